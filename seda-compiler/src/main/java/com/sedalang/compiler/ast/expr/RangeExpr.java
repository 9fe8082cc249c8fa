package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 范围表达式：a..b 半开，a...b 闭区间
 */
public class RangeExpr extends Expression {
    private final Expression start;
    private final Expression end;
    private final boolean inclusive;

    public RangeExpr(SourceLocation location, Expression start, Expression end, boolean inclusive) {
        super(location);
        this.start = start;
        this.end = end;
        this.inclusive = inclusive;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getEnd() {
        return end;
    }

    public boolean isInclusive() {
        return inclusive;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.RANGE_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRangeExpr(this, context);
    }
}
