package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 赋值表达式（右结合）
 */
public class AssignExpr extends Expression {
    private final Expression target;
    private final Expression value;

    public AssignExpr(SourceLocation location, Expression target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.ASSIGN_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
