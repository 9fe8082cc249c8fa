package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.expr.Identifier;

/**
 * case 分支：pattern => result
 */
public class CaseBranch extends AstNode {
    private final Expression pattern;
    private final Expression result;

    public CaseBranch(SourceLocation location, Expression pattern, Expression result) {
        super(location);
        this.pattern = pattern;
        this.result = result;
    }

    public Expression getPattern() {
        return pattern;
    }

    public Expression getResult() {
        return result;
    }

    /** 模式为 _ 时为兜底分支 */
    public boolean isWildcard() {
        return pattern instanceof Identifier && ((Identifier) pattern).isWildcard();
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.CASE_BRANCH;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseBranch(this, context);
    }
}
