package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;

/**
 * else if 分支
 */
public class ElseIfClause extends AstNode {
    private final Expression condition;
    private final Block block;

    public ElseIfClause(SourceLocation location, Expression condition, Block block) {
        super(location);
        this.condition = condition;
        this.block = block;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getBlock() {
        return block;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.ELSE_IF_CLAUSE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitElseIfClause(this, context);
    }
}
