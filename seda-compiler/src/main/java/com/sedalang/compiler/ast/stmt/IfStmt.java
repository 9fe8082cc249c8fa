package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * if / else if / else 语句，整条链共用一个 end
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBlock;
    private final List<ElseIfClause> elseIfs;
    private final Block elseBlock;  // 可选

    public IfStmt(SourceLocation location, Expression condition, Block thenBlock,
                  List<ElseIfClause> elseIfs, Block elseBlock) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseIfs = Collections.unmodifiableList(new ArrayList<>(elseIfs));
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public List<ElseIfClause> getElseIfs() {
        return elseIfs;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.IF_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
