package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;

/**
 * for 循环：for v in xs 或 for i, v in xs
 */
public class ForStmt extends Statement {
    private final String indexName;  // 可选
    private final String variable;
    private final Expression iterable;
    private final Block body;

    public ForStmt(SourceLocation location, String indexName, String variable,
                   Expression iterable, Block body) {
        super(location);
        this.indexName = indexName;
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getIndexName() {
        return indexName;
    }

    public boolean hasIndex() {
        return indexName != null;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.FOR_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
