package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明后附带的 where 测试块，结构与 check 相同但无标签
 */
public class WhereBlock extends AstNode {
    private final List<Statement> statements;
    private final List<Assertion> assertions;

    public WhereBlock(SourceLocation location, List<Statement> statements, List<Assertion> assertions) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.assertions = Collections.unmodifiableList(new ArrayList<>(assertions));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public List<Assertion> getAssertions() {
        return assertions;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.WHERE_BLOCK;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhereBlock(this, context);
    }
}
