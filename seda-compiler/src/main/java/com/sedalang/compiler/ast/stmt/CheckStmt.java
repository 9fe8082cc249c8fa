package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * check 测试块：准备语句 + 断言 + 可选标签
 */
public class CheckStmt extends Statement {
    private final String label;  // 可选
    private final List<Statement> statements;
    private final List<Assertion> assertions;

    public CheckStmt(SourceLocation location, String label,
                     List<Statement> statements, List<Assertion> assertions) {
        super(location);
        this.label = label;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.assertions = Collections.unmodifiableList(new ArrayList<>(assertions));
    }

    public String getLabel() {
        return label;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public List<Assertion> getAssertions() {
        return assertions;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.CHECK_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCheckStmt(this, context);
    }
}
