package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（语法树根节点），即使解析失败也不为 null
 */
public class Program extends AstNode {
    private final List<Statement> statements;

    public Program(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.PROGRAM;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
