package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.UiElementExpr;
import com.sedalang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * UI 组件声明：状态语句 + 唯一的根 UI 元素
 */
public class ComponentDecl extends Declaration {
    private final String name;
    private final List<Parameter> params;
    private final List<Statement> statements;
    private final UiElementExpr root;  // 可为 null（组件体中没有 UI 元素）

    public ComponentDecl(SourceLocation location, String name, List<Parameter> params,
                         List<Statement> statements, UiElementExpr root) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.root = root;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public UiElementExpr getRoot() {
        return root;
    }

    public boolean hasRoot() {
        return root != null;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.COMPONENT_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComponentDecl(this, context);
    }
}
