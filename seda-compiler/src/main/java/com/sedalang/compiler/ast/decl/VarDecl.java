package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.type.TypeAnnotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 变量/常量声明（var a, b: T = expr）
 */
public class VarDecl extends Declaration {
    private final List<String> names;
    private final TypeAnnotation type;  // 可选
    private final Expression value;
    private final boolean constant;

    public VarDecl(SourceLocation location, List<String> names, TypeAnnotation type,
                   Expression value, boolean constant) {
        super(location);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("variable declaration requires at least one name");
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.type = type;
        this.value = value;
        this.constant = constant;
    }

    @Override
    public String getName() {
        return names.get(0);
    }

    public List<String> getNames() {
        return names;
    }

    /** 多变量解构赋值（var a, b = f()） */
    public boolean isDestructuring() {
        return names.size() > 1;
    }

    public TypeAnnotation getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isConstant() {
        return constant;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.VAR_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
