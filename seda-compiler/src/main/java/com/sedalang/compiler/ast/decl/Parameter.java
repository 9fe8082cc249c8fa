package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.type.TypeAnnotation;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeAnnotation type;  // 可选

    public Parameter(SourceLocation location, String name, TypeAnnotation type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeAnnotation getType() {
        return type;
    }

    public boolean hasType() {
        return type != null;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.PARAMETER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
