package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.type.TypeAnnotation;

/**
 * 结构体字段 name: Type
 */
public class StructField extends AstNode {
    private final String name;
    private final TypeAnnotation type;

    public StructField(SourceLocation location, String name, TypeAnnotation type) {
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

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.STRUCT_FIELD;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructField(this, context);
    }
}
