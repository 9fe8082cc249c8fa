package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.type.TypeAnnotation;

/**
 * 类型别名声明 type Name = Type
 */
public class TypeAliasDecl extends Declaration {
    private final String name;
    private final TypeAnnotation aliasedType;

    public TypeAliasDecl(SourceLocation location, String name, TypeAnnotation aliasedType) {
        super(location);
        this.name = name;
        this.aliasedType = aliasedType;
    }

    @Override
    public String getName() {
        return name;
    }

    public TypeAnnotation getAliasedType() {
        return aliasedType;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.TYPE_ALIAS_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAliasDecl(this, context);
    }
}
