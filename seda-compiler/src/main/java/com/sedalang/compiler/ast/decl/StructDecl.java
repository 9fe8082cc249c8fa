package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Declaration {
    private final String name;
    private final List<StructField> fields;

    public StructDecl(SourceLocation location, String name, List<StructField> fields) {
        super(location);
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<StructField> getFields() {
        return fields;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.STRUCT_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
