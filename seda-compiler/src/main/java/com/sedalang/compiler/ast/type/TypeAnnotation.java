package com.sedalang.compiler.ast.type;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 类型注解（如 number、Person、Array[String]、Map[String, Array[Number]]）
 */
public class TypeAnnotation extends AstNode {
    private final String name;
    private final List<TypeAnnotation> parameters;

    public TypeAnnotation(SourceLocation location, String name) {
        this(location, name, Collections.<TypeAnnotation>emptyList());
    }

    public TypeAnnotation(SourceLocation location, String name, List<TypeAnnotation> parameters) {
        super(location);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String getName() {
        return name;
    }

    /** 泛型参数，简单类型为空 */
    public List<TypeAnnotation> getParameters() {
        return parameters;
    }

    public boolean isGeneric() {
        return !parameters.isEmpty();
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.TYPE_ANNOTATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAnnotation(this, context);
    }
}
