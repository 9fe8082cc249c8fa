package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.stmt.Block;
import com.sedalang.compiler.ast.stmt.WhereBlock;
import com.sedalang.compiler.ast.type.TypeAnnotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明（fn [Recv.]name(params)[: T] :: body [where :: ...] end）
 */
public class FnDecl extends Declaration {
    private final TypeAnnotation receiver;   // 方法声明的接收者类型，可选
    private final String name;
    private final List<Parameter> params;
    private final TypeAnnotation returnType; // 可选
    private final Block body;
    private final WhereBlock whereBlock;     // 可选

    public FnDecl(SourceLocation location, TypeAnnotation receiver, String name,
                  List<Parameter> params, TypeAnnotation returnType,
                  Block body, WhereBlock whereBlock) {
        super(location);
        this.receiver = receiver;
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.returnType = returnType;
        this.body = body;
        this.whereBlock = whereBlock;
    }

    public TypeAnnotation getReceiver() {
        return receiver;
    }

    public boolean isMethod() {
        return receiver != null;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeAnnotation getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public WhereBlock getWhereBlock() {
        return whereBlock;
    }

    public boolean hasWhereBlock() {
        return whereBlock != null;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.FN_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFnDecl(this, context);
    }
}
