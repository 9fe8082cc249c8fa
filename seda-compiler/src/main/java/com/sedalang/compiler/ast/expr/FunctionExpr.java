package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.decl.Parameter;
import com.sedalang.compiler.ast.stmt.Block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 匿名函数（fn(x) :: ... end 或 (x) :: ... end）
 */
public class FunctionExpr extends Expression {
    private final List<Parameter> params;
    private final Block body;

    public FunctionExpr(SourceLocation location, List<Parameter> params, Block body) {
        super(location);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.FUNCTION_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionExpr(this, context);
    }
}
