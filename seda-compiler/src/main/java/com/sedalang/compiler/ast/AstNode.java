package com.sedalang.compiler.ast;

import com.sedalang.compiler.printer.SourcePrinter;

/**
 * AST 节点基类
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 节点种类标签 */
    public abstract NodeKind getNodeKind();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 规范源码形式
     */
    @Override
    public String toString() {
        return SourcePrinter.print(this);
    }
}
