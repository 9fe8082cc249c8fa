package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
