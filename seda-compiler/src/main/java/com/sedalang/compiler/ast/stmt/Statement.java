package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
