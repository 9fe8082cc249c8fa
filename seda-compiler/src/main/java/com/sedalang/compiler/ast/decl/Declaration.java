package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.stmt.Statement;

/**
 * 声明基类（声明也是语句，可以出现在任意块中）
 */
public abstract class Declaration extends Statement {

    protected Declaration(SourceLocation location) {
        super(location);
    }

    /** 声明的名称，using 声明返回别名或路径 */
    public abstract String getName();
}
