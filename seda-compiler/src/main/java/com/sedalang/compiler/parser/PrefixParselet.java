package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.expr.Expression;

/**
 * 前缀位置处理器：当前 token 开始一个表达式
 */
@FunctionalInterface
interface PrefixParselet {
    /** 失败时记录错误并返回 null */
    Expression parse();
}
