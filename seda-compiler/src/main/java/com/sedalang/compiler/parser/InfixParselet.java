package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.expr.Expression;

/**
 * 中缀位置处理器：当前 token 延续已解析的左操作数
 */
@FunctionalInterface
interface InfixParselet {
    /** 失败时记录错误并返回 null */
    Expression parse(Expression left);
}
