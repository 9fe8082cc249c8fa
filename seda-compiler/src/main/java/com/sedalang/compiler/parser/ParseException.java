package com.sedalang.compiler.parser;

import com.sedalang.compiler.lexer.Token;

/**
 * 解析内部故障（嵌套深度超限）
 *
 * <p>普通语法错误只记录不抛出；本异常仅由受保护的入口捕获，转换为一条错误记录后继续解析。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    /** 不含位置信息的原始消息 */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (token == null) {
            return super.getMessage();
        }
        return super.getMessage() + " at line " + token.getLine() + ", column " + token.getColumn()
                + " (found '" + token.getLexeme() + "')";
    }
}
