package com.sedalang.compiler.parser;

import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.lexer.TokenType;

import java.util.Collections;
import java.util.List;

/**
 * 解析过程中记录的语法错误
 *
 * <p>格式化形式：{@code line L, column C: message}，
 * 期望不匹配时为 {@code line L, column C: expected A, B or C, got X}。</p>
 */
public final class ParseError {
    private final String message;
    private final Token token;
    private final int line;
    private final int column;
    private final List<TokenType> expected;
    private final TokenType actual;

    /**
     * 一般错误，位置取自 token
     */
    public ParseError(String message, Token token) {
        this(message, token, token != null ? token.getLine() : 0, token != null ? token.getColumn() : 0,
                Collections.<TokenType>emptyList());
    }

    /**
     * 期望不匹配：在 token 处期望 expected 中之一
     */
    public ParseError(Token token, List<TokenType> expected) {
        this("unexpected token", token, token.getLine(), token.getColumn(), expected);
    }

    /**
     * 只有位置、没有 token 的错误（如插值子解析合并进来的错误）
     */
    public ParseError(String message, int line, int column) {
        this(message, null, line, column, Collections.<TokenType>emptyList());
    }

    private ParseError(String message, Token token, int line, int column, List<TokenType> expected) {
        this.message = message;
        this.token = token;
        this.line = line;
        this.column = column;
        this.expected = Collections.unmodifiableList(expected);
        this.actual = token != null ? token.getType() : null;
    }

    public String getMessage() {
        return message;
    }

    public Token getToken() {
        return token;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public List<TokenType> getExpected() {
        return expected;
    }

    public TokenType getActual() {
        return actual;
    }

    public boolean isExpectationError() {
        return !expected.isEmpty();
    }

    /**
     * 不含位置的错误描述
     */
    public String getDetail() {
        if (expected.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder("expected ");
        for (int i = 0; i < expected.size(); i++) {
            if (i > 0) {
                sb.append(i == expected.size() - 1 ? " or " : ", ");
            }
            sb.append(expected.get(i).getSymbol());
        }
        sb.append(", got ").append(actual != null ? actual.getSymbol() : "nothing");
        return sb.toString();
    }

    /**
     * 完整错误信息
     */
    public String format() {
        return "line " + line + ", column " + column + ": " + getDetail();
    }

    @Override
    public String toString() {
        return format();
    }
}
