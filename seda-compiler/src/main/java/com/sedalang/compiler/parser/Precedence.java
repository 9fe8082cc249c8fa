package com.sedalang.compiler.parser;

import com.sedalang.compiler.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 运算符优先级（绑定强度），从低到高
 */
enum Precedence {
    LOWEST,
    ASSIGNMENT,   // =
    OR,           // or ||
    AND,          // and &&
    EQUALS,       // == !=
    LESSGREATER,  // < > <= >=
    RANGE,        // .. ...
    SUM,          // + -
    PRODUCT,      // * / %
    POWER,        // ^
    PREFIX,       // -x !x
    CALL,         // f(x)
    INDEX,        // a[i]
    DOT;          // obj.member

    private static final Map<TokenType, Precedence> TABLE;

    static {
        Map<TokenType, Precedence> map = new EnumMap<>(TokenType.class);
        map.put(TokenType.ASSIGN, ASSIGNMENT);
        map.put(TokenType.OR, OR);
        map.put(TokenType.AND, AND);
        map.put(TokenType.EQ, EQUALS);
        map.put(TokenType.NE, EQUALS);
        map.put(TokenType.LT, LESSGREATER);
        map.put(TokenType.GT, LESSGREATER);
        map.put(TokenType.LE, LESSGREATER);
        map.put(TokenType.GE, LESSGREATER);
        map.put(TokenType.RANGE, RANGE);
        map.put(TokenType.RANGE_INCLUSIVE, RANGE);
        map.put(TokenType.PLUS, SUM);
        map.put(TokenType.MINUS, SUM);
        map.put(TokenType.STAR, PRODUCT);
        map.put(TokenType.SLASH, PRODUCT);
        map.put(TokenType.PERCENT, PRODUCT);
        map.put(TokenType.CARET, POWER);
        map.put(TokenType.LPAREN, CALL);
        map.put(TokenType.LBRACKET, INDEX);
        map.put(TokenType.DOT, DOT);
        TABLE = Collections.unmodifiableMap(map);
    }

    /**
     * token 作为中缀时的优先级，不参与绑定的 token 为 LOWEST
     */
    static Precedence of(TokenType type) {
        Precedence p = TABLE.get(type);
        return p != null ? p : LOWEST;
    }

    boolean bindsTighterThan(Precedence other) {
        return ordinal() > other.ordinal();
    }
}
