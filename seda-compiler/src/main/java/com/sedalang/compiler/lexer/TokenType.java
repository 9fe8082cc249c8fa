package com.sedalang.compiler.lexer;

/**
 * Seda 词法单元类型
 *
 * <p>每个类型带有一个显示符号，错误信息中使用该符号（如 {@code expected =, got EOF}）。</p>
 */
public enum TokenType {
    // === 特殊 ===
    ILLEGAL("ILLEGAL"),
    EOF("EOF"),
    COMMENT("COMMENT"),

    // === 字面量与标识符 ===
    IDENTIFIER("IDENT"),
    NUMBER("NUMBER"),
    STRING("STRING"),

    // === 操作符 - 算术 ===
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    CARET("^"),

    // === 操作符 - 比较 ===
    EQ("=="),
    NE("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),

    // === 操作符 - 逻辑（and/or/not 与 &&/||/! 同类型） ===
    AND("AND"),
    OR("OR"),
    NOT("NOT"),

    // === 分隔符 ===
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    DOT("."),
    LPAREN("("),
    RPAREN(")"),
    LBRACKET("["),
    RBRACKET("]"),
    LBRACE("{"),
    RBRACE("}"),

    // === 特殊操作符 ===
    DOUBLE_COLON("::"),     // 块开始标记
    ARROW("=>"),            // case 分支
    TYPE_ARROW("->"),
    RANGE(".."),
    RANGE_INCLUSIVE("..."),

    // === 关键词 - 声明 ===
    KW_VAR("var"), KW_CONST("const"), KW_FN("fn"), KW_STRUCT("struct"),
    KW_TYPE("type"), KW_MODULE("module"), KW_USING("using"), KW_AS("as"),
    KW_COMPONENT("component"),

    // === 关键词 - 控制流 ===
    KW_IF("if"), KW_ELSE("else"), KW_CASE("case"), KW_FOR("for"), KW_IN("in"),
    KW_RETURN("return"), KW_BREAK("break"), KW_END("end"),

    // === 关键词 - 测试 ===
    KW_CHECK("check"), KW_WHERE("where"),
    KW_IS("is"), KW_ISA("isA"), KW_ISNOT("isNot"), KW_CONTAINS("contains"),
    KW_ISGREATER("isGreater"), KW_ISLESS("isLess"),
    KW_ISTRUE("isTrue"), KW_ISFALSE("isFalse"), KW_ISEMPTY("isEmpty"),
    KW_STARTSWITH("startsWith"), KW_ENDSWITH("endsWith"), KW_RAISES("raises"),

    // === 关键词 - 值 ===
    KW_SELF("self"), KW_TRUE("true"), KW_FALSE("false"), KW_NIL("nil"),

    // === 关键词 - 内置类型 ===
    KW_NUMBER("number"), KW_STRING("string"), KW_BOOLEAN("boolean");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** 错误信息中使用的显示符号 */
    public String getSymbol() {
        return symbol;
    }

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为断言操作符（check / where 块中使用）
     */
    public boolean isAssertionOperator() {
        switch (this) {
            case KW_IS:
            case KW_ISA:
            case KW_ISNOT:
            case KW_CONTAINS:
            case KW_ISGREATER:
            case KW_ISLESS:
            case KW_ISTRUE:
            case KW_ISFALSE:
            case KW_ISEMPTY:
            case KW_STARTSWITH:
            case KW_ENDSWITH:
            case KW_RAISES:
                return true;
            default:
                return false;
        }
    }

    /**
     * 一元断言：不需要右操作数
     */
    public boolean isUnaryAssertion() {
        return this == KW_ISTRUE || this == KW_ISFALSE || this == KW_ISEMPTY;
    }

    /**
     * 是否为内置类型关键字
     */
    public boolean isBuiltinType() {
        return this == KW_NUMBER || this == KW_STRING || this == KW_BOOLEAN;
    }
}
