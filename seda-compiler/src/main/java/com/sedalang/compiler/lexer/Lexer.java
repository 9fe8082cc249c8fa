package com.sedalang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Seda 词法分析器
 *
 * <p>注释作为 {@link TokenType#COMMENT} 输出，由语法分析器过滤。
 * 无法识别的字符与未闭合的字符串产生 {@link TokenType#ILLEGAL}，不在此处报错。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起始位置
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("var", TokenType.KW_VAR);
        map.put("const", TokenType.KW_CONST);
        map.put("fn", TokenType.KW_FN);
        map.put("struct", TokenType.KW_STRUCT);
        map.put("type", TokenType.KW_TYPE);
        map.put("module", TokenType.KW_MODULE);
        map.put("using", TokenType.KW_USING);
        map.put("as", TokenType.KW_AS);
        map.put("component", TokenType.KW_COMPONENT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("case", TokenType.KW_CASE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("end", TokenType.KW_END);

        // 测试与断言
        map.put("check", TokenType.KW_CHECK);
        map.put("where", TokenType.KW_WHERE);
        map.put("is", TokenType.KW_IS);
        map.put("isA", TokenType.KW_ISA);
        map.put("isNot", TokenType.KW_ISNOT);
        map.put("contains", TokenType.KW_CONTAINS);
        map.put("isGreater", TokenType.KW_ISGREATER);
        map.put("isLess", TokenType.KW_ISLESS);
        map.put("isTrue", TokenType.KW_ISTRUE);
        map.put("isFalse", TokenType.KW_ISFALSE);
        map.put("isEmpty", TokenType.KW_ISEMPTY);
        map.put("startsWith", TokenType.KW_STARTSWITH);
        map.put("endsWith", TokenType.KW_ENDSWITH);
        map.put("raises", TokenType.KW_RAISES);

        // 值
        map.put("self", TokenType.KW_SELF);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("nil", TokenType.KW_NIL);

        // 内置类型
        map.put("number", TokenType.KW_NUMBER);
        map.put("string", TokenType.KW_STRING);
        map.put("boolean", TokenType.KW_BOOLEAN);

        // 逻辑运算的单词形式
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有保留字集合（关键词及 and/or/not） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    /** 查找单词对应的 token 类型，非关键词返回 IDENTIFIER */
    public static TokenType lookupIdent(String text) {
        TokenType type = KEYWORDS.get(text);
        return type != null ? type : TokenType.IDENTIFIER;
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口），到达末尾后持续返回 EOF
     *
     * @return 下一个 Token
     */
    public Token nextToken() {
        skipWhitespace();

        start = current;
        startLine = line;
        startColumn = column;

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", null, line, column, current);
        }
        return scanToken();
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = nextToken();
            tokens.add(token);
            if (token.is(TokenType.EOF)) {
                return tokens;
            }
        }
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case '[': return makeToken(TokenType.LBRACKET);
            case ']': return makeToken(TokenType.RBRACKET);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '+': return makeToken(TokenType.PLUS);
            case '*': return makeToken(TokenType.STAR);
            case '/': return makeToken(TokenType.SLASH);
            case '%': return makeToken(TokenType.PERCENT);
            case '^': return makeToken(TokenType.CARET);

            // 可能是多字符的 Token
            case '.':
                if (match('.')) {
                    return makeToken(match('.') ? TokenType.RANGE_INCLUSIVE : TokenType.RANGE);
                }
                return makeToken(TokenType.DOT);

            case ':':
                return makeToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);

            case '-':
                return makeToken(match('>') ? TokenType.TYPE_ARROW : TokenType.MINUS);

            case '=':
                if (match('=')) return makeToken(TokenType.EQ);
                if (match('>')) return makeToken(TokenType.ARROW);
                return makeToken(TokenType.ASSIGN);

            case '!':
                return makeToken(match('=') ? TokenType.NE : TokenType.NOT);

            case '<':
                return makeToken(match('=') ? TokenType.LE : TokenType.LT);

            case '>':
                return makeToken(match('=') ? TokenType.GE : TokenType.GT);

            case '&':
                return makeToken(match('&') ? TokenType.AND : TokenType.ILLEGAL);

            case '|':
                return makeToken(match('|') ? TokenType.OR : TokenType.ILLEGAL);

            // 注释
            case '#':
                if (match('|')) {
                    return blockComment();
                }
                while (peek() != '\n' && !isAtEnd()) advance();
                return makeToken(TokenType.COMMENT);

            // 字符串
            case '"':
                return string();

            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                return makeToken(TokenType.ILLEGAL);
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               c > 127 && Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, String literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, start);
    }

    // === 复杂 Token 扫描 ===

    private Token string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                value.append(escape(advance()));
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            // 未闭合的字符串
            return makeToken(TokenType.ILLEGAL, value.toString());
        }

        advance(); // 闭合的 "
        return makeToken(TokenType.STRING, value.toString());
    }

    private String escape(char c) {
        switch (c) {
            case 'n':  return "\n";
            case 't':  return "\t";
            case 'r':  return "\r";
            case '\\': return "\\";
            case '"':  return "\"";
            case '0':  return "\0";
            default:
                // 未知转义保留原样
                return "\\" + c;
        }
    }

    private Token number() {
        while (isDigit(peek())) advance();

        // 小数部分（排除范围操作符 .. 与 ...）
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        return makeToken(TokenType.NUMBER);
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        return makeToken(lookupIdent(text));
    }

    /**
     * 多行注释 #| ... |#，支持嵌套；未闭合时吞掉剩余全部输入
     */
    private Token blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '#' && peekNext() == '|') {
                advance();
                advance();
                depth++;
            } else if (peek() == '|' && peekNext() == '#') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        return makeToken(TokenType.COMMENT);
    }
}
