package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.decl.Parameter;
import com.sedalang.compiler.ast.expr.AssignExpr;
import com.sedalang.compiler.ast.expr.BinaryExpr;
import com.sedalang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.sedalang.compiler.ast.expr.CallExpr;
import com.sedalang.compiler.ast.expr.CaseExpr;
import com.sedalang.compiler.ast.expr.CollectionLiteral;
import com.sedalang.compiler.ast.expr.CollectionLiteral.MapEntry;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.expr.FunctionExpr;
import com.sedalang.compiler.ast.expr.Identifier;
import com.sedalang.compiler.ast.expr.IndexExpr;
import com.sedalang.compiler.ast.expr.Literal;
import com.sedalang.compiler.ast.expr.MemberExpr;
import com.sedalang.compiler.ast.expr.RangeExpr;
import com.sedalang.compiler.ast.expr.UiElementExpr;
import com.sedalang.compiler.ast.expr.UnaryExpr;
import com.sedalang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.sedalang.compiler.ast.stmt.Block;
import com.sedalang.compiler.ast.stmt.CaseBranch;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.sedalang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类（Pratt）
 *
 * <p>前缀、中缀处理器按 token 类型登记在两张表中，绑定强度见 {@link Precedence}。</p>
 */
class ExprParser {

    final Parser parser;

    private final Map<TokenType, PrefixParselet> prefixParselets = new EnumMap<TokenType, PrefixParselet>(TokenType.class);
    private final Map<TokenType, InfixParselet> infixParselets = new EnumMap<TokenType, InfixParselet>(TokenType.class);

    ExprParser(Parser parser) {
        this.parser = parser;

        registerPrefix(IDENTIFIER, this::parseIdentifier);
        registerPrefix(NUMBER, this::parseNumber);
        registerPrefix(STRING, this::parseString);
        registerPrefix(KW_TRUE, this::parseBoolean);
        registerPrefix(KW_FALSE, this::parseBoolean);
        registerPrefix(KW_NIL, this::parseNil);
        registerPrefix(KW_SELF, this::parseSelf);
        registerPrefix(MINUS, this::parsePrefixOperator);
        registerPrefix(NOT, this::parsePrefixOperator);
        registerPrefix(LPAREN, this::parseGroupedOrFunction);
        registerPrefix(LBRACKET, this::parseArrayLiteral);
        registerPrefix(LBRACE, this::parseMapLiteral);
        registerPrefix(KW_FN, this::parseAnonymousFunction);
        registerPrefix(KW_CASE, this::parseCaseExpression);

        for (TokenType type : new TokenType[]{PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
                EQ, NE, LT, GT, LE, GE, AND, OR}) {
            registerInfix(type, this::parseBinary);
        }
        registerInfix(ASSIGN, this::parseAssign);
        registerInfix(RANGE, this::parseRange);
        registerInfix(RANGE_INCLUSIVE, this::parseRange);
        registerInfix(LPAREN, this::parseCall);
        registerInfix(LBRACKET, this::parseIndex);
        registerInfix(DOT, this::parseMember);
    }

    void registerPrefix(TokenType type, PrefixParselet parselet) {
        prefixParselets.put(type, parselet);
    }

    void registerInfix(TokenType type, InfixParselet parselet) {
        infixParselets.put(type, parselet);
    }

    boolean hasPrefix(TokenType type) {
        return prefixParselets.containsKey(type);
    }

    // ============ Pratt 主循环 ============

    /**
     * 以给定绑定强度解析表达式。进入时 current 是表达式的第一个 token，
     * 返回时 current 是最后一个 token。
     */
    Expression parseExpression(Precedence precedence) {
        parser.enterNesting();
        try {
            PrefixParselet prefix = prefixParselets.get(parser.current.getType());
            if (prefix == null) {
                parser.noPrefixError(parser.current);
                return null;
            }
            Expression left = prefix.parse();

            while (left != null && !parser.peekIs(EOF)
                    && Precedence.of(parser.peek().getType()).bindsTighterThan(precedence)) {
                InfixParselet infix = infixParselets.get(parser.peek().getType());
                if (infix == null) {
                    return left;
                }
                parser.advance();
                left = infix.parse(left);
            }
            return left;
        } finally {
            parser.exitNesting();
        }
    }

    /**
     * 逗号分隔的表达式列表，直到 end。进入时 current 是开括号。
     */
    List<Expression> parseExpressionList(TokenType end) {
        List<Expression> list = new ArrayList<Expression>();
        if (parser.peekIs(end)) {
            parser.advance();
            return list;
        }

        boolean saved = parser.functionLiteralAllowed;
        parser.functionLiteralAllowed = true;
        try {
            parser.advance();
            Expression expr = parseExpression(Precedence.LOWEST);
            if (expr == null) {
                return null;
            }
            list.add(expr);
            while (parser.peekIs(COMMA)) {
                parser.advance();
                parser.advance();
                expr = parseExpression(Precedence.LOWEST);
                if (expr == null) {
                    return null;
                }
                list.add(expr);
            }
        } finally {
            parser.functionLiteralAllowed = saved;
        }

        if (!parser.expectPeek(end)) {
            return null;
        }
        return list;
    }

    /**
     * 括号内的子表达式，重新允许裸函数字面量
     */
    private Expression parseDelimited() {
        boolean saved = parser.functionLiteralAllowed;
        parser.functionLiteralAllowed = true;
        try {
            return parseExpression(Precedence.LOWEST);
        } finally {
            parser.functionLiteralAllowed = saved;
        }
    }

    // ============ 前缀 ============

    private Expression parseIdentifier() {
        if (parser.componentDepth > 0 && parser.peekIs(LBRACE)) {
            return parseUiElement();
        }
        return new Identifier(parser.location(), parser.current.getLexeme());
    }

    private Expression parseNumber() {
        return Literal.ofNumber(parser.location(), parser.current.getLexeme());
    }

    private Expression parseString() {
        return parser.literalHelper.parseStringLiteral(parser.current);
    }

    private Expression parseBoolean() {
        return Literal.ofBoolean(parser.location(), parser.check(KW_TRUE));
    }

    private Expression parseNil() {
        return Literal.ofNil(parser.location());
    }

    private Expression parseSelf() {
        return new Identifier(parser.location(), parser.current.getLexeme());
    }

    private Expression parsePrefixOperator() {
        SourceLocation loc = parser.location();
        UnaryOp op = parser.check(MINUS) ? UnaryOp.NEG : UnaryOp.NOT;
        parser.advance();
        Expression operand = parseExpression(Precedence.PREFIX);
        if (operand == null) {
            return null;
        }
        return new UnaryExpr(loc, op, operand);
    }

    /**
     * ( 开头：先按参数列表形态扫描，后面紧跟 :: 时是函数字面量，否则是分组
     */
    private Expression parseGroupedOrFunction() {
        if (parser.functionLiteralAllowed && isFunctionLiteralAhead()) {
            return parseFunctionLiteral(parser.location());
        }
        parser.advance();
        Expression expr = parseDelimited();
        if (expr == null) {
            return null;
        }
        if (!parser.expectPeek(RPAREN)) {
            return null;
        }
        return expr;
    }

    /**
     * 前瞻 ( [IDENT [: Type] {, IDENT [: Type]}] ) ::，扫描后回到原位置
     */
    private boolean isFunctionLiteralAhead() {
        parser.mark();
        try {
            if (parser.peekIs(RPAREN)) {
                parser.advance();
                return parser.peekIs(DOUBLE_COLON);
            }
            while (true) {
                if (!parser.peekIs(IDENTIFIER)) {
                    return false;
                }
                parser.advance();
                if (parser.peekIs(COLON)) {
                    parser.advance();
                    if (!skipTypeAhead()) {
                        return false;
                    }
                }
                if (parser.peekIs(COMMA)) {
                    parser.advance();
                    continue;
                }
                if (parser.peekIs(RPAREN)) {
                    parser.advance();
                    return parser.peekIs(DOUBLE_COLON);
                }
                return false;
            }
        } finally {
            parser.reset();
        }
    }

    private boolean skipTypeAhead() {
        Token next = parser.peek();
        if (!next.is(IDENTIFIER) && !next.getType().isBuiltinType()) {
            return false;
        }
        parser.advance();
        if (!parser.peekIs(LBRACKET)) {
            return true;
        }
        parser.advance();
        int depth = 1;
        while (depth > 0) {
            if (parser.peekIs(EOF)) {
                return false;
            }
            parser.advance();
            if (parser.check(LBRACKET)) {
                depth++;
            } else if (parser.check(RBRACKET)) {
                depth--;
            }
        }
        return true;
    }

    /**
     * fn(params) :: body end
     */
    private Expression parseAnonymousFunction() {
        SourceLocation loc = parser.location();
        if (!parser.expectPeek(LPAREN)) {
            return null;
        }
        return parseFunctionLiteral(loc);
    }

    /**
     * 进入时 current 是参数列表的 (
     */
    private Expression parseFunctionLiteral(SourceLocation loc) {
        List<Parameter> params = parser.typeParser.parseParameters();
        if (params == null) {
            return null;
        }
        if (!parser.stmtParser.expectBlockOpen()) {
            return null;
        }
        Block body = parser.declParser.parseFunctionBody();
        if (!parser.stmtParser.expectBlockEnd()) {
            return null;
        }
        return new FunctionExpr(loc, params, body);
    }

    private Expression parseArrayLiteral() {
        SourceLocation loc = parser.location();
        List<Expression> elements = parseExpressionList(RBRACKET);
        if (elements == null) {
            return null;
        }
        return CollectionLiteral.array(loc, elements);
    }

    /**
     * {key: value, ...}
     */
    private Expression parseMapLiteral() {
        SourceLocation loc = parser.location();
        List<MapEntry> entries = new ArrayList<MapEntry>();
        while (!parser.peekIs(RBRACE)) {
            parser.advance();
            Expression key = parseDelimited();
            if (key == null) {
                return null;
            }
            if (!parser.expectPeek(COLON)) {
                return null;
            }
            parser.advance();
            Expression value = parseDelimited();
            if (value == null) {
                return null;
            }
            entries.add(new MapEntry(key, value));
            if (parser.peekIs(COMMA)) {
                parser.advance();
            } else if (!parser.peekIs(RBRACE)) {
                parser.peekError(COMMA, RBRACE);
                return null;
            }
        }
        parser.advance();
        return CollectionLiteral.map(loc, entries);
    }

    /**
     * case subject :: pattern => result ... end 作为表达式
     */
    private Expression parseCaseExpression() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression subject = parser.stmtParser.parseHeaderExpression();
        if (subject == null) {
            return null;
        }
        if (!parser.expectPeek(DOUBLE_COLON)) {
            return null;
        }
        List<CaseBranch> branches = parser.stmtParser.parseCaseBranches();
        if (branches == null) {
            return null;
        }
        return new CaseExpr(loc, subject, branches);
    }

    /**
     * Type { key: value, Child { ... } }，只在组件体内识别。
     * 属性之间的逗号可省略，重复的属性名以后出现的为准。
     */
    private UiElementExpr parseUiElement() {
        SourceLocation loc = parser.location();
        String type = parser.current.getLexeme();
        parser.enterNesting();
        try {
            parser.advance();
            parser.advance();
            Map<String, Expression> properties = new LinkedHashMap<String, Expression>();
            List<UiElementExpr> children = new ArrayList<UiElementExpr>();
            while (!parser.check(RBRACE) && !parser.check(EOF)) {
                if (parser.check(COMMA)) {
                    parser.advance();
                    continue;
                }
                if (parser.check(IDENTIFIER) && parser.peekIs(LBRACE)) {
                    UiElementExpr child = parseUiElement();
                    if (child == null) {
                        return null;
                    }
                    children.add(child);
                } else if (DeclParser.isPropertyName(parser.current) && parser.peekIs(COLON)) {
                    String key = parser.current.getLexeme();
                    parser.advance();
                    parser.advance();
                    Expression value = parseDelimited();
                    if (value == null) {
                        return null;
                    }
                    properties.put(key, value);
                } else {
                    parser.error(parser.current, "expected property or child element, got "
                            + parser.current.getType().getSymbol());
                    return null;
                }
                parser.advance();
            }
            if (parser.check(EOF)) {
                parser.currentError(RBRACE);
                return null;
            }
            return new UiElementExpr(loc, type, properties, children);
        } finally {
            parser.exitNesting();
        }
    }

    // ============ 中缀 ============

    private Expression parseBinary(Expression left) {
        SourceLocation loc = left.getLocation();
        BinaryOp op = BinaryOp.fromToken(parser.current.getType());
        Precedence precedence = Precedence.of(parser.current.getType());
        parser.advance();
        Expression right = parseExpression(precedence);
        if (right == null) {
            return null;
        }
        return new BinaryExpr(loc, left, op, right);
    }

    /**
     * 赋值右结合：右侧以最低强度解析
     */
    private Expression parseAssign(Expression left) {
        parser.advance();
        Expression value = parseExpression(Precedence.LOWEST);
        if (value == null) {
            return null;
        }
        return new AssignExpr(left.getLocation(), left, value);
    }

    private Expression parseRange(Expression left) {
        boolean inclusive = parser.check(RANGE_INCLUSIVE);
        parser.advance();
        Expression end = parseExpression(Precedence.RANGE);
        if (end == null) {
            return null;
        }
        return new RangeExpr(left.getLocation(), left, end, inclusive);
    }

    private Expression parseCall(Expression callee) {
        List<Expression> args = parseExpressionList(RPAREN);
        if (args == null) {
            return null;
        }
        return new CallExpr(callee.getLocation(), callee, args);
    }

    private Expression parseIndex(Expression target) {
        parser.advance();
        Expression index = parseDelimited();
        if (index == null) {
            return null;
        }
        if (!parser.expectPeek(RBRACKET)) {
            return null;
        }
        return new IndexExpr(target.getLocation(), target, index);
    }

    /**
     * 成员名可以是标识符或关键字（如 obj.type、obj.end）
     */
    private Expression parseMember(Expression target) {
        Token next = parser.peek();
        if (!DeclParser.isPropertyName(next)) {
            parser.error(next, "expected property name, got " + next.getType().getSymbol());
            return null;
        }
        parser.advance();
        return new MemberExpr(target.getLocation(), target, parser.current.getLexeme());
    }
}
