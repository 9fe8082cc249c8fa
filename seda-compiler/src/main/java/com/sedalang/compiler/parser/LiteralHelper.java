package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.expr.Literal;
import com.sedalang.compiler.ast.expr.StringInterpolation;
import com.sedalang.compiler.ast.expr.StringInterpolation.ExprPart;
import com.sedalang.compiler.ast.expr.StringInterpolation.LiteralPart;
import com.sedalang.compiler.ast.expr.StringInterpolation.StringPart;
import com.sedalang.compiler.lexer.Lexer;
import com.sedalang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 字面量解析辅助类：字符串与 #{...} 插值
 */
class LiteralHelper {
    private static final Logger LOG = Logger.getLogger(LiteralHelper.class.getName());

    static final String INTERPOLATION_SOURCE = "<interpolation>";

    final Parser parser;

    LiteralHelper(Parser parser) {
        this.parser = parser;
    }

    /**
     * 字符串 token 转为 Literal 或 StringInterpolation。
     * 花括号不配对时整个字符串按普通文本处理。
     */
    Expression parseStringLiteral(Token token) {
        SourceLocation loc = parser.location(token);
        String value = token.getLiteral();
        if (!value.contains("#{")) {
            return Literal.ofString(loc, value);
        }

        List<StringPart> parts = new ArrayList<StringPart>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c != '#' || i + 1 >= value.length() || value.charAt(i + 1) != '{') {
                text.append(c);
                i++;
                continue;
            }

            int start = i + 2;
            int end = findClosingBrace(value, start);
            if (end < 0) {
                LOG.fine("插值花括号未闭合，按普通字符串处理: " + value);
                return Literal.ofString(loc, value);
            }
            if (text.length() > 0) {
                parts.add(new LiteralPart(loc, text.toString()));
                text.setLength(0);
            }
            Expression expr = parseEmbedded(value.substring(start, end), token);
            if (expr != null) {
                parts.add(new ExprPart(loc, expr));
            }
            i = end + 1;
        }
        if (text.length() > 0) {
            parts.add(new LiteralPart(loc, text.toString()));
        }

        if (parts.isEmpty()) {
            return Literal.ofString(loc, "");
        }
        if (parts.size() == 1 && parts.get(0) instanceof LiteralPart) {
            return Literal.ofString(loc, ((LiteralPart) parts.get(0)).getValue());
        }
        return new StringInterpolation(loc, parts);
    }

    /**
     * 从 start 开始按花括号深度查找配对的 }，找不到返回 -1
     */
    private static int findClosingBrace(String value, int start) {
        int depth = 1;
        for (int i = start; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * 用独立的子解析器解析插值片段，子解析器的错误合并到字符串 token 的位置
     */
    private Expression parseEmbedded(String source, Token token) {
        Lexer subLexer = new Lexer(source, INTERPOLATION_SOURCE);
        Parser subParser = new Parser(subLexer, INTERPOLATION_SOURCE, parser.config);
        Expression expr = subParser.parseStandaloneExpression();
        if (parser.config.isReportInterpolationErrors()) {
            for (ParseError error : subParser.getParseErrors()) {
                parser.addError(new ParseError("in interpolation: " + error.getDetail(),
                        token.getLine(), token.getColumn()));
            }
        }
        return expr;
    }
}
