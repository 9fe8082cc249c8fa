package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.ast.expr.*;
import com.sedalang.compiler.ast.expr.StringInterpolation.ExprPart;
import com.sedalang.compiler.ast.expr.StringInterpolation.LiteralPart;
import com.sedalang.compiler.ast.stmt.ExpressionStmt;
import com.sedalang.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式解析测试
 */
class ExprParserTest {

    private Parser lastParser;

    private Expression expr(String source) {
        return expr(source, new ParserConfig());
    }

    private Expression expr(String source, ParserConfig config) {
        lastParser = new Parser(new Lexer(source, "<test>"), "<test>", config);
        Program program = lastParser.parseProgram();
        assertEquals(1, program.getStatements().size(), "statements of: " + source);
        return ((ExpressionStmt) program.getStatements().get(0)).getExpression();
    }

    private List<String> errorsOf(String source) {
        Parser parser = new Parser(new Lexer(source, "<test>"), "<test>");
        parser.parseProgram();
        return parser.errors();
    }

    @Nested
    @DisplayName("运算符优先级")
    class PrecedenceTests {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiterString = " | ", value = {
                "-a * b                     | ((-a) * b)",
                "!-a                        | (!(-a))",
                "a + b + c                  | ((a + b) + c)",
                "a - b - c                  | ((a - b) - c)",
                "a * b / c                  | ((a * b) / c)",
                "a + b * c + d / e - f      | (((a + (b * c)) + (d / e)) - f)",
                "5 > 4 == 3 < 4             | ((5 > 4) == (3 < 4))",
                "3 + 4 * 5 == 3 * 1 + 4 * 5 | ((3 + (4 * 5)) == ((3 * 1) + (4 * 5)))",
                "(5 + 5) * 2                | ((5 + 5) * 2)",
                "-(5 + 5)                   | (-(5 + 5))",
                "2 ^ 3 * 4                  | ((2 ^ 3) * 4)",
                "a or b and c               | (a || (b && c))",
                "a && b || c                | ((a && b) || c)",
                "not a == b                 | ((!a) == b)",
                "a % 2 != 0                 | ((a % 2) != 0)",
                "a + add(b * c) + d         | ((a + add((b * c))) + d)",
                "add(a, b, 1, 2 * 3, 4 + 5) | add(a, b, 1, (2 * 3), (4 + 5))",
                "a * [1, 2, 3][b * c] * d   | ((a * [1, 2, 3][(b * c)]) * d)",
                "obj.items[0].name          | obj.items[0].name",
                "0..n + 1                   | 0..(n + 1)",
                "f(x)(y)                    | f(x)(y)"
        })
        void testPrecedence(String source, String expected) {
            assertEquals(expected, expr(source).toString());
            assertFalse(lastParser.hasErrors());
        }

        @Test
        @DisplayName("赋值右结合")
        void testAssignRightAssociative() {
            AssignExpr assign = (AssignExpr) expr("x = y = 5");
            assertTrue(assign.getTarget() instanceof Identifier);
            AssignExpr inner = (AssignExpr) assign.getValue();
            assertEquals("y", ((Identifier) inner.getTarget()).getName());
        }

        @Test
        @DisplayName("赋值优先级最低")
        void testAssignLowest() {
            AssignExpr assign = (AssignExpr) expr("total = a + b * c");
            assertEquals("(a + (b * c))", assign.getValue().toString());
        }
    }

    @Nested
    @DisplayName("字面量与集合")
    class LiteralTests {

        @Test
        @DisplayName("布尔与 nil")
        void testKeywordsLiterals() {
            assertEquals(Boolean.TRUE, ((Literal) expr("true")).getValue());
            assertEquals(Literal.LiteralKind.NIL, ((Literal) expr("nil")).getKind());
        }

        @Test
        @DisplayName("数组")
        void testArray() {
            CollectionLiteral array = (CollectionLiteral) expr("[1, 2 * 2, 3 + 3]");
            assertEquals(CollectionLiteral.CollectionKind.ARRAY, array.getKind());
            assertEquals(3, array.getElements().size());
            assertEquals(0, ((CollectionLiteral) expr("[]")).getElements().size());
        }

        @Test
        @DisplayName("映射")
        void testMap() {
            CollectionLiteral map = (CollectionLiteral) expr("{\"one\": 1, \"two\": 2}");
            assertEquals(CollectionLiteral.CollectionKind.MAP, map.getKind());
            assertEquals(2, map.getMapEntries().size());
            assertEquals("\"two\"", map.getMapEntries().get(1).getKey().toString());
            assertTrue(((CollectionLiteral) expr("{}")).getMapEntries().isEmpty());
        }

        @Test
        @DisplayName("包含区间")
        void testInclusiveRange() {
            RangeExpr range = (RangeExpr) expr("1...10");
            assertTrue(range.isInclusive());
            assertFalse(((RangeExpr) expr("1..10")).isInclusive());
        }

        @Test
        @DisplayName("关键字作成员名")
        void testKeywordMember() {
            MemberExpr member = (MemberExpr) expr("node.type");
            assertEquals("type", member.getMember());
        }
    }

    @Nested
    @DisplayName("字符串插值")
    class InterpolationTests {

        @Test
        @DisplayName("文本与表达式两个片段")
        void testTwoParts() {
            StringInterpolation interp = (StringInterpolation) expr("\"Count: #{count}\"");
            assertEquals(2, interp.getParts().size());
            assertEquals("Count: ", ((LiteralPart) interp.getParts().get(0)).getValue());
            Expression inner = ((ExprPart) interp.getParts().get(1)).getExpression();
            assertEquals("count", ((Identifier) inner).getName());
        }

        @Test
        @DisplayName("普通字符串保持字面量")
        void testPlainString() {
            Literal literal = (Literal) expr("\"hello\"");
            assertEquals("hello", literal.getValue());
        }

        @Test
        @DisplayName("嵌套花括号")
        void testNestedBraces() {
            StringInterpolation interp = (StringInterpolation) expr("\"v=#{{\\\"a\\\": 1}[\\\"a\\\"]}\"");
            Expression inner = ((ExprPart) interp.getParts().get(1)).getExpression();
            assertTrue(inner instanceof IndexExpr);
        }

        @Test
        @DisplayName("花括号不配对时按普通文本")
        void testUnbalanced() {
            Literal literal = (Literal) expr("\"#{oops\"");
            assertEquals("#{oops", literal.getValue());
            assertFalse(lastParser.hasErrors());
        }

        @Test
        @DisplayName("插值中的错误合并到外层，位置在字符串处")
        void testErrorMerged() {
            assertEquals(List.of("line 1, column 5: in interpolation: no prefix parse function for ) found"),
                    errorsOf("x = \"#{)}\""));
            assertEquals(List.of("line 1, column 1: in interpolation: expected EOF, got IDENT"),
                    errorsOf("\"#{a b}\""));
        }

        @Test
        @DisplayName("可关闭插值错误报告")
        void testErrorSuppressed() {
            ParserConfig config = new ParserConfig();
            config.setReportInterpolationErrors(false);
            expr("\"#{)}\"", config);
            assertFalse(lastParser.hasErrors());
        }
    }

    @Nested
    @DisplayName("表达式错误")
    class ExpressionErrorTests {

        @Test
        @DisplayName("缺少操作数")
        void testMissingOperand() {
            assertEquals(List.of("line 1, column 4: no prefix parse function for EOF found"), errorsOf("1 +"));
        }

        @Test
        @DisplayName("非法成员名")
        void testBadMember() {
            assertEquals(List.of("line 1, column 5: expected property name, got NUMBER"), errorsOf("obj.5"));
        }

        @Test
        @DisplayName("未闭合的括号")
        void testUnclosedParen() {
            assertEquals(List.of("line 1, column 7: expected ), got EOF"), errorsOf("(1 + 2"));
        }

        @Test
        @DisplayName("未闭合的映射字面量")
        void testUnclosedMap() {
            assertEquals(List.of("line 1, column 16: expected , or }, got EOF"), errorsOf("var m = {\"a\": 1"));
            assertEquals(List.of("line 1, column 9: expected , or }, got STRING"), errorsOf("{\"a\": 1 \"b\": 2}"));
        }

        @Test
        @DisplayName("分组中不允许逗号")
        void testCommaInGroup() {
            assertEquals(List.of("line 1, column 3: expected ), got ,"), errorsOf("(a, b)"));
        }

        @Test
        @DisplayName("非法字符")
        void testIllegalToken() {
            assertEquals(List.of("line 1, column 9: no prefix parse function for ILLEGAL found"),
                    errorsOf("var x = @"));
        }
    }
}
