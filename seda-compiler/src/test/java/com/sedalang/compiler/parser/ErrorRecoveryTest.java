package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.decl.FnDecl;
import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.ast.decl.VarDecl;
import com.sedalang.compiler.ast.stmt.CheckStmt;
import com.sedalang.compiler.lexer.Lexer;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.lexer.TokenType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 错误报告与恢复测试
 */
class ErrorRecoveryTest {

    private Parser parser(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>");
    }

    private Parser parser(String source, ParserConfig config) {
        return new Parser(new Lexer(source, "<test>"), "<test>", config);
    }

    private static String repeat(String s, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(s);
        }
        return sb.toString();
    }

    @Nested
    @DisplayName("错误格式")
    class ErrorFormatTests {

        @Test
        @DisplayName("var x 只有一个期望 = 的错误，程序非 null")
        void testMissingAssign() {
            Parser parser = parser("var x");
            Program program = parser.parseProgram();
            assertNotNull(program);
            assertEquals(List.of("line 1, column 6: expected =, got EOF"), parser.errors());

            ParseError error = parser.getParseErrors().get(0);
            assertTrue(error.isExpectationError());
            assertEquals(List.of(TokenType.ASSIGN), error.getExpected());
            assertEquals(TokenType.EOF, error.getActual());
        }

        @Test
        @DisplayName("多个期望用逗号和 or 连接")
        void testMultipleExpected() {
            Parser parser = parser("");
            parser.peekError(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING);
            assertEquals(List.of("line 1, column 1: expected IDENT, NUMBER or STRING, got EOF"), parser.errors());
        }

        @Test
        @DisplayName("保留字作名称")
        void testReservedWord() {
            Parser parser = parser("var end = 1");
            parser.parseProgram();
            assertEquals("line 1, column 5: 'end' is a reserved word (in variable declaration)",
                    parser.errors().get(0));
        }

        @Test
        @DisplayName("validateIdentifier")
        void testValidateIdentifier() {
            Parser parser = parser("");
            assertTrue(parser.validateIdentifier("count", "test"));
            assertFalse(parser.validateIdentifier("for", "test"));
            assertFalse(parser.validateIdentifier("9lives", "test"));
            assertEquals(List.of(
                    "line 1, column 1: 'for' is a reserved word (in test)",
                    "line 1, column 1: invalid identifier (in test)"), parser.errors());
        }

        @Test
        @DisplayName("formatErrors 带序号")
        void testFormatErrors() {
            Parser parser = parser("var x");
            parser.parseProgram();
            assertEquals(List.of("  1. line 1, column 6: expected =, got EOF"), parser.formatErrors());
        }

        @Test
        @DisplayName("参数列表尾随逗号")
        void testTrailingCommaInParams() {
            Parser parser = parser("fn add(x,) :: x end");
            parser.parseProgram();
            assertEquals("line 1, column 10: expected IDENT, got )", parser.errors().get(0));
        }

        @Test
        @DisplayName("parse() 打包结果")
        void testParseResult() {
            ParseResult result = parser("var a = 1\nvar b").parse();
            assertTrue(result.hasErrors());
            assertEquals(1, result.getProgram().getStatements().size());
            assertEquals(List.of("line 2, column 6: expected =, got EOF"), result.getErrorMessages());
        }
    }

    @Nested
    @DisplayName("块结束")
    class BlockTerminationTests {

        @Test
        @Timeout(5)
        @DisplayName("缺少 end 报告 EOF 错误而不是挂起")
        void testMissingEnd() {
            Parser parser = parser("fn f() :: return 1");
            Program program = parser.parseProgram();
            assertNotNull(program);
            assertEquals(List.of("line 1, column 19: expected end, got EOF"), parser.errors());
        }

        @Test
        @Timeout(5)
        @DisplayName("嵌套块缺少 end 只报告一次")
        void testNestedMissingEnd() {
            Parser parser = parser("fn f() ::\n    if x ::\n        1\n    end\n");
            parser.parseProgram();
            assertEquals(1, parser.errors().size());
            assertTrue(parser.errors().get(0).endsWith("expected end, got EOF"));
        }

        @ParameterizedTest
        @Timeout(5)
        @ValueSource(strings = {
                "struct P :: name: number",
                "module m :: var x = 1",
                "component C() :: Label { text: \"a\" }",
                "check :: 1 is 1",
                "fn f() :: 1 where :: f() is 1",
                "case x :: 1 => 2",
                "for x in xs :: x",
                "var g = fn() :: 1",
                "if a :: 1 else :: 2"
        })
        @DisplayName("各类块缺少 end 时报告 EOF 错误")
        void testMissingEndInEveryBlock(String source) {
            Parser parser = parser(source);
            assertNotNull(parser.parseProgram());
            assertTrue(parser.errors().stream().anyMatch(e -> e.endsWith("expected end, got EOF")),
                    () -> source + " -> " + parser.errors());
        }

        @Test
        @DisplayName("for 块不接受 else")
        void testElseInFor() {
            Parser parser = parser("for x in xs :: 1 else :: 2 end");
            parser.parseProgram();
            assertEquals("line 1, column 18: expected end, got else", parser.errors().get(0));
        }

        @Test
        @DisplayName("顶层多余的 end 不产生节点也不报错")
        void testStrayEnd() {
            Parser parser = parser("end\nvar x = 1");
            Program program = parser.parseProgram();
            assertFalse(parser.hasErrors());
            assertEquals(1, program.getStatements().size());
        }
    }

    @Nested
    @DisplayName("恢复")
    class RecoveryTests {

        @Test
        @DisplayName("出错后在下一条语句处继续")
        void testContinueAfterError() {
            Parser parser = parser("var = 1\nvar y = 2");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 1, column 5: expected IDENT, got ="), parser.errors());
            assertEquals(1, program.getStatements().size());
            assertEquals("y", ((VarDecl) program.getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("不跳过紧随其后的语句")
        void testNextStatementKept() {
            Parser parser = parser("var x var y = 2");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 1, column 7: expected =, got var"), parser.errors());
            assertEquals(1, program.getStatements().size());
        }

        @Test
        @DisplayName("字段出错时跳过整个 struct")
        void testStructFieldError() {
            Parser parser = parser("struct P ::\n    name string\n    type: number\nend\nvar ok = 1");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 2, column 10: expected :, got string"), parser.errors());
            assertEquals(1, program.getStatements().size());
            assertEquals("ok", ((VarDecl) program.getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("行尾不完整的表达式不吞掉下一条语句")
        void testTruncatedExpressionKeepsNextStatement() {
            Parser parser = parser("var x =\nvar y = 2");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 2, column 1: no prefix parse function for var found"), parser.errors());
            assertEquals(1, program.getStatements().size());
            assertEquals("y", ((VarDecl) program.getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("二元运算缺右操作数时保留后面的函数声明")
        void testTruncatedBinaryKeepsFunction() {
            Parser parser = parser("var x = 1 +\nfn g() :: 1 end");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 2, column 4: expected (, got IDENT"), parser.errors());
            assertEquals(1, program.getStatements().size());
            assertEquals("g", ((FnDecl) program.getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("块内一处错误只报告一次")
        void testSingleErrorInBlock() {
            Parser parser = parser("fn f() :: var = 1\nvar y = 2 end");
            FnDecl fn = (FnDecl) parser.parseProgram().getStatements().get(0);
            assertEquals(List.of("line 1, column 15: expected IDENT, got ="), parser.errors());
            assertEquals(1, fn.getBody().getStatements().size());
            assertEquals("y", ((VarDecl) fn.getBody().getStatements().get(0)).getName());
        }

        @Test
        @DisplayName("块内不完整的表达式不吞掉下一条语句")
        void testTruncatedExpressionInBlock() {
            Parser parser = parser("fn f() ::\n    var x =\n    var y = 2\nend");
            FnDecl fn = (FnDecl) parser.parseProgram().getStatements().get(0);
            assertEquals(List.of("line 3, column 5: no prefix parse function for var found"), parser.errors());
            assertEquals(1, fn.getBody().getStatements().size());
        }

        @Test
        @DisplayName("check 块内出错后继续解析断言")
        void testRecoveryInCheckBody() {
            Parser parser = parser("check ::\n    var = 1\n    var y = 2\n    y is 2\nend");
            CheckStmt check = (CheckStmt) parser.parseProgram().getStatements().get(0);
            assertEquals(List.of("line 2, column 9: expected IDENT, got ="), parser.errors());
            assertEquals(1, check.getStatements().size());
            assertEquals(1, check.getAssertions().size());
        }

        @Test
        @DisplayName("严格块与容错块对同一错误的结果一致")
        void testTolerantBlocks() {
            String source = "fn f() ::\n    var = 1\n    var y = 2\nend";

            Parser strict = parser(source);
            FnDecl strictFn = (FnDecl) strict.parseProgram().getStatements().get(0);
            assertEquals(1, strict.errors().size());
            assertEquals(1, strictFn.getBody().getStatements().size());

            ParserConfig config = new ParserConfig();
            config.setTolerantBlocks(true);
            Parser tolerant = parser(source, config);
            FnDecl tolerantFn = (FnDecl) tolerant.parseProgram().getStatements().get(0);
            assertEquals(strict.errors(), tolerant.errors());
            assertEquals(1, tolerantFn.getBody().getStatements().size());
            assertTrue(tolerantFn.getBody().getStatements().get(0) instanceof VarDecl);
        }

        @Test
        @DisplayName("前瞻修复找到后面的 ::")
        void testLookaheadRepair() {
            String source = "fn f() oops :: 1 end";

            Parser strict = parser(source);
            assertTrue(strict.parseProgram().getStatements().isEmpty());

            ParserConfig config = new ParserConfig();
            config.setTolerantBlocks(true);
            Parser tolerant = parser(source, config);
            Program program = tolerant.parseProgram();
            assertEquals(List.of("line 1, column 8: expected ::, got IDENT"), tolerant.errors());
            assertTrue(program.getStatements().get(0) instanceof FnDecl);
        }

        @Test
        @DisplayName("清空错误后重新解析得到相同的错误")
        void testIdempotentErrors() {
            String source = "var = 1\nfn f( :: end\nvar z";
            Parser first = parser(source);
            first.parseProgram();
            List<String> errors = first.errors();
            assertFalse(errors.isEmpty());

            first.clearErrors();
            assertFalse(first.hasErrors());

            Parser second = parser(source);
            second.parseProgram();
            Parser third = parser(source);
            third.parseProgram();
            assertEquals(errors, second.errors());
            assertEquals(second.errors(), third.errors());
        }
    }

    @Nested
    @DisplayName("嵌套深度")
    class DepthGuardTests {

        @Test
        @DisplayName("超过配置的深度记录错误")
        void testConfiguredDepth() {
            ParserConfig config = new ParserConfig();
            config.setMaxNestingDepth(10);
            Parser parser = parser(repeat("(", 16) + "1" + repeat(")", 16), config);
            Program program = parser.parseProgram();
            assertNotNull(program);
            assertEquals(1, parser.errors().size());
            assertTrue(parser.errors().get(0).endsWith("maximum nesting depth 10 exceeded"));
        }

        @Test
        @DisplayName("深层嵌套不会栈溢出，之后的语句继续解析")
        void testDefaultDepth() {
            Parser parser = parser(repeat("[", 2000) + repeat("]", 2000) + "\nvar ok = 1");
            Program program = parser.parseProgram();
            assertTrue(parser.errors().get(0).endsWith("maximum nesting depth 256 exceeded"));
            assertTrue(program.getStatements().get(program.getStatements().size() - 1) instanceof VarDecl);
        }

        @Test
        @DisplayName("深度故障携带出错 token 的位置")
        void testParseExceptionMessage() {
            Token token = new Lexer("  deep", "<test>").scanTokens().get(0);
            ParseException e = new ParseException("maximum nesting depth 1 exceeded", token);
            assertEquals("maximum nesting depth 1 exceeded", e.getReason());
            assertEquals("maximum nesting depth 1 exceeded at line 1, column 3 (found 'deep')", e.getMessage());
            assertSame(token, e.getToken());
        }

        @Test
        @DisplayName("深度在内部恢复后复位")
        void testDepthResets() {
            ParserConfig config = new ParserConfig();
            config.setMaxNestingDepth(10);
            Parser parser = parser(repeat("(", 12) + "1" + repeat(")", 12) + "\nvar x = ((((1))))", config);
            Program program = parser.parseProgram();
            assertEquals(1, parser.errors().size());
            assertTrue(program.getStatements().get(0) instanceof VarDecl);
        }
    }
}
