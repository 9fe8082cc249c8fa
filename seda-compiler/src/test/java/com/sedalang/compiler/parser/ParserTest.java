package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.decl.*;
import com.sedalang.compiler.ast.expr.*;
import com.sedalang.compiler.ast.stmt.*;
import com.sedalang.compiler.lexer.Lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试：声明与语句
 */
class ParserTest {

    private Parser parser(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>");
    }

    /** 解析并断言没有错误 */
    private Program parse(String source) {
        Parser parser = parser(source);
        Program program = parser.parseProgram();
        assertEquals(List.of(), parser.errors(), "unexpected errors for: " + source);
        return program;
    }

    private Statement single(String source) {
        Program program = parse(source);
        assertEquals(1, program.getStatements().size());
        return program.getStatements().get(0);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    // ============ 变量声明测试 ============

    @Nested
    @DisplayName("变量声明")
    class VarDeclarationTests {

        @Test
        @DisplayName("简单变量")
        void testSimpleVar() {
            VarDecl decl = (VarDecl) single("var x = 5");
            assertEquals("x", decl.getName());
            assertFalse(decl.isConstant());
            assertNull(decl.getType());
            Literal value = (Literal) decl.getValue();
            assertEquals(Literal.LiteralKind.NUMBER, value.getKind());
            assertEquals("5", value.getValue());
        }

        @Test
        @DisplayName("带类型注解的常量")
        void testTypedConst() {
            VarDecl decl = (VarDecl) single("const PI: number = 3.14");
            assertTrue(decl.isConstant());
            assertEquals("number", decl.getType().getName());
            assertEquals("3.14", ((Literal) decl.getValue()).getValue());
        }

        @Test
        @DisplayName("多名称声明")
        void testMultipleNames() {
            VarDecl decl = (VarDecl) single("var name, age = info()");
            assertEquals(List.of("name", "age"), decl.getNames());
            assertTrue(decl.isDestructuring());
            assertTrue(decl.getValue() instanceof CallExpr);
        }

        @Test
        @DisplayName("分号分隔的多条语句")
        void testSemicolons() {
            Program program = parse("var a = 1; var b = 2;");
            assertEquals(2, program.getStatements().size());
        }

        @Test
        @DisplayName("注释被跳过")
        void testCommentsSkipped() {
            Program program = parse(lines("# header", "var a = 1 # trailing", "#| block |# var b = 2"));
            assertEquals(2, program.getStatements().size());
        }
    }

    // ============ 函数声明测试 ============

    @Nested
    @DisplayName("函数声明")
    class FunctionDeclarationTests {

        @Test
        @DisplayName("多参数函数")
        void testParams() {
            FnDecl fn = (FnDecl) single("fn add(a, b) :: return a + b end");
            assertEquals("add", fn.getName());
            assertEquals(2, fn.getParams().size());
            assertEquals("b", fn.getParams().get(1).getName());
            assertEquals(1, fn.getBody().getStatements().size());
            assertTrue(fn.getBody().getStatements().get(0) instanceof ReturnStmt);
            assertFalse(fn.isMethod());
        }

        @Test
        @DisplayName("带名称的 fn 是声明，fn( 是表达式语句")
        void testNamedVersusAnonymous() {
            assertTrue(single("fn add() :: 1 end") instanceof FnDecl);

            Statement stmt = single("fn() :: 1 end");
            assertTrue(stmt instanceof ExpressionStmt);
            assertTrue(((ExpressionStmt) stmt).getExpression() instanceof FunctionExpr);
        }

        @Test
        @DisplayName("类型注解与泛型参数")
        void testTypedParams() {
            FnDecl fn = (FnDecl) single("fn first(xs: List[number], n: number): number :: return xs[0] end");
            Parameter xs = fn.getParams().get(0);
            assertTrue(xs.hasType());
            assertEquals("List", xs.getType().getName());
            assertTrue(xs.getType().isGeneric());
            assertEquals("number", xs.getType().getParameters().get(0).getName());
            assertEquals("number", fn.getReturnType().getName());
        }

        @Test
        @DisplayName("方法接收者")
        void testMethod() {
            FnDecl fn = (FnDecl) single("fn Person.greet(): string :: return \"hi \" + self.name end");
            assertTrue(fn.isMethod());
            assertEquals("Person", fn.getReceiver().getName());
            assertEquals("greet", fn.getName());
            assertEquals("string", fn.getReturnType().getName());
        }

        @Test
        @DisplayName("where 块")
        void testWhereBlock() {
            FnDecl fn = (FnDecl) single(lines(
                    "fn add(x: number, y: number): number ::",
                    "    x + y",
                    "where ::",
                    "    add(1, 2) is 3",
                    "    add(0, 0) isGreater -1",
                    "end"));
            assertTrue(fn.hasWhereBlock());
            assertEquals(1, fn.getBody().getStatements().size());
            List<Assertion> assertions = fn.getWhereBlock().getAssertions();
            assertEquals(2, assertions.size());
            assertEquals(Assertion.AssertionOp.IS, assertions.get(0).getOperator());
            assertEquals(Assertion.AssertionOp.IS_GREATER, assertions.get(1).getOperator());
        }

        @Test
        @DisplayName("裸函数字面量")
        void testBareFunctionLiteral() {
            VarDecl decl = (VarDecl) single("var double = (x: number) :: x * 2 end");
            FunctionExpr fn = (FunctionExpr) decl.getValue();
            assertEquals(1, fn.getParams().size());
            assertEquals("number", fn.getParams().get(0).getType().getName());
            assertEquals(1, fn.getBody().getStatements().size());
        }

        @Test
        @DisplayName("括号后没有 :: 时是分组")
        void testGroupingNotFunction() {
            VarDecl decl = (VarDecl) single("var y = (x) + 1");
            assertTrue(decl.getValue() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("返回多个值与不返回值")
        void testReturnValues() {
            FnDecl multi = (FnDecl) single("fn pair() :: return \"a\", 1 end");
            ReturnStmt ret = (ReturnStmt) multi.getBody().getStatements().get(0);
            assertEquals(2, ret.getValues().size());

            FnDecl none = (FnDecl) single("fn nothing() :: return end");
            assertFalse(((ReturnStmt) none.getBody().getStatements().get(0)).hasValue());
        }
    }

    // ============ 控制流测试 ============

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if / else if / else")
        void testIfElse() {
            IfStmt stmt = (IfStmt) single(lines(
                    "if x > 10 ::",
                    "    big()",
                    "else if x < 0 ::",
                    "    negative()",
                    "else ::",
                    "    small()",
                    "end"));
            assertTrue(stmt.getCondition() instanceof BinaryExpr);
            assertEquals(1, stmt.getElseIfs().size());
            assertTrue(stmt.hasElse());
            assertEquals(1, stmt.getElseBlock().getStatements().size());
        }

        @Test
        @DisplayName("条件中的括号不会被当作函数字面量")
        void testParenthesizedCondition() {
            IfStmt stmt = (IfStmt) single("if (ready) :: go() end");
            assertTrue(stmt.getCondition() instanceof Identifier);
            assertEquals(1, stmt.getThenBlock().getStatements().size());
        }

        @Test
        @DisplayName("带索引的 for")
        void testForWithIndex() {
            ForStmt stmt = (ForStmt) single("for i, item in items :: print(item) end");
            assertTrue(stmt.hasIndex());
            assertEquals("i", stmt.getIndexName());
            assertEquals("item", stmt.getVariable());
            assertTrue(stmt.getIterable() instanceof Identifier);
        }

        @Test
        @DisplayName("for 区间与 break")
        void testForRange() {
            ForStmt stmt = (ForStmt) single("for n in 1..10 :: if n == 5 :: break end end");
            assertFalse(stmt.hasIndex());
            assertTrue(stmt.getIterable() instanceof RangeExpr);
            IfStmt inner = (IfStmt) stmt.getBody().getStatements().get(0);
            assertTrue(inner.getThenBlock().getStatements().get(0) instanceof BreakStmt);
        }

        @Test
        @DisplayName("case 语句与通配分支")
        void testCaseStatement() {
            CaseStmt stmt = (CaseStmt) single(lines(
                    "case x ::",
                    "    1 => \"one\"",
                    "    _ => \"other\"",
                    "end"));
            assertEquals(2, stmt.getBranches().size());
            assertFalse(stmt.getBranches().get(0).isWildcard());
            assertTrue(stmt.getBranches().get(1).isWildcard());
        }

        @Test
        @DisplayName("case 表达式")
        void testCaseExpression() {
            VarDecl decl = (VarDecl) single("var r = case x :: 1..5 => \"low\" _ => \"high\" end");
            CaseExpr expr = (CaseExpr) decl.getValue();
            assertEquals(2, expr.getBranches().size());
            assertTrue(expr.getBranches().get(0).getPattern() instanceof RangeExpr);
        }
    }

    // ============ 测试块 ============

    @Nested
    @DisplayName("check 块")
    class CheckTests {

        @Test
        @DisplayName("语句、断言与一元断言混合")
        void testMixedBody() {
            CheckStmt check = (CheckStmt) single(lines(
                    "check \"math\" ::",
                    "    var xs = []",
                    "    print(\"checking\")",
                    "    xs isEmpty",
                    "    add(2, 3) is 5",
                    "    name startsWith \"A\"",
                    "end"));
            assertEquals("math", check.getLabel());
            assertEquals(2, check.getStatements().size());
            assertTrue(check.getStatements().get(0) instanceof VarDecl);
            assertTrue(check.getStatements().get(1) instanceof ExpressionStmt);
            assertEquals(3, check.getAssertions().size());
            Assertion empty = check.getAssertions().get(0);
            assertEquals(Assertion.AssertionOp.IS_EMPTY, empty.getOperator());
            assertFalse(empty.hasRight());
        }

        @Test
        @DisplayName("raises 只在同一行时带右操作数")
        void testRaises() {
            CheckStmt check = (CheckStmt) single(lines(
                    "check ::",
                    "    fail() raises",
                    "    boom() raises \"Boom\"",
                    "end"));
            assertNull(check.getLabel());
            assertEquals(2, check.getAssertions().size());
            assertFalse(check.getAssertions().get(0).hasRight());
            assertTrue(check.getAssertions().get(1).hasRight());
        }
    }

    // ============ 类型与模块 ============

    @Nested
    @DisplayName("结构体、类型别名与模块")
    class TypeAndModuleTests {

        @Test
        @DisplayName("结构体字段，逗号可选")
        void testStruct() {
            StructDecl decl = (StructDecl) single(lines(
                    "struct Person ::",
                    "    name: string,",
                    "    age: number",
                    "    tags: List[string]",
                    "end"));
            assertEquals("Person", decl.getName());
            assertEquals(3, decl.getFields().size());
            assertEquals("age", decl.getFields().get(1).getName());
            assertTrue(decl.getFields().get(2).getType().isGeneric());
        }

        @Test
        @DisplayName("类型别名")
        void testTypeAlias() {
            TypeAliasDecl decl = (TypeAliasDecl) single("type Scores = Map[string, number]");
            assertEquals("Scores", decl.getName());
            assertEquals(2, decl.getAliasedType().getParameters().size());
        }

        @Test
        @DisplayName("模块")
        void testModule() {
            ModuleDecl decl = (ModuleDecl) single("module math :: fn sq(x) :: x * x end end");
            assertEquals("math", decl.getName());
            assertTrue(decl.getBody().getStatements().get(0) instanceof FnDecl);
        }

        @Test
        @DisplayName("using 与别名")
        void testUsing() {
            UsingDecl plain = (UsingDecl) single("using \"std/io\"");
            assertFalse(plain.hasAlias());
            assertEquals("std/io", plain.getName());

            UsingDecl aliased = (UsingDecl) single("using \"std/io\" as io");
            assertEquals("std/io", aliased.getPath());
            assertEquals("io", aliased.getName());
        }
    }

    // ============ 组件 ============

    @Nested
    @DisplayName("组件与 UI 元素")
    class ComponentTests {

        @Test
        @DisplayName("嵌套 UI 元素树")
        void testCounterComponent() {
            ComponentDecl comp = (ComponentDecl) single(lines(
                    "component Counter(initial: number) ::",
                    "    var count = initial",
                    "    Window {",
                    "        title: \"Counter App\", width: 400",
                    "        VBox {",
                    "            Text { text: \"Count: #{count}\", fontSize: 24 }",
                    "            Button { text: \"Increment\", onClick: fn() :: count = count + 1 end }",
                    "        }",
                    "    }",
                    "end"));
            assertEquals("Counter", comp.getName());
            assertEquals(1, comp.getParams().size());
            assertEquals(1, comp.getStatements().size());
            assertTrue(comp.hasRoot());

            UiElementExpr window = comp.getRoot();
            assertEquals("Window", window.getType());
            assertEquals(List.of("title", "width"), List.copyOf(window.getProperties().keySet()));
            UiElementExpr vbox = window.getChildren().get(0);
            assertEquals("VBox", vbox.getType());
            assertEquals(2, vbox.getChildren().size());
            UiElementExpr button = vbox.getChildren().get(1);
            assertTrue(button.getProperties().get("onClick") instanceof FunctionExpr);
            assertTrue(vbox.getChildren().get(0).getProperties().get("text") instanceof StringInterpolation);
        }

        @Test
        @DisplayName("关键字可作属性名")
        void testKeywordPropertyName() {
            ComponentDecl comp = (ComponentDecl) single("component Field() :: Input { type: \"text\" } end");
            assertTrue(comp.getRoot().getProperties().containsKey("type"));
        }

        @Test
        @DisplayName("第二个根元素报错")
        void testSecondRoot() {
            Parser parser = parser("component App() ::\n    Window { }\n    Dialog { }\nend");
            Program program = parser.parseProgram();
            assertEquals(List.of("line 3, column 5: component 'App' already has a root UI element"),
                    parser.errors());
            ComponentDecl comp = (ComponentDecl) program.getStatements().get(0);
            assertEquals("Window", comp.getRoot().getType());
        }

        @Test
        @DisplayName("组件外的 Ident { 不是 UI 元素")
        void testOutsideComponent() {
            Program program = parse("Window {}");
            assertEquals(2, program.getStatements().size());
            assertTrue(((ExpressionStmt) program.getStatements().get(0)).getExpression() instanceof Identifier);
            assertTrue(((ExpressionStmt) program.getStatements().get(1)).getExpression() instanceof CollectionLiteral);
        }
    }
}
