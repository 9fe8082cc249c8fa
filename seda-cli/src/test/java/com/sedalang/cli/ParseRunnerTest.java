package com.sedalang.cli;

import com.sedalang.cli.ParseRunner.OutputMode;
import com.sedalang.compiler.printer.PrinterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ParseRunner 测试")
class ParseRunnerTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ParseRunner runner;

    @BeforeEach
    void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new ParseRunner(new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Nested
    @DisplayName("解析")
    class ParseTests {

        @Test
        @DisplayName("无错误时退出码 0")
        void testClean() throws IOException {
            Path file = write("ok.seda", "var x = 1\nfn f() :: x end\n");
            int code = runner.parseFile(file.toString(), OutputMode.SUMMARY);

            assertThat(code).isEqualTo(ParseRunner.EXIT_OK);
            assertThat(stdout()).contains("解析成功: ok.seda").contains("2 条语句");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("语法错误写到 stderr，退出码 1")
        void testParseErrors() throws IOException {
            Path file = write("bad.seda", "var x");
            int code = runner.parseFile(file.toString(), OutputMode.SUMMARY);

            assertThat(code).isEqualTo(ParseRunner.EXIT_PARSE_ERROR);
            assertThat(stderr())
                    .contains("解析失败: bad.seda（1 个错误）")
                    .contains("  1. line 1, column 6: expected =, got EOF");
        }

        @Test
        @DisplayName("文件不存在时退出码 2")
        void testMissingFile() {
            int code = runner.parseFile(tempDir.resolve("nope.seda").toString(), OutputMode.SUMMARY);

            assertThat(code).isEqualTo(ParseRunner.EXIT_IO_ERROR);
            assertThat(stderr()).contains("错误: 文件不存在");
        }

        @Test
        @DisplayName("--ast 输出规范形式")
        void testAstMode() {
            int code = runner.parseSource("var y = a + b * c", "<expr>", OutputMode.AST);

            assertThat(code).isZero();
            assertThat(stdout()).isEqualTo("var y = (a + (b * c))\n");
        }

        @Test
        @DisplayName("--json 即使有错误也输出报告")
        void testJsonMode() {
            int code = runner.parseSource("var = 1", "<expr>", OutputMode.JSON);

            assertThat(code).isEqualTo(ParseRunner.EXIT_PARSE_ERROR);
            assertThat(stdout()).contains("\"errorCount\": 1").contains("\"file\": \"<expr>\"");
            assertThat(stderr()).isEmpty();
        }
    }

    @Nested
    @DisplayName("格式化")
    class FormatTests {

        @Test
        @DisplayName("改写为规范形式")
        void testFormat() throws IOException {
            Path file = write("f.seda", "fn add(a,b)::return a+b end");
            int code = runner.formatFile(file.toString(), new PrinterConfig(), false);

            assertThat(code).isZero();
            assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8))
                    .isEqualTo("fn add(a, b) ::\n    return (a + b)\nend\n");
            assertThat(stdout()).contains("已格式化");
        }

        @Test
        @DisplayName("--check 不写回")
        void testCheck() throws IOException {
            String source = "var a = 1+2";
            Path file = write("c.seda", source);
            int code = runner.formatFile(file.toString(), new PrinterConfig(), true);

            assertThat(code).isEqualTo(ParseRunner.EXIT_PARSE_ERROR);
            assertThat(stdout()).contains("需要格式化");
            assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).isEqualTo(source);
        }

        @Test
        @DisplayName("--check 对规范文件返回 0")
        void testCheckCanonical() throws IOException {
            Path file = write("d.seda", "var a = (1 + 2)\n");

            assertThat(runner.formatFile(file.toString(), new PrinterConfig(), true)).isZero();
            assertThat(stdout()).contains("格式已规范");
        }

        @Test
        @DisplayName("有语法错误时拒绝格式化")
        void testRefuseOnErrors() throws IOException {
            String source = "fn f( :: end";
            Path file = write("e.seda", source);
            int code = runner.formatFile(file.toString(), new PrinterConfig(), false);

            assertThat(code).isEqualTo(ParseRunner.EXIT_PARSE_ERROR);
            assertThat(stderr()).contains("未格式化");
            assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).isEqualTo(source);
        }
    }

    @Nested
    @DisplayName("词法输出")
    class TokenTests {

        @Test
        @DisplayName("每行一个 token，以 EOF 结尾")
        void testTokens() throws IOException {
            Path file = write("t.seda", "var x = 1 # note");
            int code = runner.dumpTokens(file.toString());

            String[] lines = stdout().split("\n");
            assertThat(code).isZero();
            assertThat(lines).hasSize(6);
            assertThat(lines[0]).isEqualTo("   1:1    KW_VAR           var");
            assertThat(lines[4]).contains("COMMENT").contains("# note");
            assertThat(lines[5]).contains("EOF");
        }
    }
}
