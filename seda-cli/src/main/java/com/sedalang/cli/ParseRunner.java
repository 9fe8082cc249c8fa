package com.sedalang.cli;

import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.lexer.Lexer;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.parser.Parser;
import com.sedalang.compiler.printer.PrinterConfig;
import com.sedalang.compiler.printer.SourcePrinter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 解析、格式化、词法输出执行器
 *
 * <p>每个操作返回进程退出码：0 无错误，1 有语法错误，2 读写失败。</p>
 */
public class ParseRunner {

    private static final Logger LOG = Logger.getLogger(ParseRunner.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_PARSE_ERROR = 1;
    public static final int EXIT_IO_ERROR = 2;

    /**
     * 解析结果的输出方式
     */
    public enum OutputMode {
        /** 只报告语句数 */
        SUMMARY,
        /** 输出规范形式源码 */
        AST,
        /** 输出 JSON 报告 */
        JSON
    }

    private final PrintStream out;
    private final PrintStream err;

    public ParseRunner() {
        this(System.out, System.err);
    }

    public ParseRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 解析文件
     */
    public int parseFile(String filePath, OutputMode mode) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_IO_ERROR;
        }
        return parseSource(source, path.getFileName().toString(), mode);
    }

    /**
     * 解析一段源码
     */
    public int parseSource(String source, String fileName, OutputMode mode) {
        Parser parser = new Parser(new Lexer(source, fileName), fileName);
        Program program = parser.parseProgram();

        switch (mode) {
            case JSON:
                out.println(JsonReport.toJson(fileName, program, parser.getParseErrors()));
                return parser.hasErrors() ? EXIT_PARSE_ERROR : EXIT_OK;
            case AST:
                if (!parser.hasErrors()) {
                    out.print(new SourcePrinter().format(program));
                }
                break;
            default:
                if (!parser.hasErrors()) {
                    out.println("解析成功: " + fileName + "（" + program.getStatements().size() + " 条语句）");
                }
                break;
        }

        if (parser.hasErrors()) {
            printErrors(fileName, parser);
            return EXIT_PARSE_ERROR;
        }
        return EXIT_OK;
    }

    /**
     * 格式化文件。存在语法错误时不改写。
     *
     * @param check 为 true 时只检查，不写回
     */
    public int formatFile(String filePath, PrinterConfig config, boolean check) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_IO_ERROR;
        }

        String fileName = path.getFileName().toString();
        Parser parser = new Parser(new Lexer(source, fileName), fileName);
        Program program = parser.parseProgram();
        if (parser.hasErrors()) {
            printErrors(fileName, parser);
            err.println("错误: 存在语法错误，未格式化 - " + filePath);
            return EXIT_PARSE_ERROR;
        }

        String formatted = new SourcePrinter().format(program, config);
        if (check) {
            if (formatted.equals(source)) {
                out.println("格式已规范: " + filePath);
                return EXIT_OK;
            }
            out.println("需要格式化: " + filePath);
            return EXIT_PARSE_ERROR;
        }

        try {
            Files.write(path, formatted.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "写入失败: " + path, e);
            err.println("错误: 无法写入文件 - " + filePath + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        out.println("已格式化: " + filePath);
        return EXIT_OK;
    }

    /**
     * 输出文件的词法单元，每行一个
     */
    public int dumpTokens(String filePath) {
        Path path = Paths.get(filePath);
        String source = readSource(path);
        if (source == null) {
            return EXIT_IO_ERROR;
        }
        for (Token token : new Lexer(source, path.getFileName().toString()).scanTokens()) {
            out.println(formatToken(token));
        }
        return EXIT_OK;
    }

    static String formatToken(Token token) {
        return String.format("%4d:%-4d %-16s %s",
                token.getLine(), token.getColumn(), token.getType().name(), token.getLexeme());
    }

    private void printErrors(String fileName, Parser parser) {
        err.println("解析失败: " + fileName + "（" + parser.getParseErrors().size() + " 个错误）");
        for (String line : parser.formatErrors()) {
            err.println(line);
        }
    }

    /**
     * 读取 UTF-8 源码，失败时输出错误并返回 null
     */
    private String readSource(Path path) {
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + path);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取失败: " + path, e);
            err.println("错误: 无法读取文件 - " + path + ": " + e.getMessage());
            return null;
        }
    }
}
