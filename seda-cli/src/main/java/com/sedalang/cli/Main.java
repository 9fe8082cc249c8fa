package com.sedalang.cli;

import com.sedalang.cli.ParseRunner.OutputMode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Seda CLI 入口点（picocli）
 */
@Command(name = "seda", version = "Seda v" + Main.VERSION,
         mixinStandardHelpOptions = true,
         description = "解析 Seda 源码并报告语法错误",
         subcommands = {FmtCommand.class, TokensCommand.class})
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    // 持有引用，避免日志级别随 Logger 被回收而丢失
    private static final Logger ROOT = Logger.getLogger("com.sedalang");

    @Option(names = "--ast", description = "输出规范形式的语法树")
    boolean ast;

    @Option(names = "--json", description = "以 JSON 输出解析报告")
    boolean json;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Option(names = "-e", description = "解析一段源码")
    String expression;

    @Parameters(index = "0", arity = "0..1", description = "源码文件")
    String file;

    @Override
    public Integer call() {
        setVerbose(verbose);
        OutputMode mode = json ? OutputMode.JSON : ast ? OutputMode.AST : OutputMode.SUMMARY;
        ParseRunner runner = new ParseRunner();

        if (expression != null) {
            return runner.parseSource(expression, "<expr>", mode);
        }
        if (file != null) {
            return runner.parseFile(file, mode);
        }
        new ReplRunner().run();
        return ParseRunner.EXIT_OK;
    }

    static void setVerbose(boolean verbose) {
        if (verbose) {
            ROOT.setLevel(Level.FINE);
        }
    }

    /**
     * 从 classpath 加载 logging.properties
     */
    static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "无法加载日志配置", e);
        }
    }

    public static void main(String[] args) {
        configureLogging();
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            LOG.log(Level.FINE, "控制台编码不可用: " + charsetName, e);
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 获取控制台使用的字符编码名。native.encoding 反映操作系统原生编码，
     * Windows 控制台上通常是 GBK 而不是默认的 UTF-8。
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null) {
            try {
                Charset.forName(nativeEnc);
                return nativeEnc;
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                LOG.fine("忽略无效的 native.encoding: " + nativeEnc);
            }
        }
        return Charset.defaultCharset().name();
    }
}
