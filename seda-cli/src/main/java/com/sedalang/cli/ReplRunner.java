package com.sedalang.cli;

import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.ast.stmt.Statement;
import com.sedalang.compiler.lexer.Lexer;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.parser.Parser;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式：逐段解析输入，打印规范形式或错误列表
 */
public class ReplRunner {

    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    private static final String PROMPT = "seda> ";
    private static final String CONTINUATION_PROMPT = "...   ";

    private final PrintStream out;
    private final PrintStream err;
    private int inputCount = 0;

    public ReplRunner() {
        this(System.out, System.err);
    }

    ReplRunner(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Seda v" + Main.VERSION + " 语法分析器");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "终端初始化失败", e);
            err.println("终端初始化失败: " + e.getMessage());
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println();
        out.println("再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                String line = reader.readLine(buffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT);
                if (line == null) break;
                if (!accept(line, buffer)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 丢弃当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            out.print(buffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT);
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "读取输入失败", e);
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null) break;
            if (!accept(line, buffer)) break;
        }
    }

    /**
     * 处理一行输入
     *
     * @return false 表示退出
     */
    boolean accept(String line, StringBuilder buffer) {
        if (buffer.length() == 0 && line.trim().startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        buffer.append(line).append("\n");
        String source = buffer.toString();
        if (needsMoreInput(source)) {
            return true;
        }
        buffer.setLength(0);

        if (!source.trim().isEmpty()) {
            // 去掉末尾换行，使 EOF 错误落在最后一行
            evaluateAndPrint(source.substring(0, source.length() - 1));
        }
        return true;
    }

    /**
     * 输入是否未完结：括号未闭合，或 :: 开启的代码块还没有对应的 end
     */
    static boolean needsMoreInput(String source) {
        int brackets = 0;
        int blocks = 0;
        // else / where 后面的 :: 延续已打开的块
        boolean continuesBlock = false;

        for (Token token : new Lexer(source, "<repl>").scanTokens()) {
            switch (token.getType()) {
                case LPAREN:
                case LBRACKET:
                case LBRACE:
                    brackets++;
                    break;
                case RPAREN:
                case RBRACKET:
                case RBRACE:
                    brackets--;
                    break;
                case KW_ELSE:
                case KW_WHERE:
                    continuesBlock = true;
                    break;
                case DOUBLE_COLON:
                    if (continuesBlock) {
                        continuesBlock = false;
                    } else {
                        blocks++;
                    }
                    break;
                case KW_END:
                    blocks--;
                    break;
                case ILLEGAL:
                    // 未闭合的字符串
                    if (token.getLexeme().startsWith("\"")) {
                        return true;
                    }
                    break;
                default:
                    break;
            }
        }
        return brackets > 0 || blocks > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        String name = command;
        String arg = "";
        int space = command.indexOf(' ');
        if (space > 0) {
            name = command.substring(0, space);
            arg = command.substring(space + 1).trim();
        }

        switch (name) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
            case ":h":
                printReplHelp();
                return true;
            case ":version":
                out.println("Seda v" + Main.VERSION);
                out.println("Java: " + System.getProperty("java.version"));
                return true;
            case ":ast":
                if (arg.isEmpty()) {
                    err.println("用法: :ast <源码>");
                } else {
                    printStructure(arg);
                }
                return true;
            case ":tokens":
                if (arg.isEmpty()) {
                    err.println("用法: :tokens <源码>");
                } else {
                    for (Token token : new Lexer(arg, "<repl>").scanTokens()) {
                        out.println(ParseRunner.formatToken(token));
                    }
                }
                return true;
            default:
                out.println("未知命令: " + command);
                out.println("输入 :help 获取帮助");
                return true;
        }
    }

    /**
     * 解析并打印每条语句的规范形式
     */
    void evaluateAndPrint(String source) {
        Parser parser = newParser(source);
        Program program = parser.parseProgram();
        if (parser.hasErrors()) {
            for (String line : parser.formatErrors()) {
                err.println(line);
            }
            return;
        }
        for (Statement stmt : program.getStatements()) {
            out.println(stmt);
        }
    }

    private void printStructure(String source) {
        Parser parser = newParser(source);
        Program program = parser.parseProgram();
        for (Statement stmt : program.getStatements()) {
            out.println(stmt.getNodeKind() + " @" + stmt.getLocation().getLine() + ":" + stmt.getLocation().getColumn());
            out.println("  " + stmt.toString().replace("\n", "\n  "));
        }
        for (String line : parser.formatErrors()) {
            err.println(line);
        }
    }

    private Parser newParser(String source) {
        String name = "<repl-" + (++inputCount) + ">";
        return new Parser(new Lexer(source, name), name);
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h          显示此帮助");
        out.println("  :quit, :q, :exit   退出 REPL");
        out.println("  :version           显示版本");
        out.println("  :ast <源码>        显示语句种类、位置与规范形式");
        out.println("  :tokens <源码>     显示词法单元");
        out.println();
        out.println("示例:");
        out.println("  var x = 1 + 2 * 3");
        out.println("  fn add(a, b) :: a + b end");
        out.println("  \"Count: #{count}\"");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号和 :: 代码块会自动进入多行模式");
    }
}
