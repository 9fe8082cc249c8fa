package com.sedalang.cli;

import com.sedalang.compiler.printer.PrinterConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：将源码文件改写为规范形式
 */
@Command(name = "fmt", description = "将源码文件改写为规范形式")
public class FmtCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Option(names = "--indent-size", defaultValue = "4", description = "缩进空格数（默认 4）")
    int indentSize;

    @Option(names = "--use-tabs", description = "使用 Tab 缩进")
    boolean useTabs;

    @Option(names = "--check", description = "只检查是否已是规范形式，不写回文件")
    boolean check;

    @Override
    public Integer call() {
        PrinterConfig config = new PrinterConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        return new ParseRunner().formatFile(file, config, check);
    }
}
