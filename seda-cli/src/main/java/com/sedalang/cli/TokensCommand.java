package com.sedalang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * picocli tokens 子命令：输出词法单元流
 */
@Command(name = "tokens", description = "输出源码文件的词法单元")
public class TokensCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    @Override
    public Integer call() {
        return new ParseRunner().dumpTokens(file);
    }
}
