package com.sedalang.compiler.parser;

/**
 * 语法分析配置
 */
public class ParserConfig {
    private int maxNestingDepth = 256;
    private boolean reportInterpolationErrors = true;
    private boolean tolerantBlocks = false;
    private int lookaheadRepairWindow = 5;

    public ParserConfig() {
    }

    /** 表达式与代码块的最大嵌套深度，超过后报告错误而不是栈溢出 */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public void setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /** 字符串插值中子表达式的错误是否合并到外层错误列表 */
    public boolean isReportInterpolationErrors() {
        return reportInterpolationErrors;
    }

    public void setReportInterpolationErrors(boolean reportInterpolationErrors) {
        this.reportInterpolationErrors = reportInterpolationErrors;
    }

    /**
     * 容错块模式：块内语句出错后跳到下一条语句，
     * 缺少 :: 时在前瞻窗口内查找
     */
    public boolean isTolerantBlocks() {
        return tolerantBlocks;
    }

    public void setTolerantBlocks(boolean tolerantBlocks) {
        this.tolerantBlocks = tolerantBlocks;
    }

    /** 前瞻修复窗口大小 */
    public int getLookaheadRepairWindow() {
        return lookaheadRepairWindow;
    }

    public void setLookaheadRepairWindow(int lookaheadRepairWindow) {
        if (lookaheadRepairWindow < 0) {
            throw new IllegalArgumentException("lookaheadRepairWindow must not be negative: " + lookaheadRepairWindow);
        }
        this.lookaheadRepairWindow = lookaheadRepairWindow;
    }
}
