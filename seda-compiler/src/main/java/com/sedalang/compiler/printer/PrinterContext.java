package com.sedalang.compiler.printer;

/**
 * 输出上下文，跟踪输出缓冲区和缩进层级
 */
public class PrinterContext {
    private final StringBuilder output = new StringBuilder();
    private final PrinterConfig config;
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public PrinterContext(PrinterConfig config) {
        this.config = config;
        this.indentUnit = config.getIndentString();
    }

    public PrinterConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }
}
