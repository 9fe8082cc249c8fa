package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.decl.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解析结果：语法树（总是非 null）和收集到的错误列表
 */
public final class ParseResult {
    private final Program program;
    private final List<ParseError> errors;

    public ParseResult(Program program, List<ParseError> errors) {
        this.program = program;
        this.errors = Collections.unmodifiableList(new ArrayList<ParseError>(errors));
    }

    public Program getProgram() {
        return program;
    }

    public List<ParseError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** 格式化后的错误字符串 */
    public List<String> getErrorMessages() {
        List<String> messages = new ArrayList<String>(errors.size());
        for (ParseError error : errors) {
            messages.add(error.format());
        }
        return messages;
    }
}
