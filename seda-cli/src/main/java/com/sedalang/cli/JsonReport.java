package com.sedalang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.ast.stmt.Statement;
import com.sedalang.compiler.lexer.TokenType;
import com.sedalang.compiler.parser.ParseError;

import java.util.List;

/**
 * 解析结果的 JSON 报告
 *
 * <pre>
 * {"file", "errorCount",
 *  "errors": [{"line", "column", "message", "expected": [...], "actual"}],
 *  "statements": [{"kind", "line", "column", "source"}]}
 * </pre>
 */
public final class JsonReport {

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private JsonReport() {}

    public static String toJson(String fileName, Program program, List<ParseError> errors) {
        return GSON.toJson(build(fileName, program, errors));
    }

    static JsonObject build(String fileName, Program program, List<ParseError> errors) {
        JsonObject report = new JsonObject();
        report.addProperty("file", fileName);
        report.addProperty("errorCount", errors.size());

        JsonArray errorArray = new JsonArray();
        for (ParseError error : errors) {
            JsonObject item = new JsonObject();
            item.addProperty("line", error.getLine());
            item.addProperty("column", error.getColumn());
            item.addProperty("message", error.getDetail());
            JsonArray expected = new JsonArray();
            for (TokenType type : error.getExpected()) {
                expected.add(type.getSymbol());
            }
            item.add("expected", expected);
            item.addProperty("actual", error.getActual() != null ? error.getActual().getSymbol() : null);
            errorArray.add(item);
        }
        report.add("errors", errorArray);

        JsonArray statements = new JsonArray();
        for (Statement stmt : program.getStatements()) {
            JsonObject item = new JsonObject();
            item.addProperty("kind", stmt.getNodeKind().name());
            item.addProperty("line", stmt.getLocation().getLine());
            item.addProperty("column", stmt.getLocation().getColumn());
            item.addProperty("source", stmt.toString());
            statements.add(item);
        }
        report.add("statements", statements);
        return report;
    }
}
