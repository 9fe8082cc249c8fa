package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.decl.Parameter;
import com.sedalang.compiler.ast.type.TypeAnnotation;

import java.util.ArrayList;
import java.util.List;

import static com.sedalang.compiler.lexer.TokenType.*;

/**
 * 类型注解与参数列表解析辅助类
 */
class TypeParser {

    final Parser parser;

    TypeParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 类型注解：Name 或 Name[T, U]。进入时 current 是类型名。
     */
    TypeAnnotation parseType() {
        SourceLocation loc = parser.location();
        if (!parser.check(IDENTIFIER) && !parser.current.getType().isBuiltinType()) {
            parser.currentError(IDENTIFIER);
            return null;
        }
        String name = parser.current.getLexeme();
        if (!parser.peekIs(LBRACKET)) {
            return new TypeAnnotation(loc, name);
        }

        parser.advance();
        List<TypeAnnotation> parameters = new ArrayList<TypeAnnotation>();
        parser.advance();
        TypeAnnotation param = parseType();
        if (param == null) {
            return null;
        }
        parameters.add(param);
        while (parser.peekIs(COMMA)) {
            parser.advance();
            parser.advance();
            param = parseType();
            if (param == null) {
                return null;
            }
            parameters.add(param);
        }
        if (!parser.expectPeek(RBRACKET)) {
            return null;
        }
        return new TypeAnnotation(loc, name, parameters);
    }

    /**
     * 参数列表 (a, b: T)。进入时 current 是 (，返回时 current 是 )。
     */
    List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        if (parser.peekIs(RPAREN)) {
            parser.advance();
            return params;
        }

        Parameter param = parseParameter();
        if (param == null) {
            return null;
        }
        params.add(param);
        while (parser.peekIs(COMMA)) {
            parser.advance();
            param = parseParameter();
            if (param == null) {
                return null;
            }
            params.add(param);
        }
        if (!parser.expectPeek(RPAREN)) {
            return null;
        }
        return params;
    }

    private Parameter parseParameter() {
        String name = parser.expectName("function parameter");
        if (name == null) {
            return null;
        }
        SourceLocation loc = parser.location();
        TypeAnnotation type = null;
        if (parser.peekIs(COLON)) {
            parser.advance();
            parser.advance();
            type = parseType();
            if (type == null) {
                return null;
            }
        }
        return new Parameter(loc, name, type);
    }
}
