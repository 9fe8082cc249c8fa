package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.decl.ComponentDecl;
import com.sedalang.compiler.ast.decl.FnDecl;
import com.sedalang.compiler.ast.decl.ModuleDecl;
import com.sedalang.compiler.ast.decl.Parameter;
import com.sedalang.compiler.ast.decl.StructDecl;
import com.sedalang.compiler.ast.decl.StructField;
import com.sedalang.compiler.ast.decl.TypeAliasDecl;
import com.sedalang.compiler.ast.decl.UsingDecl;
import com.sedalang.compiler.ast.decl.VarDecl;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.expr.UiElementExpr;
import com.sedalang.compiler.ast.stmt.Block;
import com.sedalang.compiler.ast.stmt.ExpressionStmt;
import com.sedalang.compiler.ast.stmt.Statement;
import com.sedalang.compiler.ast.stmt.WhereBlock;
import com.sedalang.compiler.ast.type.TypeAnnotation;
import com.sedalang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.sedalang.compiler.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 变量 ============

    /**
     * var a, b: T = value / const NAME = value
     */
    VarDecl parseVarDecl(boolean constant) {
        SourceLocation loc = parser.location();
        String context = constant ? "constant declaration" : "variable declaration";
        List<String> names = new ArrayList<String>();

        String name = parser.expectName(context);
        if (name == null) {
            return null;
        }
        names.add(name);
        while (parser.peekIs(COMMA)) {
            parser.advance();
            name = parser.expectName(context);
            if (name == null) {
                return null;
            }
            names.add(name);
        }

        TypeAnnotation type = null;
        if (parser.peekIs(COLON)) {
            parser.advance();
            parser.advance();
            type = parser.typeParser.parseType();
            if (type == null) {
                return null;
            }
        }

        if (!parser.expectPeek(ASSIGN)) {
            return null;
        }
        parser.advance();
        Expression value = parser.parseExpression(Precedence.LOWEST);
        if (value == null) {
            return null;
        }
        return new VarDecl(loc, names, type, value, constant);
    }

    // ============ 函数 ============

    /**
     * fn name(params): T :: body [where :: ...] end，
     * 方法形式 fn Type.name(...)
     */
    FnDecl parseFnDecl() {
        SourceLocation loc = parser.location();
        String first = parser.expectName("function declaration");
        if (first == null) {
            return null;
        }
        TypeAnnotation receiver = null;
        String name = first;
        if (parser.peekIs(DOT)) {
            receiver = new TypeAnnotation(parser.location(), first);
            parser.advance();
            name = parser.expectName("method declaration");
            if (name == null) {
                return null;
            }
        }

        if (!parser.expectPeek(LPAREN)) {
            return null;
        }
        List<Parameter> params = parser.typeParser.parseParameters();
        if (params == null) {
            return null;
        }

        TypeAnnotation returnType = null;
        if (parser.peekIs(COLON)) {
            parser.advance();
            parser.advance();
            returnType = parser.typeParser.parseType();
            if (returnType == null) {
                return null;
            }
        }

        if (!parser.stmtParser.expectBlockOpen()) {
            return null;
        }
        Block body = parseFunctionBody();

        WhereBlock whereBlock = null;
        if (parser.check(KW_WHERE)) {
            whereBlock = parser.stmtParser.parseWhereBlock();
            if (whereBlock == null) {
                return null;
            }
        }
        if (!parser.stmtParser.expectBlockEnd()) {
            return null;
        }
        return new FnDecl(loc, receiver, name, params, returnType, body, whereBlock);
    }

    /**
     * 函数体。函数体内不在组件上下文中，IDENT { 不是 UI 元素。
     */
    Block parseFunctionBody() {
        int savedDepth = parser.componentDepth;
        parser.componentDepth = 0;
        try {
            return parser.parseBlock();
        } finally {
            parser.componentDepth = savedDepth;
        }
    }

    // ============ 类型 ============

    /**
     * struct Name :: field: Type [,] ... end
     */
    StructDecl parseStructDecl() {
        SourceLocation loc = parser.location();
        String name = parser.expectName("struct declaration");
        if (name == null) {
            return null;
        }
        if (!parser.stmtParser.expectBlockOpen()) {
            return null;
        }
        parser.advance();

        List<StructField> fields = new ArrayList<StructField>();
        while (!parser.check(KW_END) && !parser.check(EOF)) {
            if (parser.check(IDENTIFIER)) {
                SourceLocation fieldLoc = parser.location();
                String fieldName = parser.current.getLexeme();
                if (!parser.expectPeek(COLON)) {
                    return abandonStruct();
                }
                parser.advance();
                TypeAnnotation type = parser.typeParser.parseType();
                if (type == null) {
                    return abandonStruct();
                }
                fields.add(new StructField(fieldLoc, fieldName, type));
                if (parser.peekIs(COMMA)) {
                    parser.advance();
                }
            } else if (Parser.isWordToken(parser.current.getType())) {
                parser.validateIdentifier(parser.current.getLexeme(), "struct field");
                return abandonStruct();
            } else {
                parser.currentError(IDENTIFIER);
                return abandonStruct();
            }
            parser.advance();
        }
        if (parser.check(EOF)) {
            parser.currentError(KW_END);
            return null;
        }
        return new StructDecl(loc, name, fields);
    }

    /**
     * 字段出错时跳过剩余字段，停在 struct 的 end
     */
    private StructDecl abandonStruct() {
        parser.skipToEnd();
        return null;
    }

    /**
     * type Name = TypeAnnotation
     */
    TypeAliasDecl parseTypeAliasDecl() {
        SourceLocation loc = parser.location();
        String name = parser.expectName("type alias");
        if (name == null) {
            return null;
        }
        if (!parser.expectPeek(ASSIGN)) {
            return null;
        }
        parser.advance();
        TypeAnnotation aliased = parser.typeParser.parseType();
        if (aliased == null) {
            return null;
        }
        return new TypeAliasDecl(loc, name, aliased);
    }

    // ============ 模块 ============

    ModuleDecl parseModuleDecl() {
        SourceLocation loc = parser.location();
        String name = parser.expectName("module declaration");
        if (name == null) {
            return null;
        }
        if (!parser.stmtParser.expectBlockOpen()) {
            return null;
        }
        Block body = parser.parseBlock();
        if (!parser.stmtParser.expectBlockEnd()) {
            return null;
        }
        return new ModuleDecl(loc, name, body);
    }

    /**
     * using "path" [as alias]
     */
    UsingDecl parseUsingDecl() {
        SourceLocation loc = parser.location();
        if (!parser.expectPeek(STRING)) {
            return null;
        }
        String path = parser.current.getLiteral();
        String alias = null;
        if (parser.peekIs(KW_AS)) {
            parser.advance();
            alias = parser.expectName("using alias");
            if (alias == null) {
                return null;
            }
        }
        return new UsingDecl(loc, path, alias);
    }

    // ============ 组件 ============

    /**
     * component Name(params) :: statements... RootElement { ... } end
     *
     * <p>组件体内作为语句出现的 UI 元素成为根元素，只允许一个。</p>
     */
    ComponentDecl parseComponentDecl() {
        SourceLocation loc = parser.location();
        String name = parser.expectName("component declaration");
        if (name == null) {
            return null;
        }
        if (!parser.expectPeek(LPAREN)) {
            return null;
        }
        List<Parameter> params = parser.typeParser.parseParameters();
        if (params == null) {
            return null;
        }
        if (!parser.stmtParser.expectBlockOpen()) {
            return null;
        }

        Block body;
        parser.componentDepth++;
        try {
            body = parser.parseBlock();
        } finally {
            parser.componentDepth--;
        }
        if (!parser.stmtParser.expectBlockEnd()) {
            return null;
        }

        List<Statement> statements = new ArrayList<Statement>();
        UiElementExpr root = null;
        for (Statement stmt : body.getStatements()) {
            if (stmt instanceof ExpressionStmt
                    && ((ExpressionStmt) stmt).getExpression() instanceof UiElementExpr) {
                UiElementExpr element = (UiElementExpr) ((ExpressionStmt) stmt).getExpression();
                if (root == null) {
                    root = element;
                } else {
                    parser.addError(new ParseError("component '" + name + "' already has a root UI element",
                            element.getLocation().getLine(), element.getLocation().getColumn()));
                }
            } else {
                statements.add(stmt);
            }
        }
        return new ComponentDecl(loc, name, params, statements, root);
    }

    /** 当前 token 可作为属性名（标识符或关键字） */
    static boolean isPropertyName(Token token) {
        return token.is(IDENTIFIER) || Parser.isWordToken(token.getType());
    }
}
