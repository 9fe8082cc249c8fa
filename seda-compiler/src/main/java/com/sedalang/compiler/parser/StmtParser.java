package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.stmt.Assertion;
import com.sedalang.compiler.ast.stmt.Assertion.AssertionOp;
import com.sedalang.compiler.ast.stmt.Block;
import com.sedalang.compiler.ast.stmt.BreakStmt;
import com.sedalang.compiler.ast.stmt.CaseBranch;
import com.sedalang.compiler.ast.stmt.CaseStmt;
import com.sedalang.compiler.ast.stmt.CheckStmt;
import com.sedalang.compiler.ast.stmt.ElseIfClause;
import com.sedalang.compiler.ast.stmt.ExpressionStmt;
import com.sedalang.compiler.ast.stmt.ForStmt;
import com.sedalang.compiler.ast.stmt.IfStmt;
import com.sedalang.compiler.ast.stmt.ReturnStmt;
import com.sedalang.compiler.ast.stmt.Statement;
import com.sedalang.compiler.ast.stmt.WhereBlock;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.sedalang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 按当前 token 分派。where / else / end 只作为块终结符，这里不产生节点。
     */
    Statement parseStatement() {
        switch (parser.current.getType()) {
            case KW_VAR:
                return parser.declParser.parseVarDecl(false);
            case KW_CONST:
                return parser.declParser.parseVarDecl(true);
            case KW_FN:
                // fn( 开头是匿名函数表达式
                if (parser.peekIs(LPAREN)) {
                    return parseExpressionStatement();
                }
                return parser.declParser.parseFnDecl();
            case KW_STRUCT:
                return parser.declParser.parseStructDecl();
            case KW_TYPE:
                return parser.declParser.parseTypeAliasDecl();
            case KW_MODULE:
                return parser.declParser.parseModuleDecl();
            case KW_USING:
                return parser.declParser.parseUsingDecl();
            case KW_COMPONENT:
                return parser.declParser.parseComponentDecl();
            case KW_IF:
                return parseIfStmt();
            case KW_CASE:
                return parseCaseStmt();
            case KW_FOR:
                return parseForStmt();
            case KW_RETURN:
                return parseReturnStmt();
            case KW_BREAK:
                return new BreakStmt(parser.location());
            case KW_CHECK:
                return parseCheckStmt();
            case KW_WHERE:
            case KW_ELSE:
            case KW_END:
            case COMMENT:
                return null;
            default:
                return parseExpressionStatement();
        }
    }

    Statement parseExpressionStatement() {
        SourceLocation loc = parser.location();
        Expression expr = parser.parseExpression(Precedence.LOWEST);
        if (expr == null) {
            return null;
        }
        return new ExpressionStmt(loc, expr);
    }

    // ============ 块 ============

    /**
     * 解析代码块。进入时 current 是 ::，返回时 current 是终结符
     * （end / else / where），到达 EOF 时记录错误。
     */
    Block parseBlock() {
        if (parser.config.isTolerantBlocks()) {
            return parseBlockWithRecovery();
        }
        SourceLocation loc = parser.location();
        boolean savedAllowed = parser.functionLiteralAllowed;
        parser.enterNesting();
        try {
            parser.functionLiteralAllowed = true;
            parser.advance();
            List<Statement> statements = new ArrayList<Statement>();
            while (!isBlockTerminator(parser.current)) {
                if (parser.check(SEMICOLON)) {
                    parser.advance();
                    continue;
                }
                int before = parser.errorCount();
                Token start = parser.current;
                Statement stmt = parseStatement();
                if (stmt != null) {
                    statements.add(stmt);
                } else if (parser.errorCount() > before) {
                    recoverInBlock(start);
                    continue;
                }
                parser.advance();
            }
            if (parser.check(EOF)) {
                parser.currentError(KW_END);
            }
            return new Block(loc, statements);
        } finally {
            parser.functionLiteralAllowed = savedAllowed;
            parser.exitNesting();
        }
    }

    /**
     * 容错块：语句经受保护入口解析，块头缺少 :: 时在窗口内向前查找
     */
    Block parseBlockWithRecovery() {
        SourceLocation loc = parser.location();
        boolean savedAllowed = parser.functionLiteralAllowed;
        parser.enterNesting();
        try {
            parser.functionLiteralAllowed = true;
            parser.advance();
            List<Statement> statements = new ArrayList<Statement>();
            while (!isBlockTerminator(parser.current)) {
                if (parser.check(SEMICOLON)) {
                    parser.advance();
                    continue;
                }
                int before = parser.errorCount();
                Token start = parser.current;
                Statement stmt = parser.parseStatementWithRecovery();
                if (stmt != null) {
                    statements.add(stmt);
                } else if (parser.errorCount() > before) {
                    recoverInBlock(start);
                    continue;
                }
                parser.advance();
            }
            if (parser.check(EOF)) {
                parser.currentError(KW_END);
            }
            return new Block(loc, statements);
        } finally {
            parser.functionLiteralAllowed = savedAllowed;
            parser.exitNesting();
        }
    }

    /**
     * 块内语句失败后跳到下一条语句起点，一个错误只报告一次
     */
    private void recoverInBlock(Token start) {
        if (parser.atResumePoint(start)) {
            return;
        }
        parser.advance();
        parser.skipToNextStatement();
    }

    private static boolean isBlockTerminator(Token token) {
        return token.isOneOf(KW_END, KW_ELSE, KW_WHERE, EOF);
    }

    /**
     * 期望下一个 token 是 ::
     */
    boolean expectBlockOpen() {
        if (parser.config.isTolerantBlocks()) {
            return parser.expectPeekWithRecovery(DOUBLE_COLON);
        }
        return parser.expectPeek(DOUBLE_COLON);
    }

    /**
     * 块结束后 current 必须是 end。EOF 已在块内报告过，不重复报告。
     */
    boolean expectBlockEnd() {
        if (parser.check(KW_END)) {
            return true;
        }
        if (!parser.check(EOF)) {
            parser.currentError(KW_END);
        }
        return false;
    }

    /**
     * 块头表达式（if / else if 条件、case 主体、for 迭代对象），其中不识别裸函数字面量
     */
    Expression parseHeaderExpression() {
        boolean saved = parser.functionLiteralAllowed;
        parser.functionLiteralAllowed = false;
        try {
            return parser.parseExpression(Precedence.LOWEST);
        } finally {
            parser.functionLiteralAllowed = saved;
        }
    }

    // ============ 控制流 ============

    private Statement parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parseHeaderExpression();
        if (condition == null) {
            return null;
        }
        if (!expectBlockOpen()) {
            return null;
        }
        Block thenBlock = parseBlock();

        List<ElseIfClause> elseIfs = new ArrayList<ElseIfClause>();
        Block elseBlock = null;
        while (parser.check(KW_ELSE)) {
            if (parser.peekIs(KW_IF)) {
                parser.advance();
                SourceLocation clauseLoc = parser.location();
                parser.advance();
                Expression elseIfCondition = parseHeaderExpression();
                if (elseIfCondition == null) {
                    return null;
                }
                if (!expectBlockOpen()) {
                    return null;
                }
                elseIfs.add(new ElseIfClause(clauseLoc, elseIfCondition, parseBlock()));
            } else {
                if (!expectBlockOpen()) {
                    return null;
                }
                elseBlock = parseBlock();
                break;
            }
        }

        if (!expectBlockEnd()) {
            return null;
        }
        return new IfStmt(loc, condition, thenBlock, elseIfs, elseBlock);
    }

    private Statement parseCaseStmt() {
        SourceLocation loc = parser.location();
        parser.advance();
        Expression subject = parseHeaderExpression();
        if (subject == null) {
            return null;
        }
        if (!parser.expectPeek(DOUBLE_COLON)) {
            return null;
        }
        List<CaseBranch> branches = parseCaseBranches();
        if (branches == null) {
            return null;
        }
        return new CaseStmt(loc, subject, branches);
    }

    /**
     * 解析 case 分支 {@code pattern => result}，直到 end。
     * 进入时 current 是 ::，返回时 current 是 end。
     */
    List<CaseBranch> parseCaseBranches() {
        List<CaseBranch> branches = new ArrayList<CaseBranch>();
        parser.advance();
        while (!parser.check(KW_END) && !parser.check(EOF)) {
            if (parser.check(SEMICOLON)) {
                parser.advance();
                continue;
            }
            SourceLocation branchLoc = parser.location();
            Expression pattern = parser.parseExpression(Precedence.LOWEST);
            if (pattern == null) {
                return null;
            }
            if (!parser.expectPeek(ARROW)) {
                return null;
            }
            parser.advance();
            Expression result = parser.parseExpression(Precedence.LOWEST);
            if (result == null) {
                return null;
            }
            branches.add(new CaseBranch(branchLoc, pattern, result));
            parser.advance();
        }
        if (parser.check(EOF)) {
            parser.currentError(KW_END);
            return null;
        }
        return branches;
    }

    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        String first = parser.expectName("for loop variable");
        if (first == null) {
            return null;
        }
        String indexName = null;
        String variable = first;
        if (parser.peekIs(COMMA)) {
            parser.advance();
            indexName = first;
            variable = parser.expectName("for loop variable");
            if (variable == null) {
                return null;
            }
        }
        if (!parser.expectPeek(KW_IN)) {
            return null;
        }
        parser.advance();
        Expression iterable = parseHeaderExpression();
        if (iterable == null) {
            return null;
        }
        if (!expectBlockOpen()) {
            return null;
        }
        Block body = parseBlock();
        if (!expectBlockEnd()) {
            return null;
        }
        return new ForStmt(loc, indexName, variable, iterable, body);
    }

    private Statement parseReturnStmt() {
        SourceLocation loc = parser.location();
        List<Expression> values = new ArrayList<Expression>();
        if (canStartReturnValue(parser.peek())) {
            parser.advance();
            Expression value = parser.parseExpression(Precedence.LOWEST);
            if (value == null) {
                return null;
            }
            values.add(value);
            while (parser.peekIs(COMMA)) {
                parser.advance();
                parser.advance();
                value = parser.parseExpression(Precedence.LOWEST);
                if (value == null) {
                    return null;
                }
                values.add(value);
            }
        }
        return new ReturnStmt(loc, values);
    }

    private boolean canStartReturnValue(Token next) {
        if (next.isOneOf(KW_END, KW_ELSE, KW_WHERE, SEMICOLON, EOF)) {
            return false;
        }
        return parser.exprParser.hasPrefix(next.getType());
    }

    // ============ 测试块 ============

    private Statement parseCheckStmt() {
        SourceLocation loc = parser.location();
        String label = null;
        if (parser.peekIs(STRING)) {
            parser.advance();
            label = parser.current.getLiteral();
        }
        if (!expectBlockOpen()) {
            return null;
        }
        List<Statement> statements = new ArrayList<Statement>();
        List<Assertion> assertions = new ArrayList<Assertion>();
        if (!parseAssertionBody(statements, assertions)) {
            return null;
        }
        return new CheckStmt(loc, label, statements, assertions);
    }

    /**
     * 函数的 where 块。进入时 current 是 where，返回时 current 是 end。
     */
    WhereBlock parseWhereBlock() {
        SourceLocation loc = parser.location();
        if (!parser.expectPeek(DOUBLE_COLON)) {
            return null;
        }
        List<Statement> statements = new ArrayList<Statement>();
        List<Assertion> assertions = new ArrayList<Assertion>();
        if (!parseAssertionBody(statements, assertions)) {
            return null;
        }
        return new WhereBlock(loc, statements, assertions);
    }

    /**
     * check / where 块体：语句关键字开头的是语句，其余是表达式，
     * 后跟断言操作符时构成断言。进入时 current 是 ::，返回时 current 是 end。
     */
    private boolean parseAssertionBody(List<Statement> statements, List<Assertion> assertions) {
        parser.enterNesting();
        try {
            parser.advance();
            while (!parser.check(KW_END) && !parser.check(EOF)) {
                if (parser.check(SEMICOLON)) {
                    parser.advance();
                    continue;
                }
                int before = parser.errorCount();
                Token start = parser.current;
                boolean parsed;
                if (isStatementStart()) {
                    Statement stmt = parseStatement();
                    parsed = stmt != null;
                    if (parsed) {
                        statements.add(stmt);
                    }
                } else {
                    parsed = parseAssertionOrExpression(statements, assertions);
                }
                if (!parsed && parser.errorCount() > before) {
                    recoverInBlock(start);
                    continue;
                }
                parser.advance();
            }
            if (parser.check(EOF)) {
                parser.currentError(KW_END);
                return false;
            }
            return true;
        } finally {
            parser.exitNesting();
        }
    }

    private boolean isStatementStart() {
        switch (parser.current.getType()) {
            case KW_VAR:
            case KW_CONST:
            case KW_STRUCT:
            case KW_TYPE:
            case KW_MODULE:
            case KW_USING:
            case KW_COMPONENT:
            case KW_IF:
            case KW_FOR:
            case KW_RETURN:
            case KW_BREAK:
            case KW_CHECK:
                return true;
            case KW_FN:
                return !parser.peekIs(LPAREN);
            default:
                return false;
        }
    }

    /**
     * @return 解析失败时 false
     */
    private boolean parseAssertionOrExpression(List<Statement> statements, List<Assertion> assertions) {
        SourceLocation loc = parser.location();
        Expression left = parser.parseExpression(Precedence.LOWEST);
        if (left == null) {
            return false;
        }
        if (!parser.peek().getType().isAssertionOperator()) {
            statements.add(new ExpressionStmt(loc, left));
            return true;
        }

        parser.advance();
        Token operatorToken = parser.current;
        AssertionOp op = AssertionOp.fromToken(operatorToken.getType());
        Expression right = null;
        if (op == AssertionOp.RAISES) {
            // raises 的期望错误只能写在同一行
            Token next = parser.peek();
            if (next.getLine() == operatorToken.getLine() && canStartAssertionOperand(next.getType())) {
                parser.advance();
                right = parser.parseExpression(Precedence.LOWEST);
                if (right == null) {
                    return false;
                }
            }
        } else if (!op.isUnary()) {
            parser.advance();
            right = parser.parseExpression(Precedence.LOWEST);
            if (right == null) {
                return false;
            }
        }
        assertions.add(new Assertion(loc, left, op, right));
        return true;
    }

    private boolean canStartAssertionOperand(TokenType type) {
        return type != KW_END && type != EOF && parser.exprParser.hasPrefix(type);
    }
}
