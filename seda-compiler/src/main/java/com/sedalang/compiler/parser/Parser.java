package com.sedalang.compiler.parser;

import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.decl.Program;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.ast.stmt.Block;
import com.sedalang.compiler.ast.stmt.Statement;
import com.sedalang.compiler.lexer.Lexer;
import com.sedalang.compiler.lexer.Token;
import com.sedalang.compiler.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.sedalang.compiler.lexer.TokenType.*;

/**
 * Seda 语法分析器（Pratt 表达式 + 递归下降语句）
 *
 * <p>约定：每个语句/表达式处理函数进入时 {@code current} 是它的第一个 token，
 * 返回时 {@code current} 是它的最后一个 token，由外层循环前进。
 * 语法错误只记录不抛出，处理函数失败时返回 null。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    /** 可开始一条语句的关键字，错误恢复以此为同步点 */
    private static final List<TokenType> STATEMENT_KEYWORDS = Collections.unmodifiableList(Arrays.asList(
            KW_VAR, KW_CONST, KW_FN, KW_STRUCT, KW_TYPE, KW_IF, KW_FOR, KW_CHECK));

    final Lexer lexer;
    final String fileName;
    final ParserConfig config;
    Token current;
    private Token nextToken;  // 用于 lookahead 的缓冲
    private final Deque<Token> replayQueue = new ArrayDeque<Token>(); // 回放队列

    // mark/reset 回溯支持
    private final List<Token> markRecordBuffer = new ArrayList<Token>(8);
    private boolean marking;

    private final List<ParseError> errors = new ArrayList<ParseError>();
    private int depth;

    /** 组件体内 IDENT { 解析为 UI 元素 */
    int componentDepth;
    /** 裸函数字面量 (x) :: ... end 是否可用；块头表达式中关闭 */
    boolean functionLiteralAllowed = true;

    // === Helper 实例 ===
    final LiteralHelper literalHelper = new LiteralHelper(this);
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName(), new ParserConfig());
    }

    public Parser(Lexer lexer, String fileName) {
        this(lexer, fileName, new ParserConfig());
    }

    public Parser(Lexer lexer, String fileName, ParserConfig config) {
        this.lexer = lexer;
        this.fileName = fileName;
        this.config = config;
        current = pull();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 从回放队列或词法分析器取下一个 token，跳过注释
     */
    private Token pull() {
        Token token;
        do {
            token = replayQueue.isEmpty() ? lexer.nextToken() : replayQueue.poll();
        } while (token.is(COMMENT));
        return token;
    }

    /**
     * 前进到下一个 token，返回之前的当前 token
     */
    Token advance() {
        Token previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = pull();
        }
        // 回溯模式下记录消费的 token
        if (marking) {
            markRecordBuffer.add(previous);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = pull();
        }
        return nextToken;
    }

    /**
     * 标记当前位置，用于回溯
     */
    void mark() {
        markRecordBuffer.clear();
        marking = true;
    }

    /**
     * 回溯到标记的位置
     */
    void reset() {
        // 将 nextToken + current 放回 replayQueue 前端，再把 markRecord 按逆序插入最前
        if (nextToken != null) {
            replayQueue.addFirst(nextToken);
            nextToken = null;
        }
        replayQueue.addFirst(current);
        for (int i = markRecordBuffer.size() - 1; i >= 0; i--) {
            replayQueue.addFirst(markRecordBuffer.get(i));
        }
        markRecordBuffer.clear();
        marking = false;
        current = replayQueue.poll();
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean peekIs(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 下一个 token 匹配则前进，否则在下一个 token 处记录期望错误
     */
    boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            advance();
            return true;
        }
        peekError(type);
        return false;
    }

    /**
     * 带修复的 expectPeek：下一个不匹配时在前瞻窗口内查找，
     * 找到则记录错误、跳过中间 token 并返回 true
     */
    boolean expectPeekWithRecovery(TokenType type) {
        if (peekIs(type)) {
            advance();
            return true;
        }
        peekError(type);
        int window = config.getLookaheadRepairWindow();
        mark();
        for (int i = 0; i < window && !peekIs(EOF); i++) {
            advance();
            if (peekIs(type)) {
                marking = false;
                markRecordBuffer.clear();
                advance();
                LOG.fine("在 " + (i + 1) + " 个 token 后找到 " + type.getSymbol() + "，已跳过");
                return true;
            }
        }
        reset();
        return false;
    }

    /**
     * 当前位置（取自 current）
     */
    SourceLocation location() {
        return location(current);
    }

    SourceLocation location(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    // ============ 嵌套深度 ============

    void enterNesting() {
        depth++;
        if (depth > config.getMaxNestingDepth()) {
            depth--;
            throw new ParseException("maximum nesting depth " + config.getMaxNestingDepth() + " exceeded", current);
        }
    }

    void exitNesting() {
        depth--;
    }

    // ============ 错误记录 ============

    void peekError(TokenType... expected) {
        errors.add(new ParseError(peek(), Arrays.asList(expected)));
    }

    void currentError(TokenType... expected) {
        errors.add(new ParseError(current, Arrays.asList(expected)));
    }

    void error(Token token, String message) {
        errors.add(new ParseError(message, token));
    }

    void addError(ParseError error) {
        errors.add(error);
    }

    void noPrefixError(Token token) {
        error(token, "no prefix parse function for " + token.getType().getSymbol() + " found");
    }

    int errorCount() {
        return errors.size();
    }

    /**
     * 格式化后的错误信息（line L, column C: ...）
     */
    public List<String> errors() {
        List<String> messages = new ArrayList<String>(errors.size());
        for (ParseError error : errors) {
            messages.add(error.format());
        }
        return messages;
    }

    public List<ParseError> getParseErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 带序号的错误列表，用于展示
     */
    public List<String> formatErrors() {
        List<String> lines = new ArrayList<String>(errors.size());
        for (int i = 0; i < errors.size(); i++) {
            lines.add(String.format("%3d. %s", i + 1, errors.get(i).format()));
        }
        return lines;
    }

    public void clearErrors() {
        errors.clear();
    }

    /**
     * 检查名称不是保留字，否则在当前 token 处记录错误
     *
     * @param name    名称
     * @param context 使用场景，如 "variable declaration"
     */
    public boolean validateIdentifier(String name, String context) {
        return validateIdentifier(name, context, current);
    }

    boolean validateIdentifier(String name, String context, Token at) {
        if (name == null || name.isEmpty() || !isIdentifierText(name)) {
            error(at, "invalid identifier (in " + context + ")");
            return false;
        }
        if (Lexer.getKeywords().contains(name)) {
            error(at, "'" + name + "' is a reserved word (in " + context + ")");
            return false;
        }
        return true;
    }

    private static boolean isIdentifierText(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
                    || (c > 127 && Character.isLetter(c));
            if (!letter && !(i > 0 && c >= '0' && c <= '9')) {
                return false;
            }
        }
        return true;
    }

    /**
     * 期望下一个 token 是名称。关键字会得到保留字错误（不消费），
     * 其他 token 得到期望 IDENT 的错误。
     */
    String expectName(String context) {
        Token next = peek();
        if (next.is(IDENTIFIER)) {
            advance();
            return validateIdentifier(current.getLexeme(), context) ? current.getLexeme() : null;
        }
        if (isWordToken(next.getType())) {
            validateIdentifier(next.getLexeme(), context, next);
            return null;
        }
        peekError(IDENTIFIER);
        return null;
    }

    /** 关键字及 and/or/not 的单词形式 */
    static boolean isWordToken(TokenType type) {
        return type.isKeyword() || type == AND || type == OR || type == NOT;
    }

    // ============ 错误恢复 ============

    /**
     * 跳到下一个同步点：下一个 token 是语句关键字，或当前 token 是 end
     */
    void synchronize() {
        while (!check(EOF)) {
            if (check(KW_END) || peekIs(EOF)) {
                return;
            }
            if (STATEMENT_KEYWORDS.contains(peek().getType())) {
                return;
            }
            advance();
        }
    }

    /**
     * 语句失败时 current 是否已停在别的语句关键字或块终结符上。
     * 此时应从 current 原地继续，再同步或前进会跳过一条完好的语句。
     *
     * @param start 失败语句的第一个 token
     */
    boolean atResumePoint(Token start) {
        if (current == start) {
            return false;
        }
        return STATEMENT_KEYWORDS.contains(current.getType()) || current.isOneOf(KW_END, KW_ELSE, KW_WHERE);
    }

    /**
     * 跳到当前块的 end（或 EOF）
     */
    void skipToEnd() {
        while (!check(KW_END) && !check(EOF)) {
            advance();
        }
    }

    /**
     * 跳到下一条语句的起点或块的 end
     */
    void skipToNextStatement() {
        while (!check(EOF)) {
            if (check(KW_END) || STATEMENT_KEYWORDS.contains(current.getType())) {
                return;
            }
            advance();
        }
    }

    /**
     * 受保护的语句入口：内部故障记录为错误并同步，不会逃出解析器
     */
    Statement parseStatementWithRecovery() {
        try {
            return stmtParser.parseStatement();
        } catch (ParseException e) {
            LOG.log(Level.FINE, "语句解析中断，已恢复", e);
            error(e.getToken() != null ? e.getToken() : current, "panic during parsing: " + e.getReason());
            synchronize();
            return null;
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个输入。总是返回 Program，错误通过 {@link #errors()} 获取。
     */
    public Program parseProgram() {
        SourceLocation loc = location();
        List<Statement> statements = new ArrayList<Statement>();

        while (!check(EOF)) {
            if (check(SEMICOLON)) {
                advance();
                continue;
            }
            int before = errors.size();
            Token start = current;
            Statement stmt = parseStatementWithRecovery();
            if (stmt != null) {
                statements.add(stmt);
            } else if (errors.size() > before) {
                if (atResumePoint(start)) {
                    continue;
                }
                synchronize();
            }
            advance();
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(fileName + ": " + statements.size() + " 条顶层语句, " + errors.size() + " 个错误");
        }
        return new Program(loc, statements);
    }

    /**
     * 解析并打包结果
     */
    public ParseResult parse() {
        Program program = parseProgram();
        return new ParseResult(program, errors);
    }

    /**
     * 解析单个表达式直到输入结束，多余的 token 记为错误。
     * 用于字符串插值片段。
     */
    Expression parseStandaloneExpression() {
        try {
            Expression expr = exprParser.parseExpression(Precedence.LOWEST);
            if (expr != null && !peekIs(EOF)) {
                peekError(EOF);
            }
            return expr;
        } catch (ParseException e) {
            LOG.log(Level.FINE, "表达式解析中断", e);
            error(e.getToken() != null ? e.getToken() : current, "panic during parsing: " + e.getReason());
            return null;
        }
    }

    // ============ 委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }
    Expression parseExpression(Precedence precedence) { return exprParser.parseExpression(precedence); }
}
