package com.sedalang.compiler.printer;

import com.sedalang.compiler.ast.*;
import com.sedalang.compiler.ast.decl.*;
import com.sedalang.compiler.ast.expr.*;
import com.sedalang.compiler.ast.expr.CollectionLiteral.MapEntry;
import com.sedalang.compiler.ast.expr.StringInterpolation.ExprPart;
import com.sedalang.compiler.ast.expr.StringInterpolation.LiteralPart;
import com.sedalang.compiler.ast.expr.StringInterpolation.StringPart;
import com.sedalang.compiler.ast.stmt.*;
import com.sedalang.compiler.ast.type.*;

import java.util.List;
import java.util.Map;

/**
 * Seda AST 源码输出
 *
 * <p>遍历 AST 输出规范形式的源码：中缀与前缀运算完整加括号，
 * 代码块使用 {@code ::} / {@code end} 并按配置缩进。
 * 输出再次解析后得到相同的节点结构。</p>
 */
public class SourcePrinter implements AstVisitor<Void, PrinterContext> {

    private static final SourcePrinter INSTANCE = new SourcePrinter();

    /**
     * 使用默认配置输出任意节点
     */
    public static String print(AstNode node) {
        return print(node, new PrinterConfig());
    }

    public static String print(AstNode node, PrinterConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        node.accept(INSTANCE, ctx);
        return ctx.getOutput();
    }

    /**
     * 格式化程序
     */
    public String format(Program program, PrinterConfig config) {
        PrinterContext ctx = new PrinterContext(config);
        visitProgram(program, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置格式化
     */
    public String format(Program program) {
        return format(program, new PrinterConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, PrinterContext ctx) {
        List<Statement> statements = node.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            Statement stmt = statements.get(i);
            // 块状声明前后空一行
            if (i > 0 && (isBlockLike(stmt) || isBlockLike(statements.get(i - 1)))) {
                ctx.newLine();
            }
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        return null;
    }

    private static boolean isBlockLike(Statement stmt) {
        return stmt instanceof FnDecl || stmt instanceof StructDecl || stmt instanceof ModuleDecl
                || stmt instanceof ComponentDecl || stmt instanceof CheckStmt;
    }

    @Override
    public Void visitVarDecl(VarDecl node, PrinterContext ctx) {
        ctx.append(node.isConstant() ? "const " : "var ");
        ctx.append(String.join(", ", node.getNames()));
        if (node.getType() != null) {
            ctx.append(": ");
            node.getType().accept(this, ctx);
        }
        ctx.append(" = ");
        node.getValue().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitFnDecl(FnDecl node, PrinterContext ctx) {
        ctx.append("fn ");
        if (node.isMethod()) {
            node.getReceiver().accept(this, ctx);
            ctx.append(".");
        }
        ctx.append(node.getName());
        formatParams(node.getParams(), ctx);
        if (node.getReturnType() != null) {
            ctx.append(": ");
            node.getReturnType().accept(this, ctx);
        }
        ctx.append(" ::");
        formatBody(node.getBody().getStatements(), ctx);
        if (node.hasWhereBlock()) {
            ctx.newLine();
            ctx.append("where ::");
            WhereBlock where = node.getWhereBlock();
            formatBody(where.getStatements(), ctx);
            formatBody(where.getAssertions(), ctx);
        }
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, PrinterContext ctx) {
        ctx.append("struct ");
        ctx.append(node.getName());
        ctx.append(" ::");
        formatBody(node.getFields(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitTypeAliasDecl(TypeAliasDecl node, PrinterContext ctx) {
        ctx.append("type ");
        ctx.append(node.getName());
        ctx.append(" = ");
        node.getAliasedType().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitModuleDecl(ModuleDecl node, PrinterContext ctx) {
        ctx.append("module ");
        ctx.append(node.getName());
        ctx.append(" ::");
        formatBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitUsingDecl(UsingDecl node, PrinterContext ctx) {
        ctx.append("using ");
        ctx.append(quote(node.getPath()));
        if (node.hasAlias()) {
            ctx.append(" as ");
            ctx.append(node.getAlias());
        }
        return null;
    }

    @Override
    public Void visitComponentDecl(ComponentDecl node, PrinterContext ctx) {
        ctx.append("component ");
        ctx.append(node.getName());
        formatParams(node.getParams(), ctx);
        ctx.append(" ::");
        formatBody(node.getStatements(), ctx);
        if (node.hasRoot()) {
            ctx.indent();
            ctx.newLine();
            node.getRoot().accept(this, ctx);
            ctx.dedent();
        }
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, PrinterContext ctx) {
        ctx.append(node.getName());
        if (node.hasType()) {
            ctx.append(": ");
            node.getType().accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitStructField(StructField node, PrinterContext ctx) {
        ctx.append(node.getName());
        ctx.append(": ");
        node.getType().accept(this, ctx);
        return null;
    }

    // ============ 语句 ============

    /**
     * 独立输出的代码块：每条语句一行，不带 :: / end
     */
    @Override
    public Void visitBlock(Block node, PrinterContext ctx) {
        List<Statement> statements = node.getStatements();
        for (int i = 0; i < statements.size(); i++) {
            if (i > 0) {
                ctx.newLine();
            }
            statements.get(i).accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, PrinterContext ctx) {
        node.getExpression().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, PrinterContext ctx) {
        ctx.append("if ");
        node.getCondition().accept(this, ctx);
        ctx.append(" ::");
        formatBody(node.getThenBlock().getStatements(), ctx);
        for (ElseIfClause clause : node.getElseIfs()) {
            ctx.newLine();
            clause.accept(this, ctx);
        }
        if (node.hasElse()) {
            ctx.newLine();
            ctx.append("else ::");
            formatBody(node.getElseBlock().getStatements(), ctx);
        }
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitElseIfClause(ElseIfClause node, PrinterContext ctx) {
        ctx.append("else if ");
        node.getCondition().accept(this, ctx);
        ctx.append(" ::");
        formatBody(node.getBlock().getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitCaseStmt(CaseStmt node, PrinterContext ctx) {
        formatCase(node.getSubject(), node.getBranches(), ctx);
        return null;
    }

    @Override
    public Void visitCaseBranch(CaseBranch node, PrinterContext ctx) {
        node.getPattern().accept(this, ctx);
        ctx.append(" => ");
        node.getResult().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, PrinterContext ctx) {
        ctx.append("for ");
        if (node.hasIndex()) {
            ctx.append(node.getIndexName());
            ctx.append(", ");
        }
        ctx.append(node.getVariable());
        ctx.append(" in ");
        node.getIterable().accept(this, ctx);
        ctx.append(" ::");
        formatBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitCheckStmt(CheckStmt node, PrinterContext ctx) {
        ctx.append("check ");
        if (node.getLabel() != null) {
            ctx.append(quote(node.getLabel()));
            ctx.append(" ");
        }
        ctx.append("::");
        formatBody(node.getStatements(), ctx);
        formatBody(node.getAssertions(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitWhereBlock(WhereBlock node, PrinterContext ctx) {
        ctx.append("where ::");
        formatBody(node.getStatements(), ctx);
        formatBody(node.getAssertions(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitAssertion(Assertion node, PrinterContext ctx) {
        node.getLeft().accept(this, ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        if (node.hasRight()) {
            ctx.append(" ");
            node.getRight().accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, PrinterContext ctx) {
        ctx.append("return");
        List<Expression> values = node.getValues();
        for (int i = 0; i < values.size(); i++) {
            ctx.append(i == 0 ? " " : ", ");
            values.get(i).accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, PrinterContext ctx) {
        ctx.append("break");
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitIdentifier(Identifier node, PrinterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, PrinterContext ctx) {
        switch (node.getKind()) {
            case STRING:
                ctx.append(quote((String) node.getValue()));
                break;
            case NIL:
                ctx.append("nil");
                break;
            default:
                ctx.append(String.valueOf(node.getValue()));
                break;
        }
        return null;
    }

    @Override
    public Void visitStringInterpolation(StringInterpolation node, PrinterContext ctx) {
        StringBuilder sb = new StringBuilder("\"");
        for (StringPart part : node.getParts()) {
            if (part instanceof LiteralPart) {
                sb.append(escape(((LiteralPart) part).getValue()));
            } else {
                // 插值片段在字符串内，其中的引号与换行同样需要转义
                String source = print(((ExprPart) part).getExpression(), ctx.getConfig());
                sb.append("#{").append(escape(source)).append("}");
            }
        }
        sb.append("\"");
        ctx.append(sb.toString());
        return null;
    }

    @Override
    public Void visitCollectionLiteral(CollectionLiteral node, PrinterContext ctx) {
        if (node.getKind() == CollectionLiteral.CollectionKind.ARRAY) {
            ctx.append("[");
            formatExpressionList(node.getElements(), ctx);
            ctx.append("]");
        } else {
            ctx.append("{");
            List<MapEntry> entries = node.getMapEntries();
            for (int i = 0; i < entries.size(); i++) {
                if (i > 0) {
                    ctx.append(", ");
                }
                entries.get(i).getKey().accept(this, ctx);
                ctx.append(": ");
                entries.get(i).getValue().accept(this, ctx);
            }
            ctx.append("}");
        }
        return null;
    }

    @Override
    public Void visitFunctionExpr(FunctionExpr node, PrinterContext ctx) {
        ctx.append("fn");
        formatParams(node.getParams(), ctx);
        ctx.append(" ::");
        formatBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        ctx.append("end");
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, PrinterContext ctx) {
        ctx.append("(");
        ctx.append(node.getOperator().toSourceString());
        formatOperand(node.getOperand(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, PrinterContext ctx) {
        ctx.append("(");
        formatOperand(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatOperand(node.getRight(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, PrinterContext ctx) {
        formatOperand(node.getCallee(), ctx);
        ctx.append("(");
        formatExpressionList(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, PrinterContext ctx) {
        formatOperand(node.getTarget(), ctx);
        ctx.append("[");
        node.getIndex().accept(this, ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, PrinterContext ctx) {
        formatOperand(node.getTarget(), ctx);
        ctx.append(".");
        ctx.append(node.getMember());
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, PrinterContext ctx) {
        formatOperand(node.getTarget(), ctx);
        ctx.append(" = ");
        node.getValue().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, PrinterContext ctx) {
        formatOperand(node.getStart(), ctx);
        ctx.append(node.isInclusive() ? "..." : "..");
        formatOperand(node.getEnd(), ctx);
        return null;
    }

    @Override
    public Void visitCaseExpr(CaseExpr node, PrinterContext ctx) {
        formatCase(node.getSubject(), node.getBranches(), ctx);
        return null;
    }

    @Override
    public Void visitUiElementExpr(UiElementExpr node, PrinterContext ctx) {
        ctx.append(node.getType());
        ctx.append(" {");
        ctx.indent();
        for (Map.Entry<String, Expression> property : node.getProperties().entrySet()) {
            ctx.newLine();
            ctx.append(property.getKey());
            ctx.append(": ");
            property.getValue().accept(this, ctx);
        }
        for (UiElementExpr child : node.getChildren()) {
            ctx.newLine();
            child.accept(this, ctx);
        }
        ctx.dedent();
        ctx.newLine();
        ctx.append("}");
        return null;
    }

    // ============ 类型 ============

    @Override
    public Void visitTypeAnnotation(TypeAnnotation node, PrinterContext ctx) {
        ctx.append(node.getName());
        if (node.isGeneric()) {
            ctx.append("[");
            List<TypeAnnotation> params = node.getParameters();
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) {
                    ctx.append(", ");
                }
                params.get(i).accept(this, ctx);
            }
            ctx.append("]");
        }
        return null;
    }

    // ============ 辅助方法 ============

    /**
     * 缩进输出一组节点，每个一行
     */
    private void formatBody(List<? extends AstNode> nodes, PrinterContext ctx) {
        ctx.indent();
        for (AstNode node : nodes) {
            ctx.newLine();
            node.accept(this, ctx);
        }
        ctx.dedent();
    }

    private void formatParams(List<Parameter> params, PrinterContext ctx) {
        ctx.append("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            params.get(i).accept(this, ctx);
        }
        ctx.append(")");
    }

    private void formatExpressionList(List<Expression> expressions, PrinterContext ctx) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                ctx.append(", ");
            }
            expressions.get(i).accept(this, ctx);
        }
    }

    private void formatCase(Expression subject, List<CaseBranch> branches, PrinterContext ctx) {
        ctx.append("case ");
        subject.accept(this, ctx);
        ctx.append(" ::");
        formatBody(branches, ctx);
        ctx.newLine();
        ctx.append("end");
    }

    /**
     * 作为操作数输出。赋值、区间、case、函数字面量不自带括号，嵌套时补上。
     */
    private void formatOperand(Expression expr, PrinterContext ctx) {
        boolean wrap = expr instanceof AssignExpr || expr instanceof RangeExpr
                || expr instanceof CaseExpr || expr instanceof FunctionExpr;
        if (wrap) {
            ctx.append("(");
        }
        expr.accept(this, ctx);
        if (wrap) {
            ctx.append(")");
        }
    }

    static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"':  sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\0': sb.append("\\0"); break;
                default:   sb.append(c); break;
            }
        }
        return sb.toString();
    }
}
