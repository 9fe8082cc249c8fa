package com.sedalang.compiler.ast;

import com.sedalang.compiler.ast.decl.*;
import com.sedalang.compiler.ast.expr.*;
import com.sedalang.compiler.ast.stmt.*;
import com.sedalang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitVarDecl(VarDecl node, C ctx) { return null; }

    default R visitFnDecl(FnDecl node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitTypeAliasDecl(TypeAliasDecl node, C ctx) { return null; }

    default R visitModuleDecl(ModuleDecl node, C ctx) { return null; }

    default R visitUsingDecl(UsingDecl node, C ctx) { return null; }

    default R visitComponentDecl(ComponentDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitStructField(StructField node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitElseIfClause(ElseIfClause node, C ctx) { return null; }

    default R visitCaseStmt(CaseStmt node, C ctx) { return null; }

    default R visitCaseBranch(CaseBranch node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitCheckStmt(CheckStmt node, C ctx) { return null; }

    default R visitWhereBlock(WhereBlock node, C ctx) { return null; }

    default R visitAssertion(Assertion node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitStringInterpolation(StringInterpolation node, C ctx) { return null; }

    default R visitCollectionLiteral(CollectionLiteral node, C ctx) { return null; }

    default R visitFunctionExpr(FunctionExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitRangeExpr(RangeExpr node, C ctx) { return null; }

    default R visitCaseExpr(CaseExpr node, C ctx) { return null; }

    default R visitUiElementExpr(UiElementExpr node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitTypeAnnotation(TypeAnnotation node, C ctx) { return null; }
}
