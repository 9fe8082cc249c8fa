package com.sedalang.compiler.ast;

/**
 * 节点种类：语法树是封闭的节点集合，每个具体节点对应一个常量
 */
public enum NodeKind {
    PROGRAM(Category.ROOT),

    // 声明
    VAR_DECL(Category.STATEMENT),
    FN_DECL(Category.STATEMENT),
    STRUCT_DECL(Category.STATEMENT),
    TYPE_ALIAS_DECL(Category.STATEMENT),
    MODULE_DECL(Category.STATEMENT),
    USING_DECL(Category.STATEMENT),
    COMPONENT_DECL(Category.STATEMENT),

    // 语句
    IF_STMT(Category.STATEMENT),
    CASE_STMT(Category.STATEMENT),
    FOR_STMT(Category.STATEMENT),
    CHECK_STMT(Category.STATEMENT),
    RETURN_STMT(Category.STATEMENT),
    BREAK_STMT(Category.STATEMENT),
    EXPRESSION_STMT(Category.STATEMENT),
    BLOCK(Category.STATEMENT),

    // 表达式
    IDENTIFIER(Category.EXPRESSION),
    LITERAL(Category.EXPRESSION),
    STRING_INTERPOLATION(Category.EXPRESSION),
    COLLECTION_LITERAL(Category.EXPRESSION),
    FUNCTION_EXPR(Category.EXPRESSION),
    UNARY_EXPR(Category.EXPRESSION),
    BINARY_EXPR(Category.EXPRESSION),
    CALL_EXPR(Category.EXPRESSION),
    INDEX_EXPR(Category.EXPRESSION),
    MEMBER_EXPR(Category.EXPRESSION),
    ASSIGN_EXPR(Category.EXPRESSION),
    RANGE_EXPR(Category.EXPRESSION),
    CASE_EXPR(Category.EXPRESSION),
    UI_ELEMENT_EXPR(Category.EXPRESSION),

    // 辅助节点
    PARAMETER(Category.SUPPORT),
    STRUCT_FIELD(Category.SUPPORT),
    ELSE_IF_CLAUSE(Category.SUPPORT),
    CASE_BRANCH(Category.SUPPORT),
    WHERE_BLOCK(Category.SUPPORT),
    ASSERTION(Category.SUPPORT),
    TYPE_ANNOTATION(Category.SUPPORT);

    private final Category category;

    NodeKind(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isExpression() {
        return category == Category.EXPRESSION;
    }

    /**
     * 节点族
     */
    public enum Category {
        ROOT,
        STATEMENT,
        EXPRESSION,
        SUPPORT
    }
}
