package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.lexer.TokenType;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.BINARY_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        POW("^"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),

        // 逻辑
        AND("&&"),
        OR("||");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回 Seda 源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        /**
         * 由 token 类型得到运算符，非二元运算符返回 null
         */
        public static BinaryOp fromToken(TokenType type) {
            switch (type) {
                case PLUS:    return ADD;
                case MINUS:   return SUB;
                case STAR:    return MUL;
                case SLASH:   return DIV;
                case PERCENT: return MOD;
                case CARET:   return POW;
                case EQ:      return EQ;
                case NE:      return NE;
                case LT:      return LT;
                case GT:      return GT;
                case LE:      return LE;
                case GE:      return GE;
                case AND:     return AND;
                case OR:      return OR;
                default:      return null;
            }
        }
    }
}
