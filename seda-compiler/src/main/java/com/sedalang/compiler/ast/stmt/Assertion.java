package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstNode;
import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;
import com.sedalang.compiler.lexer.TokenType;

/**
 * 断言（如 add(2, 3) is 5、items isEmpty）
 */
public class Assertion extends AstNode {
    private final Expression left;
    private final AssertionOp operator;
    private final Expression right;  // 一元断言及无参 raises 为 null

    public Assertion(SourceLocation location, Expression left, AssertionOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public AssertionOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    public boolean hasRight() {
        return right != null;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.ASSERTION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssertion(this, context);
    }

    /**
     * 断言操作符
     */
    public enum AssertionOp {
        IS("is"),
        IS_A("isA"),
        IS_NOT("isNot"),
        CONTAINS("contains"),
        IS_GREATER("isGreater"),
        IS_LESS("isLess"),
        IS_TRUE("isTrue"),
        IS_FALSE("isFalse"),
        IS_EMPTY("isEmpty"),
        STARTS_WITH("startsWith"),
        ENDS_WITH("endsWith"),
        RAISES("raises");

        private final String source;

        AssertionOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }

        /** isTrue / isFalse / isEmpty 不带右操作数 */
        public boolean isUnary() {
            return this == IS_TRUE || this == IS_FALSE || this == IS_EMPTY;
        }

        public static AssertionOp fromToken(TokenType type) {
            switch (type) {
                case KW_IS:         return IS;
                case KW_ISA:        return IS_A;
                case KW_ISNOT:      return IS_NOT;
                case KW_CONTAINS:   return CONTAINS;
                case KW_ISGREATER:  return IS_GREATER;
                case KW_ISLESS:     return IS_LESS;
                case KW_ISTRUE:     return IS_TRUE;
                case KW_ISFALSE:    return IS_FALSE;
                case KW_ISEMPTY:    return IS_EMPTY;
                case KW_STARTSWITH: return STARTS_WITH;
                case KW_ENDSWITH:   return ENDS_WITH;
                case KW_RAISES:     return RAISES;
                default:            return null;
            }
        }
    }
}
