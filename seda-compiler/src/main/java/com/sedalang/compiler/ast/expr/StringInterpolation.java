package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 字符串插值（如 "Hello, #{name}!"）
 */
public class StringInterpolation extends Expression {
    private final List<StringPart> parts;

    public StringInterpolation(SourceLocation location, List<StringPart> parts) {
        super(location);
        this.parts = Collections.unmodifiableList(new ArrayList<>(parts));
    }

    public List<StringPart> getParts() {
        return parts;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.STRING_INTERPOLATION;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }

    /**
     * 字符串片段基类
     */
    public abstract static class StringPart {
        private final SourceLocation location;

        protected StringPart(SourceLocation location) {
            this.location = location;
        }

        public SourceLocation getLocation() {
            return location;
        }
    }

    /**
     * 纯文本片段
     */
    public static final class LiteralPart extends StringPart {
        private final String value;

        public LiteralPart(SourceLocation location, String value) {
            super(location);
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    /**
     * 嵌入表达式片段 #{...}
     */
    public static final class ExprPart extends StringPart {
        private final Expression expression;

        public ExprPart(SourceLocation location, Expression expression) {
            super(location);
            this.expression = expression;
        }

        public Expression getExpression() {
            return expression;
        }
    }
}
