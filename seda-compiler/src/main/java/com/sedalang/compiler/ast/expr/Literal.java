package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>数值保留源码文本（如 {@code "3.50"}），由求值器决定数值表示。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal ofNumber(SourceLocation location, String text) {
        return new Literal(location, text, LiteralKind.NUMBER);
    }

    public static Literal ofString(SourceLocation location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public static Literal ofBoolean(SourceLocation location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOLEAN);
    }

    public static Literal ofNil(SourceLocation location) {
        return new Literal(location, null, LiteralKind.NIL);
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        NIL
    }
}
