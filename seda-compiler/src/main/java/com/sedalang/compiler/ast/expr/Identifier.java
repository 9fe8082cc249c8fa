package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 标识符（self 与 case 中的通配符 _ 也是标识符）
 */
public class Identifier extends Expression {
    public static final String WILDCARD = "_";

    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** case 分支中的兜底模式 */
    public boolean isWildcard() {
        return WILDCARD.equals(name);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
