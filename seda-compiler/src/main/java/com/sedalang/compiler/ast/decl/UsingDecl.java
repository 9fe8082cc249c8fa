package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

/**
 * 外部模块导入 using "path" [as alias]
 */
public class UsingDecl extends Declaration {
    private final String path;
    private final String alias;  // 可选

    public UsingDecl(SourceLocation location, String path, String alias) {
        super(location);
        this.path = path;
        this.alias = alias;
    }

    public String getPath() {
        return path;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    @Override
    public String getName() {
        return alias != null ? alias : path;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.USING_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUsingDecl(this, context);
    }
}
