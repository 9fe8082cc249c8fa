package com.sedalang.compiler.ast.decl;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.stmt.Block;

/**
 * 模块声明 module Name :: ... end
 */
public class ModuleDecl extends Declaration {
    private final String name;
    private final Block body;

    public ModuleDecl(SourceLocation location, String name, Block body) {
        super(location);
        this.name = name;
        this.body = body;
    }

    @Override
    public String getName() {
        return name;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.MODULE_DECL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
