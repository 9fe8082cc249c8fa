package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.stmt.CaseBranch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * case 表达式（与 case 语句结构相同，但产生值）
 */
public class CaseExpr extends Expression {
    private final Expression subject;
    private final List<CaseBranch> branches;

    public CaseExpr(SourceLocation location, Expression subject, List<CaseBranch> branches) {
        super(location);
        this.subject = subject;
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    public Expression getSubject() {
        return subject;
    }

    public List<CaseBranch> getBranches() {
        return branches;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.CASE_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseExpr(this, context);
    }
}
