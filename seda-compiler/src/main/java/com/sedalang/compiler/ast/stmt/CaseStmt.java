package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * case 语句
 */
public class CaseStmt extends Statement {
    private final Expression subject;
    private final List<CaseBranch> branches;

    public CaseStmt(SourceLocation location, Expression subject, List<CaseBranch> branches) {
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
        return NodeKind.CASE_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCaseStmt(this, context);
    }
}
