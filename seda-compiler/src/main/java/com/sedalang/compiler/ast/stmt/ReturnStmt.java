package com.sedalang.compiler.ast.stmt;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;
import com.sedalang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * return 语句，可返回零个或多个值
 */
public class ReturnStmt extends Statement {
    private final List<Expression> values;

    public ReturnStmt(SourceLocation location, List<Expression> values) {
        super(location);
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Expression> getValues() {
        return values;
    }

    public boolean hasValue() {
        return !values.isEmpty();
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.RETURN_STMT;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStmt(this, context);
    }
}
