package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UI 元素（如 Window { title: "App", VBox { ... } }），仅出现在 component 体内
 */
public class UiElementExpr extends Expression {
    private final String type;
    private final Map<String, Expression> properties;
    private final List<UiElementExpr> children;

    /**
     * @param properties 按书写顺序排列的属性
     */
    public UiElementExpr(SourceLocation location, String type,
                         Map<String, Expression> properties, List<UiElementExpr> children) {
        super(location);
        this.type = type;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public String getType() {
        return type;
    }

    public Map<String, Expression> getProperties() {
        return properties;
    }

    public List<UiElementExpr> getChildren() {
        return children;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.UI_ELEMENT_EXPR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUiElementExpr(this, context);
    }
}
