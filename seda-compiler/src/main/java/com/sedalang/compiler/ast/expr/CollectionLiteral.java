package com.sedalang.compiler.ast.expr;

import com.sedalang.compiler.ast.AstVisitor;
import com.sedalang.compiler.ast.NodeKind;
import com.sedalang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 集合字面量（如 [1, 2, 3], {"a": 1, "b": 2}）
 */
public class CollectionLiteral extends Expression {
    private final CollectionKind kind;
    private final List<Expression> elements;
    private final List<MapEntry> mapEntries;  // 仅 MAP，保持书写顺序

    public CollectionLiteral(SourceLocation location, CollectionKind kind,
                             List<Expression> elements, List<MapEntry> mapEntries) {
        super(location);
        this.kind = kind;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.mapEntries = Collections.unmodifiableList(new ArrayList<>(mapEntries));
    }

    public static CollectionLiteral array(SourceLocation location, List<Expression> elements) {
        return new CollectionLiteral(location, CollectionKind.ARRAY, elements,
                Collections.<MapEntry>emptyList());
    }

    public static CollectionLiteral map(SourceLocation location, List<MapEntry> entries) {
        return new CollectionLiteral(location, CollectionKind.MAP,
                Collections.<Expression>emptyList(), entries);
    }

    public CollectionKind getKind() {
        return kind;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public List<MapEntry> getMapEntries() {
        return mapEntries;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.COLLECTION_LITERAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCollectionLiteral(this, context);
    }

    /**
     * 集合类型
     */
    public enum CollectionKind {
        ARRAY,
        MAP
    }

    /**
     * Map 条目
     */
    public static final class MapEntry {
        private final Expression key;
        private final Expression value;

        public MapEntry(Expression key, Expression value) {
            this.key = key;
            this.value = value;
        }

        public Expression getKey() {
            return key;
        }

        public Expression getValue() {
            return value;
        }
    }
}
