package me.christianrobert.adqlpg.transformer.node;

import java.util.Arrays;
import java.util.List;

/**
 * A possibly qualified column name: {@code [[[catalog.]schema.]table.]column}.
 */
public class ColumnReference extends FieldInfoedNode {

    private final List<Identifier> parts;

    public ColumnReference(List<Identifier> parts) {
        super(NodeKind.COLUMN_REFERENCE);
        if (parts.isEmpty() || parts.size() > 4) {
            throw new IllegalArgumentException("Column reference needs 1 to 4 name parts, got " + parts.size());
        }
        this.parts = List.copyOf(parts);
    }

    public static ColumnReference of(String... names) {
        return new ColumnReference(Arrays.stream(names).map(Identifier::regular).toList());
    }

    public List<Identifier> getParts() {
        return parts;
    }

    public Identifier getColumn() {
        return parts.get(parts.size() - 1);
    }

    public String getColumnName() {
        return getColumn().normalized();
    }

    /**
     * Normalized qualifier (everything before the column name), null for bare names.
     */
    public String getQualifier() {
        if (parts.size() == 1) {
            return null;
        }
        return Identifier.normalizeAll(parts.subList(0, parts.size() - 1));
    }

    public List<Identifier> getQualifierParts() {
        return parts.subList(0, parts.size() - 1);
    }

    public ColumnReference withParts(List<Identifier> newParts) {
        return carryAnnotation(new ColumnReference(newParts));
    }

    @Override
    public List<AdqlNode> children() {
        return List.of();
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 0);
        return this;
    }

    @Override
    public String flatten() {
        return Identifier.flattenAll(parts);
    }
}
