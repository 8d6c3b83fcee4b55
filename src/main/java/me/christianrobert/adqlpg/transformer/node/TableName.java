package me.christianrobert.adqlpg.transformer.node;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code [[catalog.]schema.]table}.
 */
public class TableName extends AdqlNode {

    private final List<Identifier> parts;

    public TableName(List<Identifier> parts) {
        super(NodeKind.TABLE_NAME);
        if (parts.isEmpty() || parts.size() > 3) {
            throw new IllegalArgumentException("Table name needs 1 to 3 name parts, got " + parts.size());
        }
        this.parts = List.copyOf(parts);
    }

    public List<Identifier> getParts() {
        return parts;
    }

    public Identifier getTable() {
        return parts.get(parts.size() - 1);
    }

    /** Schema part, null if not given. */
    public Identifier getSchema() {
        return parts.size() >= 2 ? parts.get(parts.size() - 2) : null;
    }

    /** Catalog part, null if not given. */
    public Identifier getCatalog() {
        return parts.size() == 3 ? parts.get(0) : null;
    }

    /**
     * Normalized, dot-joined name used for catalog lookups and qualifier matching.
     */
    public String getQualifiedName() {
        return Identifier.normalizeAll(parts);
    }

    public TableName withParts(List<Identifier> newParts) {
        return new TableName(newParts);
    }

    /**
     * Every table name referenced below a node, in order of appearance, without duplicates.
     */
    public static List<String> collectNames(AdqlNode root) {
        Set<String> names = new LinkedHashSet<>();
        for (AdqlNode node : root.findAll(NodeKind.TABLE_NAME)) {
            names.add(((TableName) node).getQualifiedName());
        }
        return List.copyOf(names);
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
