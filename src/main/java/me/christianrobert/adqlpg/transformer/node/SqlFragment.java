package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * Pre-rendered target SQL standing in for the node it replaced.
 * Keeps the kind and frame of the original so later handlers can still reason about it.
 */
public class SqlFragment extends FieldInfoedNode {

    private final String sql;
    private final NodeKind sourceKind;
    private final String frame;

    public SqlFragment(String sql, NodeKind sourceKind, String frame) {
        super(NodeKind.SQL_FRAGMENT);
        this.sql = sql;
        this.sourceKind = sourceKind;
        this.frame = frame;
    }

    /**
     * Fragment replacing {@code original}; carries over its annotation.
     */
    public static SqlFragment replacing(AdqlNode original, String sql) {
        String frame = original instanceof GeometryNode ? ((GeometryNode) original).getFrame()
                : original instanceof SqlFragment ? ((SqlFragment) original).getFrame() : null;
        NodeKind sourceKind = original instanceof SqlFragment
                ? ((SqlFragment) original).getSourceKind() : original.kind();
        SqlFragment fragment = new SqlFragment(sql, sourceKind, frame);
        if (original instanceof FieldInfoed) {
            fragment.setFieldInfo(((FieldInfoed) original).getFieldInfo());
        }
        return fragment;
    }

    public String getSql() {
        return sql;
    }

    public NodeKind getSourceKind() {
        return sourceKind;
    }

    public String getFrame() {
        return frame;
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
        return sql;
    }
}
