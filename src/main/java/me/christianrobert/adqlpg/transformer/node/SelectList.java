package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

public class SelectList extends AdqlNode {

    private final boolean star;
    private final List<AdqlNode> items;

    private SelectList(boolean star, List<AdqlNode> items) {
        super(NodeKind.SELECT_LIST);
        this.star = star;
        this.items = List.copyOf(items);
    }

    public static SelectList star() {
        return new SelectList(true, List.of());
    }

    /**
     * @param items {@link DerivedColumn} and {@link QualifiedStar} nodes
     */
    public static SelectList of(List<AdqlNode> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Select list cannot be empty");
        }
        return new SelectList(false, items);
    }

    public boolean isStar() {
        return star;
    }

    public List<AdqlNode> getItems() {
        return items;
    }

    @Override
    public List<AdqlNode> children() {
        return items;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, items.size());
        return star ? this : new SelectList(false, newChildren);
    }

    @Override
    public String flatten() {
        if (star) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        for (AdqlNode item : items) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(item.flatten());
        }
        return sb.toString();
    }
}
