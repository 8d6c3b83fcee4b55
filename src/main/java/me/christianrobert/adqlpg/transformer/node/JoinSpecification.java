package me.christianrobert.adqlpg.transformer.node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code ON condition} or {@code USING (columns)}.
 */
public class JoinSpecification extends AdqlNode {

    private final AdqlNode condition;
    private final List<Identifier> usingColumns;

    private JoinSpecification(AdqlNode condition, List<Identifier> usingColumns) {
        super(NodeKind.JOIN_SPECIFICATION);
        this.condition = condition;
        this.usingColumns = usingColumns;
    }

    public static JoinSpecification on(AdqlNode condition) {
        return new JoinSpecification(condition, null);
    }

    public static JoinSpecification using(List<Identifier> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("USING needs at least one column");
        }
        return new JoinSpecification(null, List.copyOf(columns));
    }

    public boolean isUsing() {
        return usingColumns != null;
    }

    public AdqlNode getCondition() {
        return condition;
    }

    public List<Identifier> getUsingColumns() {
        return usingColumns;
    }

    @Override
    public List<AdqlNode> children() {
        return condition == null ? List.of() : List.of(condition);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, children().size());
        return condition == null ? this : new JoinSpecification(newChildren.get(0), null);
    }

    @Override
    public String flatten() {
        if (condition != null) {
            return "ON " + condition.flatten();
        }
        return "USING (" + usingColumns.stream().map(Identifier::flatten).collect(Collectors.joining(", ")) + ")";
    }
}
