package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

public class FromClause extends AdqlNode {

    private final List<AdqlNode> tables;

    public FromClause(List<AdqlNode> tables) {
        super(NodeKind.FROM_CLAUSE);
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("FROM clause needs at least one table");
        }
        this.tables = List.copyOf(tables);
    }

    public List<AdqlNode> getTables() {
        return tables;
    }

    @Override
    public List<AdqlNode> children() {
        return tables;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, tables.size());
        return new FromClause(newChildren);
    }

    @Override
    public String flatten() {
        StringBuilder sb = new StringBuilder("FROM ");
        for (int i = 0; i < tables.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(tables.get(i).flatten());
        }
        return sb.toString();
    }
}
