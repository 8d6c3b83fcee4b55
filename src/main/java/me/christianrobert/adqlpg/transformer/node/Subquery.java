package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A parenthesized query expression.
 */
public class Subquery extends ColumnBearingNode {

    private final AdqlNode query;

    public Subquery(AdqlNode query) {
        super(NodeKind.SUBQUERY);
        this.query = query;
    }

    public AdqlNode getQuery() {
        return query;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(query);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new Subquery(newChildren.get(0)));
    }

    @Override
    public String flatten() {
        return "(" + query.flatten() + ")";
    }
}
