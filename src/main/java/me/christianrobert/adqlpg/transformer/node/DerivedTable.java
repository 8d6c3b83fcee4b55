package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A subquery in a FROM clause. The correlation name is mandatory.
 */
public class DerivedTable extends ColumnBearingNode {

    private final Subquery subquery;
    private final Identifier alias;

    public DerivedTable(Subquery subquery, Identifier alias) {
        super(NodeKind.DERIVED_TABLE);
        if (alias == null) {
            throw new IllegalArgumentException("A derived table needs a correlation name");
        }
        this.subquery = subquery;
        this.alias = alias;
    }

    public Subquery getSubquery() {
        return subquery;
    }

    public Identifier getAlias() {
        return alias;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(subquery);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new DerivedTable((Subquery) newChildren.get(0), alias));
    }

    @Override
    public String flatten() {
        return subquery.flatten() + " AS " + alias.flatten();
    }
}
