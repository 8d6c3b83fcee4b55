package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A catalog table in a FROM clause, optionally with a correlation name.
 */
public class PlainTableRef extends ColumnBearingNode {

    private final TableName tableName;
    private final Identifier alias;

    public PlainTableRef(TableName tableName, Identifier alias) {
        super(NodeKind.PLAIN_TABLE_REFERENCE);
        this.tableName = tableName;
        this.alias = alias;
    }

    public TableName getTableName() {
        return tableName;
    }

    public Identifier getAlias() {
        return alias;
    }

    /** The name columns refer to this table by. */
    public String getReferenceName() {
        return alias != null ? alias.normalized() : tableName.getQualifiedName();
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(tableName);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new PlainTableRef((TableName) newChildren.get(0), alias));
    }

    @Override
    public String flatten() {
        return alias == null ? tableName.flatten() : tableName.flatten() + " AS " + alias.flatten();
    }
}
