package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * Select list entry: an expression with an optional alias.
 */
public class DerivedColumn extends FieldInfoedNode {

    private final AdqlNode expression;
    private final Identifier alias;
    private final String generatedName;

    /**
     * @param generatedName name used when there is no alias and the expression is not a column reference
     */
    public DerivedColumn(AdqlNode expression, Identifier alias, String generatedName) {
        super(NodeKind.DERIVED_COLUMN);
        this.expression = expression;
        this.alias = alias;
        this.generatedName = generatedName;
    }

    public AdqlNode getExpression() {
        return expression;
    }

    public Identifier getAlias() {
        return alias;
    }

    public String getGeneratedName() {
        return generatedName;
    }

    /**
     * Output name: the alias, the name of a bare column reference, or the generated name.
     */
    public String getName() {
        if (alias != null) {
            return alias.normalized();
        }
        if (expression instanceof ColumnReference) {
            return ((ColumnReference) expression).getColumnName();
        }
        return generatedName;
    }

    public DerivedColumn withAlias(Identifier newAlias) {
        return carryAnnotation(new DerivedColumn(expression, newAlias, generatedName));
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(expression);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new DerivedColumn(newChildren.get(0), alias, generatedName));
    }

    @Override
    public String flatten() {
        return alias == null ? expression.flatten() : expression.flatten() + " AS " + alias.flatten();
    }
}
