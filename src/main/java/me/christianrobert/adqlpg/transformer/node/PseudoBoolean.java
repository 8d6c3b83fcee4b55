package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A translated CONTAINS or INTERSECTS call. ADQL treats these as integers
 * (1 or 0) while the target SQL has boolean operators.
 * <p>
 * When compared with 0 or 1 the enclosing comparison is replaced by the
 * boolean SQL. Anywhere else it renders as its integer-valued form.
 * </p>
 */
public class PseudoBoolean extends FieldInfoedNode {

    private final AdqlNode functionForm;
    private final String booleanSql;

    public PseudoBoolean(AdqlNode functionForm, String booleanSql) {
        super(NodeKind.PSEUDO_BOOLEAN);
        this.functionForm = functionForm;
        this.booleanSql = booleanSql;
    }

    public String getBooleanSql() {
        return booleanSql;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(functionForm);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new PseudoBoolean(newChildren.get(0), booleanSql));
    }

    @Override
    public String flatten() {
        return functionForm.flatten();
    }
}
