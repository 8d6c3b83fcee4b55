package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * {@code table.*} in a select list.
 */
public class QualifiedStar extends AdqlNode {

    private final List<Identifier> qualifierParts;

    public QualifiedStar(List<Identifier> qualifierParts) {
        super(NodeKind.QUALIFIED_STAR);
        if (qualifierParts.isEmpty() || qualifierParts.size() > 3) {
            throw new IllegalArgumentException("Table qualifier needs 1 to 3 name parts");
        }
        this.qualifierParts = List.copyOf(qualifierParts);
    }

    public List<Identifier> getQualifierParts() {
        return qualifierParts;
    }

    public String getQualifier() {
        return Identifier.normalizeAll(qualifierParts);
    }

    public QualifiedStar withQualifierParts(List<Identifier> newParts) {
        return new QualifiedStar(newParts);
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
        return Identifier.flattenAll(qualifierParts) + ".*";
    }
}
