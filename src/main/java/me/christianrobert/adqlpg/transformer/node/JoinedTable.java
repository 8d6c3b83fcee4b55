package me.christianrobert.adqlpg.transformer.node;

import java.util.ArrayList;
import java.util.List;

/**
 * A binary join. Chains of joins are folded to the left:
 * {@code a JOIN b JOIN c} is {@code (a JOIN b) JOIN c}.
 */
public class JoinedTable extends ColumnBearingNode {

    private final AdqlNode left;
    private final AdqlNode right;
    private final boolean natural;
    private final String joinType;
    private final JoinSpecification specification;
    private final boolean parenthesized;

    /**
     * @param joinType INNER, LEFT, LEFT OUTER, ... as written; null for a plain JOIN
     * @param specification ON or USING part, null for natural and cross joins
     */
    public JoinedTable(AdqlNode left, AdqlNode right, boolean natural, String joinType,
                       JoinSpecification specification, boolean parenthesized) {
        super(NodeKind.JOINED_TABLE);
        if (natural && specification != null) {
            throw new IllegalArgumentException("A NATURAL join cannot have an ON or USING clause");
        }
        this.left = left;
        this.right = right;
        this.natural = natural;
        this.joinType = joinType;
        this.specification = specification;
        this.parenthesized = parenthesized;
    }

    public AdqlNode getLeft() {
        return left;
    }

    public AdqlNode getRight() {
        return right;
    }

    public boolean isNatural() {
        return natural;
    }

    public String getJoinType() {
        return joinType;
    }

    public JoinSpecification getSpecification() {
        return specification;
    }

    public boolean isParenthesized() {
        return parenthesized;
    }

    public JoinedTable asParenthesized() {
        return carryAnnotation(new JoinedTable(left, right, natural, joinType, specification, true));
    }

    @Override
    public List<AdqlNode> children() {
        List<AdqlNode> result = new ArrayList<>();
        result.add(left);
        result.add(right);
        if (specification != null) {
            result.add(specification);
        }
        return result;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, specification == null ? 2 : 3);
        JoinSpecification newSpec = specification == null ? null : (JoinSpecification) newChildren.get(2);
        return carryAnnotation(new JoinedTable(newChildren.get(0), newChildren.get(1), natural, joinType,
                newSpec, parenthesized));
    }

    @Override
    public String flatten() {
        StringBuilder sb = new StringBuilder(left.flatten()).append(' ');
        if (natural) {
            sb.append("NATURAL ");
        }
        if (joinType != null) {
            sb.append(joinType).append(' ');
        }
        sb.append("JOIN ").append(right.flatten());
        if (specification != null) {
            sb.append(' ').append(specification.flatten());
        }
        return parenthesized ? "(" + sb + ")" : sb.toString();
    }
}
