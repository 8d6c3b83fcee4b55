package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * Query expressions combined with UNION, INTERSECT and EXCEPT, evaluated left to right
 * (INTERSECT binds tighter and is nested by the builder).
 */
public class SetExpression extends ColumnBearingNode {

    private final List<AdqlNode> operands;
    private final List<String> operators;
    private final Integer limit;

    /**
     * @param operators one per gap between operands, e.g. {@code UNION ALL}
     * @param limit trailing LIMIT produced by the syntax pass, null in ADQL
     */
    public SetExpression(List<AdqlNode> operands, List<String> operators, Integer limit) {
        super(NodeKind.SET_EXPRESSION);
        if (operands.size() < 2 || operands.size() != operators.size() + 1) {
            throw new IllegalArgumentException("Set expression needs n operands and n-1 operators");
        }
        this.operands = List.copyOf(operands);
        this.operators = List.copyOf(operators);
        this.limit = limit;
    }

    public List<AdqlNode> getOperands() {
        return operands;
    }

    public List<String> getOperators() {
        return operators;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<String> getContributingNames() {
        return TableName.collectNames(this);
    }

    public SetExpression withLimit(Integer newLimit) {
        return carryAnnotation(new SetExpression(operands, operators, newLimit));
    }

    public SetExpression withOperands(List<AdqlNode> newOperands) {
        return carryAnnotation(new SetExpression(newOperands, operators, limit));
    }

    @Override
    public List<AdqlNode> children() {
        return operands;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, operands.size());
        return withOperands(newChildren);
    }

    @Override
    public String flatten() {
        StringBuilder sb = new StringBuilder(operands.get(0).flatten());
        for (int i = 0; i < operators.size(); i++) {
            sb.append(' ').append(operators.get(i)).append(' ').append(operands.get(i + 1).flatten());
        }
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }
        return sb.toString();
    }
}
