package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * Operands joined by binary operators of one precedence level: numeric value
 * expressions (+, -), terms (*, /) and string concatenations (||).
 */
public class OperatorExpression extends FieldInfoedNode {

    private final List<AdqlNode> operands;
    private final List<String> operators;

    public OperatorExpression(NodeKind kind, List<AdqlNode> operands, List<String> operators) {
        super(kind);
        if (kind != NodeKind.NUMERIC_VALUE_EXPRESSION && kind != NodeKind.TERM
                && kind != NodeKind.CHARACTER_VALUE_EXPRESSION) {
            throw new IllegalArgumentException("Not an operator expression kind: " + kind);
        }
        if (operands.size() != operators.size() + 1) {
            throw new IllegalArgumentException("Operator expression needs one operator less than operands");
        }
        this.operands = List.copyOf(operands);
        this.operators = List.copyOf(operators);
    }

    public List<AdqlNode> getOperands() {
        return operands;
    }

    public List<String> getOperators() {
        return operators;
    }

    @Override
    public List<AdqlNode> children() {
        return operands;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        return carryAnnotation(new OperatorExpression(kind(), newChildren, operators));
    }

    @Override
    public String flatten() {
        StringBuilder sb = new StringBuilder(operands.get(0).flatten());
        for (int i = 0; i < operators.size(); i++) {
            sb.append(' ').append(operators.get(i)).append(' ').append(operands.get(i + 1).flatten());
        }
        return sb.toString();
    }
}
