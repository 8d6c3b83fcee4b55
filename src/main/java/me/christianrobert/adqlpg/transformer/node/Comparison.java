package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * {@code op1 <operator> op2} with one of =, !=, &lt;&gt;, &lt;, &gt;, &lt;=, &gt;=.
 */
public class Comparison extends AdqlNode {

    private final AdqlNode op1;
    private final String operator;
    private final AdqlNode op2;

    public Comparison(AdqlNode op1, String operator, AdqlNode op2) {
        super(NodeKind.COMPARISON);
        this.op1 = op1;
        this.operator = operator;
        this.op2 = op2;
    }

    public AdqlNode getOp1() {
        return op1;
    }

    public String getOperator() {
        return operator;
    }

    public AdqlNode getOp2() {
        return op2;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(op1, op2);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 2);
        return new Comparison(newChildren.get(0), operator, newChildren.get(1));
    }

    @Override
    public String flatten() {
        return op1.flatten() + " " + operator + " " + op2.flatten();
    }
}
