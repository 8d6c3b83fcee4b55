package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

public class ParenthesizedExpression extends FieldInfoedNode {

    private final AdqlNode inner;

    public ParenthesizedExpression(AdqlNode inner) {
        super(NodeKind.PARENTHESIZED_EXPRESSION);
        this.inner = inner;
    }

    public AdqlNode getInner() {
        return inner;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(inner);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new ParenthesizedExpression(newChildren.get(0)));
    }

    @Override
    public String flatten() {
        return "(" + inner.flatten() + ")";
    }
}
