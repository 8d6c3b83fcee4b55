package me.christianrobert.adqlpg.transformer.node;

import java.math.BigDecimal;
import java.util.List;

public class NumericLiteral extends FieldInfoedNode {

    private final String text;

    public NumericLiteral(String text) {
        super(NodeKind.NUMERIC_LITERAL);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public BigDecimal getValue() {
        return new BigDecimal(text);
    }

    public boolean isInteger() {
        return text.chars().allMatch(Character::isDigit);
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
        return text;
    }
}
