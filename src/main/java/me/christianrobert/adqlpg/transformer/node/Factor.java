package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * A signed numeric primary. Unsigned factors are collapsed into their primary.
 */
public class Factor extends FieldInfoedNode {

    private final String sign;
    private final AdqlNode primary;

    public Factor(String sign, AdqlNode primary) {
        super(NodeKind.FACTOR);
        this.sign = sign;
        this.primary = primary;
    }

    public String getSign() {
        return sign;
    }

    public AdqlNode getPrimary() {
        return primary;
    }

    @Override
    public List<AdqlNode> children() {
        return List.of(primary);
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, 1);
        return carryAnnotation(new Factor(sign, newChildren.get(0)));
    }

    @Override
    public String flatten() {
        return sign + primary.flatten();
    }
}
