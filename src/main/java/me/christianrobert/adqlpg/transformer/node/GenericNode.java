package me.christianrobert.adqlpg.transformer.node;

import java.util.List;

/**
 * Node whose structure is fully described by its kind and children, e.g. clauses
 * and predicates. Keywords are kept as {@link Lexeme} children.
 */
public class GenericNode extends AdqlNode {

    private final List<AdqlNode> children;

    public GenericNode(NodeKind kind, List<AdqlNode> children) {
        super(kind);
        this.children = List.copyOf(children);
    }

    @Override
    public List<AdqlNode> children() {
        return children;
    }

    @Override
    public AdqlNode withChildren(List<AdqlNode> newChildren) {
        checkChildCount(newChildren, children.size());
        return carryAnnotation(new GenericNode(kind(), newChildren));
    }
}
