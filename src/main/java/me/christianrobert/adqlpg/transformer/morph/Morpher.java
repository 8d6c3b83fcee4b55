package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Postorder tree rewriter driven by a table of handlers per node kind.
 * <p>
 * Children are morphed first. If any child was replaced, the node is rebuilt
 * with {@link AdqlNode#withChildren(List)}; the input tree is never modified.
 * Then the handler registered for the kind of the (possibly rebuilt) node runs
 * and its result replaces the node. Results of a handler are not morphed again.
 * </p>
 */
public class Morpher {

    private final Map<NodeKind, MorphHandler> handlers;

    public Morpher(Map<NodeKind, MorphHandler> handlers) {
        this.handlers = handlers.isEmpty() ? new EnumMap<>(NodeKind.class) : new EnumMap<>(handlers);
    }

    public MorphResult morph(AdqlNode tree) {
        return morph(tree, new MorphState());
    }

    public MorphResult morph(AdqlNode tree, MorphState state) {
        AdqlNode result = traverse(tree, state);
        return new MorphResult(state, result);
    }

    private AdqlNode traverse(AdqlNode node, MorphState state) {
        List<AdqlNode> children = node.children();
        List<AdqlNode> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (AdqlNode child : children) {
            AdqlNode newChild = traverse(child, state);
            changed |= newChild != child;
            newChildren.add(newChild);
        }
        AdqlNode current = changed ? node.withChildren(newChildren) : node;

        MorphHandler handler = handlers.get(current.kind());
        if (handler == null) {
            return current;
        }
        AdqlNode replacement = handler.morph(current, state);
        if (replacement == null) {
            throw new IllegalStateException("Morph handler for " + current.kind() + " returned null");
        }
        return replacement;
    }
}
