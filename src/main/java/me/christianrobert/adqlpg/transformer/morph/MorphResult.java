package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;

import java.util.List;

/**
 * Outcome of a morph pass: the new tree and the state the pass ended with.
 */
public class MorphResult {

    private final MorphState state;
    private final AdqlNode node;

    public MorphResult(MorphState state, AdqlNode node) {
        this.state = state;
        this.node = node;
    }

    public MorphState getState() {
        return state;
    }

    public AdqlNode getNode() {
        return node;
    }

    public List<String> getWarnings() {
        return state.getWarnings();
    }
}
