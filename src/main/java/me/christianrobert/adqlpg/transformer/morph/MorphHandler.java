package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;

/**
 * Rewrites one node whose children have already been morphed.
 * Returns the replacement, which may be the node itself; never null.
 */
@FunctionalInterface
public interface MorphHandler {

    AdqlNode morph(AdqlNode node, MorphState state);
}
