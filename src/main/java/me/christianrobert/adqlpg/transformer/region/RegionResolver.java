package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;

/**
 * Turns the argument of {@code REGION('...')} into a geometry.
 * <p>
 * By convention a specification starts with a word identifying its kind
 * (an STC-S shape, {@code simbad}, ...), separated from the rest by whitespace.
 * </p>
 */
@FunctionalInterface
public interface RegionResolver {

    /**
     * @return the replacement node, or null if this resolver does not understand the specification
     * @throws me.christianrobert.adqlpg.transformer.context.RegionException if the
     *         specification is meant for this resolver but invalid
     */
    AdqlNode resolve(String specification);
}
