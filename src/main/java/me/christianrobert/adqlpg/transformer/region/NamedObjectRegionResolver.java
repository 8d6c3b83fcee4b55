package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.StringLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Resolves {@code REGION('simbad M 31')} style specifications into an ICRS point
 * using an {@link ObjectPositionLookup}.
 * <p>
 * Whitespace inside the object name is removed before the lookup.
 * </p>
 */
public class NamedObjectRegionResolver implements RegionResolver {

    private static final Logger log = LoggerFactory.getLogger(NamedObjectRegionResolver.class);

    private final String service;
    private final ObjectPositionLookup lookup;

    /**
     * @param service the leading word selecting this resolver, matched case-insensitively
     */
    public NamedObjectRegionResolver(String service, ObjectPositionLookup lookup) {
        this.service = service;
        this.lookup = lookup;
    }

    @Override
    public AdqlNode resolve(String specification) {
        String[] words = specification.trim().split("\\s+");
        if (words.length == 0 || !words[0].equalsIgnoreCase(service)) {
            return null;
        }
        String objectName = String.join("", List.of(words).subList(1, words.length));
        if (objectName.isEmpty()) {
            throw new RegionException("No object name given in '" + specification + "'");
        }

        log.debug("Looking up position of {} via {}", objectName, service);
        double[] position = lookup.getPosition(objectName);
        if (position == null) {
            throw new RegionException("No " + service + " position for '" + objectName + "'");
        }
        return new GeometryNode(NodeKind.POINT, new StringLiteral("ICRS"), List.of(
                new NumericLiteral(String.format(Locale.ROOT, "%.10f", position[0])),
                new NumericLiteral(String.format(Locale.ROOT, "%.10f", position[1]))));
    }
}
