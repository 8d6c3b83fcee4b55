package me.christianrobert.adqlpg.transformer.region;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.morph.MorphHandler;
import me.christianrobert.adqlpg.transformer.morph.Morpher;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.StringLiteral;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered chain of {@link RegionResolver}s replacing {@code REGION('...')} calls.
 * <p>
 * The STC-S resolver is registered by default; further resolvers are tried
 * after it in registration order. The first non-null result wins.
 * </p>
 */
@ApplicationScoped
public class RegionResolverRegistry {

    private static final Logger log = LoggerFactory.getLogger(RegionResolverRegistry.class);

    private final List<RegionResolver> resolvers = new CopyOnWriteArrayList<>();

    public RegionResolverRegistry() {
        resolvers.add(new StcsRegionResolver());
    }

    public void register(RegionResolver resolver) {
        log.debug("Registering region resolver {}", resolver.getClass().getSimpleName());
        resolvers.add(resolver);
    }

    public List<RegionResolver> getResolvers() {
        return List.copyOf(resolvers);
    }

    /**
     * Resolves one region specification.
     *
     * @throws RegionException if no resolver understands it
     */
    public AdqlNode resolve(String specification) {
        for (RegionResolver resolver : resolvers) {
            AdqlNode result = resolver.resolve(specification);
            if (result != null) {
                log.trace("'{}' resolved by {}", specification, resolver.getClass().getSimpleName());
                return result;
            }
        }
        throw new RegionException("'" + specification + "' is not a region specification I understand.");
    }

    /**
     * Replaces every REGION call in the tree.
     */
    public AdqlNode resolveAll(AdqlNode tree) {
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.REGION, (node, state) -> {
            AdqlNode argument = ((FunctionNode) node).getArg(0);
            if (!(argument instanceof StringLiteral)) {
                throw new RegionException("'" + node.flatten() + "' is not a Region expression I understand");
            }
            return resolve(((StringLiteral) argument).getValue());
        });
        return new Morpher(handlers).morph(tree).getNode();
    }
}
