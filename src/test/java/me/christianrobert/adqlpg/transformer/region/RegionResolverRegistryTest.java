package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.StringLiteral;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.adqlpg.transformer.TestFixtures.parse;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RegionResolverRegistryTest {

    @Test
    void stcsResolverIsRegisteredByDefault() {
        RegionResolverRegistry registry = new RegionResolverRegistry();

        assertEquals(1, registry.getResolvers().size());
        assertInstanceOf(StcsRegionResolver.class, registry.getResolvers().get(0));
        assertEquals(NodeKind.CIRCLE, registry.resolve("Circle ICRS 1 2 3").kind());
    }

    @Test
    void resolversAreTriedInOrder() {
        // Given
        RegionResolverRegistry registry = new RegionResolverRegistry();
        RegionResolver first = mock(RegionResolver.class);
        RegionResolver second = mock(RegionResolver.class);
        AdqlNode point = new GeometryNode(NodeKind.POINT, new StringLiteral("ICRS"),
                List.of(new NumericLiteral("1"), new NumericLiteral("2")));
        when(first.resolve("here")).thenReturn(null);
        when(second.resolve("here")).thenReturn(point);
        registry.register(first);
        registry.register(second);

        // When
        AdqlNode result = registry.resolve("here");

        // Then
        assertSame(point, result);
        verify(first).resolve("here");
        verify(second).resolve("here");
    }

    @Test
    void laterResolversAreNotAskedAfterAMatch() {
        RegionResolverRegistry registry = new RegionResolverRegistry();
        RegionResolver fallback = mock(RegionResolver.class);
        registry.register(fallback);

        registry.resolve("Circle ICRS 1 2 3");

        verifyNoInteractions(fallback);
    }

    @Test
    void unknownSpecificationFails() {
        RegionResolverRegistry registry = new RegionResolverRegistry();

        RegionException e = assertThrows(RegionException.class, () -> registry.resolve("somewhere nice"));
        assertEquals("'somewhere nice' is not a region specification I understand.", e.getMessage());
    }

    @Test
    void resolveAllReplacesRegionCalls() {
        // Given
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), REGION('Circle ICRS 10 20 1'))");

        // When
        AdqlNode resolved = new RegionResolverRegistry().resolveAll(tree);

        // Then
        assertEquals("SELECT alpha FROM ppmx.data"
                        + " WHERE 1 = CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 1))",
                resolved.flatten());
    }

    @Test
    void treeWithoutRegionsIsUnchanged() {
        AdqlNode tree = parse("SELECT alpha FROM ppmx.data");

        assertSame(tree, new RegionResolverRegistry().resolveAll(tree));
    }

    @Test
    void nonLiteralRegionArgumentFails() {
        AdqlNode tree = parse("SELECT REGION(alpha) FROM ppmx.data");

        RegionException e = assertThrows(RegionException.class, () -> new RegionResolverRegistry().resolveAll(tree));
        assertTrue(e.getMessage().endsWith("is not a Region expression I understand"));
    }
}
