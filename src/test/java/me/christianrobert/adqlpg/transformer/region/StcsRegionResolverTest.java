package me.christianrobert.adqlpg.transformer.region;

import me.christianrobert.adqlpg.transformer.context.RegionException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.CompoundRegion;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StcsRegionResolverTest {

    private final StcsRegionResolver resolver = new StcsRegionResolver();

    @Test
    void circleWithFrame() {
        // When
        AdqlNode node = resolver.resolve("Circle ICRS 10 20 0.5");

        // Then
        assertEquals(NodeKind.CIRCLE, node.kind());
        assertEquals("ICRS", ((GeometryNode) node).getFrame());
        assertEquals("CIRCLE('ICRS', 10, 20, 0.5)", node.flatten());
    }

    @Test
    void positionBecomesPoint() {
        AdqlNode node = resolver.resolve("Position GALACTIC 1.5 -3");

        assertEquals(NodeKind.POINT, node.kind());
        assertEquals("POINT('GALACTIC', 1.5, -3)", node.flatten());
    }

    @Test
    void frameIsOptional() {
        GeometryNode node = (GeometryNode) resolver.resolve("box 10 20 1 2");

        assertEquals(NodeKind.BOX, node.kind());
        assertEquals("", node.getFrame());
    }

    @Test
    void referencePositionFlavorAndUnitAreSkipped() {
        AdqlNode node = resolver.resolve("Polygon ICRS TOPOCENTER SPHERICAL2 1 2 3 4 5 6 unit deg");

        assertEquals("POLYGON('ICRS', 1, 2, 3, 4, 5, 6)", node.flatten());
    }

    @Test
    void equinoxNamesMapToFrames() {
        assertEquals("FK5", ((GeometryNode) resolver.resolve("Circle J2000 1 2 3")).getFrame());
        assertEquals("FK4", ((GeometryNode) resolver.resolve("Circle B1950 1 2 3")).getFrame());
    }

    @Test
    void unionOperandsInheritFrame() {
        // When
        AdqlNode node = resolver.resolve("Union ICRS (Circle 10 20 1 Box 1 2 3 4)");

        // Then
        assertEquals(NodeKind.REGION_UNION, node.kind());
        CompoundRegion union = (CompoundRegion) node;
        assertEquals("ICRS", union.getFrame());
        assertEquals(2, union.getOperands().size());
        assertEquals("ICRS", ((GeometryNode) union.getOperands().get(0)).getFrame());
        assertEquals("ICRS", ((GeometryNode) union.getOperands().get(1)).getFrame());
        assertEquals("Union ICRS (Circle 10 20 1 Box 1 2 3 4)", union.getSourceText());
    }

    @Test
    void nestedCompounds() {
        CompoundRegion node = (CompoundRegion) resolver.resolve(
                "Intersection ICRS (Circle 10 20 1 Not (Circle 10 20 0.5))");

        assertEquals(NodeKind.REGION_INTERSECTION, node.kind());
        CompoundRegion negation = (CompoundRegion) node.getOperands().get(1);
        assertEquals(NodeKind.REGION_NOT, negation.kind());
        assertNull(negation.getSourceText());
        assertEquals("ICRS", negation.getFrame());
    }

    @Test
    void operandFrameOverridesInherited() {
        CompoundRegion node = (CompoundRegion) resolver.resolve(
                "Union ICRS (Circle GALACTIC 10 20 1 Circle 1 2 3)");

        assertEquals("GALACTIC", ((GeometryNode) node.getOperands().get(0)).getFrame());
        assertEquals("ICRS", ((GeometryNode) node.getOperands().get(1)).getFrame());
    }

    @Test
    void unknownLeadingWordIsNotHandled() {
        assertNull(resolver.resolve("simbad M 31"));
        assertNull(resolver.resolve("   "));
    }

    @Test
    void wrongNumberOfCoordinatesFails() {
        RegionException e = assertThrows(RegionException.class, () -> resolver.resolve("Circle ICRS 10 20"));
        assertTrue(e.getMessage().startsWith("Invalid STC-S region 'Circle ICRS 10 20'"), e.getMessage());
    }

    @Test
    void unionNeedsTwoOperands() {
        RegionException e = assertThrows(RegionException.class,
                () -> resolver.resolve("Union ICRS (Circle 10 20 1)"));
        assertTrue(e.getMessage().contains("Union cannot have 1 operands"), e.getMessage());
    }

    @Test
    void trailingGarbageFails() {
        assertThrows(RegionException.class, () -> resolver.resolve("Circle ICRS 10 20 1 banana"));
    }

    @Test
    void unsupportedUnitFails() {
        RegionException e = assertThrows(RegionException.class,
                () -> resolver.resolve("Circle ICRS 10 20 1 unit rad"));
        assertTrue(e.getMessage().contains("only deg is supported"), e.getMessage());
    }

    @Test
    void unclosedCompoundFails() {
        assertThrows(RegionException.class, () -> resolver.resolve("Union ICRS (Circle 10 20 1 Circle 1 2 3"));
    }
}
