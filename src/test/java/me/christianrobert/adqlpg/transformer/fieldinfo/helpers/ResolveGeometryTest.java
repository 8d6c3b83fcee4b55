package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.AnnotationContext;
import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolveGeometryTest {

    private static final FieldInfo RA = FieldInfo.forColumn("deg", "pos.eq.ra", "ICRS", "t.ra");
    private static final FieldInfo DEC = FieldInfo.forColumn("deg", "pos.eq.dec", "ICRS", "t.dec");

    private final AnnotationContext context = new AnnotationContext(name -> List.of());

    @Test
    void pointUnitsAreJoined() {
        FieldInfo point = ResolveGeometry.constructor("POINT", "ICRS", List.of(RA, DEC), context);

        assertEquals("deg,deg", point.getUnit());
        assertEquals("", point.getUcd());
        assertEquals("ICRS", point.getStc());
        assertFalse(context.hasErrors());
    }

    @Test
    void literalsOnlyGiveEmptyUnit() {
        FieldInfo circle = ResolveGeometry.constructor("CIRCLE", "ICRS",
                List.of(FieldInfo.DIMENSIONLESS, FieldInfo.DIMENSIONLESS, FieldInfo.DIMENSIONLESS), context);

        assertEquals("", circle.getUnit());
    }

    @Test
    void incompatibleArgumentIsAnError() {
        ResolveGeometry.constructor("POINT", "GALACTIC", List.of(FieldInfo.DIMENSIONLESS, DEC), context);

        assertEquals(List.of("When constructing POINT: Argument 2 has incompatible STC"), context.getErrors());
    }

    @Test
    void coordinatesTakeTheirUnitAndColumn() {
        FieldInfo point = ResolveGeometry.constructor("POINT", "ICRS", List.of(RA, DEC), context);

        FieldInfo second = ResolveGeometry.coordinate(1, point);

        assertEquals("deg", second.getUnit());
        assertEquals(List.of("t.dec"), second.getUserData());
    }

    @Test
    void coordinateOfOpaquePointHasNoUnit() {
        assertEquals("", ResolveGeometry.coordinate(0, FieldInfo.DIMENSIONLESS).getUnit());
    }

    @Test
    void areaAndCoordSys() {
        assertEquals("deg**2", ResolveGeometry.area(FieldInfo.DIMENSIONLESS).getUnit());
        assertEquals("meta.ref;pos.frame", ResolveGeometry.coordSys().getUcd());
    }
}
