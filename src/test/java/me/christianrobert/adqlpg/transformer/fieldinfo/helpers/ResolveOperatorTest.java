package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.AnnotationContext;
import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolveOperatorTest {

    private static final FieldInfo RA = FieldInfo.forColumn("deg", "pos.eq.ra", "ICRS", "t.ra");
    private static final FieldInfo GLON = FieldInfo.forColumn("deg", "pos.galactic.lon", "GALACTIC", "t.glon");
    private static final FieldInfo PM = FieldInfo.forColumn("mas/yr", "pos.pm", null, "t.pm");
    private static final FieldInfo TIME = FieldInfo.forColumn("yr", "time.epoch", null, "t.epoch");

    private AnnotationContext context;

    @BeforeEach
    void setUp() {
        context = new AnnotationContext(name -> List.of());
    }

    @Test
    void constantFactorKeepsUnitAndTaints() {
        FieldInfo result = ResolveOperator.multiply("*", RA, FieldInfo.DIMENSIONLESS, context);

        assertEquals("deg", result.getUnit());
        assertEquals("pos.eq.ra", result.getUcd());
        assertTrue(result.isTainted());
    }

    @Test
    void productOfDimensionalValuesLosesUcd() {
        FieldInfo result = ResolveOperator.multiply("*", PM, TIME, context);

        assertEquals("mas/yr*yr", result.getUnit());
        assertEquals("", result.getUcd());
        assertFalse(result.isTainted());
        assertEquals(List.of("t.pm", "t.epoch"), result.getUserData());
    }

    @Test
    void compoundDivisorIsParenthesized() {
        FieldInfo result = ResolveOperator.multiply("/", TIME, PM, context);

        assertEquals("yr/(mas/yr)", result.getUnit());
    }

    @Test
    void multiplicativeFoldsLeftToRight() {
        FieldInfo result = ResolveOperator.multiplicative(List.of(PM, TIME, TIME), List.of("*", "/"), context);

        assertEquals("mas/yr*yr/yr", result.getUnit());
    }

    @Test
    void sumOfEqualMetadataKeepsIt() {
        FieldInfo result = ResolveOperator.add(RA, RA, context);

        assertEquals("deg", result.getUnit());
        assertEquals("pos.eq.ra", result.getUcd());
        assertFalse(result.isTainted());
    }

    @Test
    void sumOfDifferentMetadataIsTaintedAndDimensionless() {
        FieldInfo result = ResolveOperator.additive(List.of(PM, TIME), context);

        assertEquals("", result.getUnit());
        assertEquals("", result.getUcd());
        assertTrue(result.isTainted());
    }

    @Test
    void conflictingFramesWarn() {
        // When
        FieldInfo result = ResolveOperator.add(RA, GLON, context);

        // Then
        assertEquals("BROKEN", result.getStc());
        assertEquals(List.of("Ambiguous STC info: combining values in ICRS and GALACTIC"), context.getWarnings());
    }

    @Test
    void brokenFramesWarnOnlyOnce() {
        FieldInfo broken = ResolveOperator.add(RA, GLON, context);
        ResolveOperator.add(broken, RA, context);

        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void concatenationIsTainted() {
        FieldInfo result = ResolveOperator.concatenation(List.of(RA, PM));

        assertTrue(result.isTainted());
        assertEquals("", result.getUnit());
        assertEquals(List.of("t.ra", "t.pm"), result.getUserData());
    }
}
