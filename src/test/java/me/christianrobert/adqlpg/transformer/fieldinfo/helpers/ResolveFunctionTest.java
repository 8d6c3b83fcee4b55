package me.christianrobert.adqlpg.transformer.fieldinfo.helpers;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunction;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolveFunctionTest {

    private static final FieldInfo MAG = FieldInfo.forColumn("mag", "phot.mag", null, "t.mag");
    private static final FieldInfo NAME = FieldInfo.forColumn("", "", null, "t.name");

    @Test
    void countIsANumber() {
        FieldInfo result = ResolveFunction.setFunction("COUNT", MAG);

        assertEquals("", result.getUnit());
        assertEquals("meta.number", result.getUcd());
        assertEquals(List.of("t.mag"), result.getUserData());
        assertEquals("meta.number", ResolveFunction.setFunction("COUNT", null).getUcd());
    }

    @Test
    void statisticsPrefixUcd() {
        assertEquals("stat.max;phot.mag", ResolveFunction.setFunction("MAX", MAG).getUcd());
        assertEquals("stat.min", ResolveFunction.setFunction("MIN", NAME).getUcd());
    }

    @Test
    void sumDropsUcd() {
        FieldInfo result = ResolveFunction.setFunction("SUM", MAG);

        assertEquals("mag", result.getUnit());
        assertEquals("", result.getUcd());
    }

    @Test
    void absKeepsMetadata() {
        FieldInfo result = ResolveFunction.numericFunction("ABS", List.of(MAG));

        assertEquals("mag", result.getUnit());
        assertEquals("phot.mag", result.getUcd());
    }

    @Test
    void angleConversions() {
        assertEquals("deg", ResolveFunction.numericFunction("DEGREES", List.of(MAG)).getUnit());
        assertEquals("rad", ResolveFunction.numericFunction("RADIANS", List.of(MAG)).getUnit());
        assertEquals("rad", ResolveFunction.numericFunction("ATAN2", List.of(MAG, MAG)).getUnit());
    }

    @Test
    void otherFunctionsAreDimensionlessButKeepTaint() {
        FieldInfo tainted = MAG.withTainted(true);

        FieldInfo result = ResolveFunction.numericFunction("SQRT", List.of(tainted));

        assertEquals("", result.getUnit());
        assertTrue(result.isTainted());
        assertEquals(List.of("t.mag"), result.getUserData());
    }

    @Test
    void userFunctionsTakeRegisteredMetadata() {
        // Given
        UserFunctionRegistry registry = new UserFunctionRegistry();
        registry.register(new UserFunction("gavo_redshift", null, null, "DOUBLE PRECISION", "", "src.redshift",
                1, null));

        // When
        FieldInfo result = ResolveFunction.userFunction("GAVO_REDSHIFT", List.of(MAG), registry);

        // Then
        assertEquals("src.redshift", result.getUcd());
        assertEquals(List.of("t.mag"), result.getUserData());
    }

    @Test
    void unknownUserFunctionIsDimensionless() {
        FieldInfo result = ResolveFunction.userFunction("gavo_nope", List.of(MAG), null);

        assertEquals("", result.getUnit());
        assertEquals("", result.getUcd());
    }
}
