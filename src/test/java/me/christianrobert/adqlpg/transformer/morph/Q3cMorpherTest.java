package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.context.PseudoBooleanException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import org.junit.jupiter.api.Test;

import static me.christianrobert.adqlpg.transformer.TestFixtures.annotated;
import static me.christianrobert.adqlpg.transformer.TestFixtures.normalize;
import static org.junit.jupiter.api.Assertions.*;

class Q3cMorpherTest {

    private final Q3cMorpher morpher = new Q3cMorpher();

    private String morph(String adql) {
        return normalize(morpher.morph(annotated(adql)).getNode().flatten());
    }

    @Test
    void containsCircleComparedToOne() {
        // Given
        String adql = "SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))";

        // When
        String sql = morph(adql);

        // Then
        assertEquals("SELECT alpha FROM ppmx.data WHERE q3c_join_symmetric(10, 20, alpha, delta, 0.5)", sql);
    }

    @Test
    void containsComparedToZeroIsNegated() {
        String sql = morph("SELECT alpha FROM ppmx.data"
                + " WHERE CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5)) = 0");

        assertEquals("SELECT alpha FROM ppmx.data WHERE NOT q3c_join_symmetric(10, 20, alpha, delta, 0.5)", sql);
    }

    @Test
    void notEqualToZeroIsNotNegated() {
        String sql = morph("SELECT alpha FROM ppmx.data"
                + " WHERE CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5)) != 0");

        assertEquals("SELECT alpha FROM ppmx.data WHERE q3c_join_symmetric(10, 20, alpha, delta, 0.5)", sql);
    }

    @Test
    void literalPointGoesFirst() {
        String sql = morph("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', 10, 20), CIRCLE('ICRS', alpha, delta, 1))");

        assertEquals("SELECT alpha FROM ppmx.data WHERE q3c_join_symmetric(10, 20, alpha, delta, 1)", sql);
    }

    @Test
    void containsPolygonUsesPolyQuery() {
        String sql = morph("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), POLYGON('ICRS', 1, 2, 3, 4, 5, 6))");

        assertEquals("SELECT alpha FROM ppmx.data WHERE q3c_poly_query(alpha, delta, ARRAY[1, 2, 3, 4, 5, 6])", sql);
    }

    @Test
    void containsBoxUsesCornerPolygon() {
        String sql = morph("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), BOX('ICRS', 10, 20, 2, 4))");

        assertEquals("SELECT alpha FROM ppmx.data WHERE q3c_poly_query(alpha, delta, ARRAY["
                + "10-2/2.0, 20-4/2.0, 10-2/2.0, 20+4/2.0, 10+2/2.0, 20+4/2.0, 10+2/2.0, 20-4/2.0])", sql);
    }

    @Test
    void incompatibleFramesAreLeftAlone() {
        // Given
        AdqlNode tree = annotated("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('GALACTIC', 10, 20, 0.5))");

        // When
        MorphResult result = morpher.morph(tree);

        // Then
        assertSame(tree, result.getNode());
    }

    @Test
    void predicateOutsideComparisonRendersAsInteger() {
        String sql = morph("SELECT CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))"
                + " FROM ppmx.data");

        assertEquals("SELECT (CASE WHEN q3c_join_symmetric(10, 20, alpha, delta, 0.5) THEN 1 ELSE 0 END)"
                + " FROM ppmx.data", sql);
    }

    @Test
    void comparisonAgainstOtherValuesFails() {
        AdqlNode tree = annotated("SELECT alpha FROM ppmx.data"
                + " WHERE 2=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))");

        PseudoBooleanException e = assertThrows(PseudoBooleanException.class, () -> morpher.morph(tree));
        assertTrue(e.getMessage().contains("against 0 or 1"));
    }

    @Test
    void orderingComparisonFails() {
        AdqlNode tree = annotated("SELECT alpha FROM ppmx.data"
                + " WHERE CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5)) < 1");

        PseudoBooleanException e = assertThrows(PseudoBooleanException.class, () -> morpher.morph(tree));
        assertTrue(e.getMessage().contains("compared using"));
    }
}
