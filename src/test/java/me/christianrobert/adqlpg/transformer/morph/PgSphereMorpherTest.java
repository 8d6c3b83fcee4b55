package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.context.NoDualTransformException;
import me.christianrobert.adqlpg.transformer.context.UnsupportedConstructException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static me.christianrobert.adqlpg.transformer.TestFixtures.annotated;
import static me.christianrobert.adqlpg.transformer.TestFixtures.normalize;
import static org.junit.jupiter.api.Assertions.*;

class PgSphereMorpherTest {

    private static final String POINT_SQL = "spoint(RADIANS(alpha), RADIANS(delta))";
    private static final String CIRCLE_SQL = "scircle(spoint(RADIANS(10), RADIANS(20)), RADIANS(0.5))";

    private final PgSphereMorpher morpher = new PgSphereMorpher();

    private String morph(String adql) {
        return normalize(morpher.morph(annotated(adql)).getNode().flatten());
    }

    @Nested
    class Constructors {

        @Test
        void pointBecomesSpoint() {
            assertEquals("SELECT " + POINT_SQL + " FROM ppmx.data",
                    morph("SELECT POINT('ICRS', alpha, delta) FROM ppmx.data"));
        }

        @Test
        void circleBecomesScircle() {
            assertEquals("SELECT " + CIRCLE_SQL + " FROM ppmx.data",
                    morph("SELECT CIRCLE('ICRS', 10, 20, 0.5) FROM ppmx.data"));
        }

        @Test
        void polygonIsAggregatedInOrder() {
            String sql = morph("SELECT POLYGON('ICRS', 1, 2, 3, 4, 5, 6) FROM ppmx.data");

            assertEquals("SELECT (SELECT spoly(q.p) FROM (VALUES"
                    + " (0, spoint(RADIANS(1), RADIANS(2))),"
                    + " (1, spoint(RADIANS(3), RADIANS(4))),"
                    + " (2, spoint(RADIANS(5), RADIANS(6)))"
                    + " ORDER BY column1) as q(ind,p)) FROM ppmx.data", sql);
        }

        @Test
        void boxBecomesFourCornerPolygon() {
            String sql = morph("SELECT BOX('ICRS', 10, 20, 2, 4) FROM ppmx.data");

            assertTrue(sql.contains("(0, spoint(RADIANS(10)-RADIANS(2)/2, RADIANS(20)-RADIANS(4)/2))"), sql);
            assertTrue(sql.contains("(2, spoint(RADIANS(10)+RADIANS(2)/2, RADIANS(20)+RADIANS(4)/2))"), sql);
            assertTrue(sql.contains("(3, spoint(RADIANS(10)+RADIANS(2)/2, RADIANS(20)-RADIANS(4)/2))"), sql);
        }
    }

    @Nested
    class Predicates {

        @Test
        void containsBecomesContainmentOperator() {
            // Given
            String adql = "SELECT alpha FROM ppmx.data"
                    + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))";

            // When
            String sql = morph(adql);

            // Then
            assertEquals("SELECT alpha FROM ppmx.data WHERE ((" + POINT_SQL + ") @ (" + CIRCLE_SQL + "))", sql);
        }

        @Test
        void containsComparedToZeroIsNegated() {
            String sql = morph("SELECT alpha FROM ppmx.data"
                    + " WHERE 0=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))");

            assertEquals("SELECT alpha FROM ppmx.data WHERE NOT ((" + POINT_SQL + ") @ (" + CIRCLE_SQL + "))", sql);
        }

        @Test
        void intersectsOfTwoRegionsUsesOverlapOperator() {
            String sql = morph("SELECT alpha FROM ppmx.data WHERE"
                    + " 1=INTERSECTS(CIRCLE('ICRS', alpha, delta, 1), CIRCLE('ICRS', 10, 20, 0.5))");

            assertEquals("SELECT alpha FROM ppmx.data WHERE"
                    + " ((scircle(" + POINT_SQL + ", RADIANS(1))) && (" + CIRCLE_SQL + "))", sql);
        }

        @Test
        void intersectsWithPointSecondIsSwapped() {
            String sql = morph("SELECT alpha FROM ppmx.data"
                    + " WHERE 1=INTERSECTS(CIRCLE('ICRS', 10, 20, 0.5), POINT('ICRS', alpha, delta))");

            assertEquals("SELECT alpha FROM ppmx.data WHERE ((" + POINT_SQL + ") @ (" + CIRCLE_SQL + "))", sql);
        }

        @Test
        void literalRegionIsRotatedIntoColumnFrame() {
            String sql = morph("SELECT mag FROM gal.stars WHERE 1=CONTAINS(pos, CIRCLE('ICRS', 10, 20, 0.5))");

            assertEquals("SELECT mag FROM gal.stars WHERE ((pos) @ (((" + CIRCLE_SQL
                    + ")+strans(1.3463560974, -1.0973190018, 0.5747705247))))", sql);
        }

        @Test
        void unionRegionIsDistributed() {
            String sql = morph("SELECT alpha FROM ppmx.data WHERE 1=CONTAINS(POINT('ICRS', alpha, delta),"
                    + " REGION('Union ICRS (Circle 10 20 1 Circle 30 40 1)'))");

            assertEquals("SELECT alpha FROM ppmx.data WHERE ("
                    + "((" + POINT_SQL + ") @ (scircle(spoint(RADIANS(10), RADIANS(20)), RADIANS(1))))"
                    + " OR ((" + POINT_SQL + ") @ (scircle(spoint(RADIANS(30), RADIANS(40)), RADIANS(1)))))", sql);
        }

        @Test
        void notRegionIsNegated() {
            String sql = morph("SELECT alpha FROM ppmx.data WHERE 1=CONTAINS(POINT('ICRS', alpha, delta),"
                    + " REGION('Not ICRS (Circle 10 20 1)'))");

            assertEquals("SELECT alpha FROM ppmx.data WHERE (NOT "
                    + "((" + POINT_SQL + ") @ (scircle(spoint(RADIANS(10), RADIANS(20)), RADIANS(1)))))", sql);
        }

        @Test
        void compoundRegionsOnBothSidesFail() {
            AdqlNode tree = annotated("SELECT alpha FROM ppmx.data WHERE 1=INTERSECTS("
                    + "REGION('Union ICRS (Circle 10 20 1 Circle 30 40 1)'),"
                    + " REGION('Union ICRS (Circle 1 2 1 Circle 3 4 1)'))");

            assertThrows(NoDualTransformException.class, () -> morpher.morph(tree));
        }

        @Test
        void compoundRegionOutsidePredicateFails() {
            AdqlNode tree = annotated("SELECT AREA(REGION('Union ICRS (Circle 10 20 1 Circle 30 40 1)'))"
                    + " FROM ppmx.data");

            assertThrows(UnsupportedConstructException.class, () -> morpher.morph(tree));
        }

        @Test
        void unknownTransformIsReportedAsWarning() {
            // Given
            AdqlNode tree = annotated("SELECT mag FROM gal.stars"
                    + " WHERE 1=CONTAINS(pos, CIRCLE('ECLIPTIC', 10, 20, 0.5))");

            // When
            MorphResult result = morpher.morph(tree);

            // Then
            assertEquals(1, result.getWarnings().size());
            assertTrue(result.getWarnings().get(0).startsWith("Cannot transform from ECLIPTIC to GALACTIC"));
            assertEquals("SELECT mag FROM gal.stars WHERE ((pos) @ (scircle(spoint(RADIANS(10), RADIANS(20)),"
                    + " RADIANS(0.5))))", normalize(result.getNode().flatten()));
        }
    }

    @Nested
    class GeometryFunctions {

        @Test
        void coordinatesAreExtractedInDegrees() {
            String sql = morph("SELECT COORD1(pos), COORD2(pos) FROM gal.stars");

            assertTrue(sql.startsWith("SELECT DEGREES(long(pos)), DEGREES(lat(pos))"), sql);
        }

        @Test
        void coordsysOfLiteralPoint() {
            String sql = morph("SELECT COORDSYS(POINT('GALACTIC', 1, 2)) FROM gal.stars");

            assertTrue(sql.startsWith("SELECT 'GALACTIC'"), sql);
        }

        @Test
        void areaIsInSquareDegrees() {
            String sql = morph("SELECT AREA(CIRCLE('ICRS', 10, 20, 0.5)) FROM ppmx.data");

            assertTrue(sql.startsWith("SELECT 3282.806350011744*AREA(" + CIRCLE_SQL + ")"), sql);
        }

        @Test
        void distanceUsesDistanceOperator() {
            String sql = morph("SELECT DISTANCE(POINT('ICRS', alpha, delta), POINT('ICRS', 10, 20)) FROM ppmx.data");

            assertTrue(sql.startsWith("SELECT DEGREES((" + POINT_SQL
                    + ") <-> (spoint(RADIANS(10), RADIANS(20))))"), sql);
        }

        @Test
        void centroidOfCircle() {
            String sql = morph("SELECT CENTROID(CIRCLE('ICRS', 10, 20, 0.5)) FROM ppmx.data");

            assertTrue(sql.startsWith("SELECT @@(" + CIRCLE_SQL + ")"), sql);
        }

        @Test
        void centroidOfPolygonIsUnsupported() {
            AdqlNode tree = annotated("SELECT CENTROID(POLYGON('ICRS', 1, 2, 3, 4, 5, 6)) FROM ppmx.data");

            UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                    () -> morpher.morph(tree));
            assertTrue(e.getMessage().startsWith("Can only compute centroids of circles and points"));
        }
    }

    @Nested
    class NumericFunctions {

        @Test
        void roundWithDigits() {
            assertEquals("SELECT (ROUND((mag)*10^(2)) / 10^(2)) FROM ppmx.data",
                    morph("SELECT ROUND(mag, 2) FROM ppmx.data"));
        }

        @Test
        void roundWithDigitsStaysWholeAsDivisor() {
            assertEquals("SELECT 1 / (ROUND((mag)*10^(2)) / 10^(2)) AS m FROM ppmx.data",
                    morph("SELECT 1 / ROUND(mag, 2) AS m FROM ppmx.data"));
        }

        @Test
        void truncateWithDigitsStaysWholeAsDivisor() {
            assertEquals("SELECT mag FROM ppmx.data WHERE mag > 1 / (TRUNC((mag)*10^(1)) / 10^(1))",
                    morph("SELECT mag FROM ppmx.data WHERE mag > 1 / TRUNCATE(mag, 1)"));
        }

        @Test
        void roundWithoutDigitsIsKept() {
            assertEquals("SELECT ROUND(mag) FROM ppmx.data", morph("SELECT ROUND(mag) FROM ppmx.data"));
        }

        @Test
        void truncateBecomesTrunc() {
            assertEquals("SELECT TRUNC(mag) FROM ppmx.data", morph("SELECT TRUNCATE(mag) FROM ppmx.data"));
        }

        @Test
        void logarithms() {
            assertEquals("SELECT LN(mag), LOG(mag) FROM ppmx.data",
                    morph("SELECT LOG(mag), LOG10(mag) FROM ppmx.data"));
        }

        @Test
        void square() {
            assertEquals("SELECT ((mag)^2) FROM ppmx.data", morph("SELECT SQUARE(mag) FROM ppmx.data"));
        }

        @Test
        void negatedSquareKeepsTheSignOutside() {
            assertEquals("SELECT -((mag)^2) AS m FROM ppmx.data",
                    morph("SELECT -SQUARE(mag) AS m FROM ppmx.data"));
        }

        @Test
        void randWithoutSeed() {
            assertEquals("SELECT random() FROM ppmx.data", morph("SELECT RAND() FROM ppmx.data"));
        }

        @Test
        void randWithSeedSetsNormalizedSeed() {
            assertEquals("SELECT (SELECT random() FROM (SELECT setseed(0.5)) AS q) FROM ppmx.data",
                    morph("SELECT RAND(1073741824) FROM ppmx.data"));
        }

        @Test
        void seedsWrapAround() {
            assertEquals("0", PgSphereMorpher.normalizeSeed(new NumericLiteral("2147483648")));
            assertEquals("0.25", PgSphereMorpher.normalizeSeed(new NumericLiteral("536870912")));
            assertEquals("0", PgSphereMorpher.normalizeSeed(new NumericLiteral("0")));
        }
    }
}
