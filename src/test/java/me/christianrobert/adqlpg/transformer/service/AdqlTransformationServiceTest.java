package me.christianrobert.adqlpg.transformer.service;

import me.christianrobert.adqlpg.config.service.AdqlConfigService;
import me.christianrobert.adqlpg.transformer.context.AdqlSyntaxException;
import me.christianrobert.adqlpg.transformer.context.TranslationResult;
import me.christianrobert.adqlpg.transformer.fieldinfo.OutputColumn;
import me.christianrobert.adqlpg.transformer.fieldinfo.TableCatalog;
import me.christianrobert.adqlpg.transformer.parser.AntlrParser;
import me.christianrobert.adqlpg.transformer.region.NamedObjectRegionResolver;
import me.christianrobert.adqlpg.transformer.region.RegionResolverRegistry;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.adqlpg.transformer.TestFixtures.CATALOG;
import static me.christianrobert.adqlpg.transformer.TestFixtures.normalize;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end translations through the whole pipeline.
 */
class AdqlTransformationServiceTest {

    private AdqlConfigService configService;
    private RegionResolverRegistry regionResolvers;
    private AdqlTransformationService service;

    @BeforeEach
    void setUp() {
        configService = new AdqlConfigService();
        regionResolvers = new RegionResolverRegistry();
        service = new AdqlTransformationService(new AntlrParser(), configService, regionResolvers,
                new UserFunctionRegistry());
    }

    private String translate(String adql) {
        TranslationResult result = service.transform(adql, CATALOG);
        assertTrue(result.isSuccess(), result.getErrorMessage());
        return normalize(result.getSql());
    }

    @Test
    void coneSearchUsesQ3c() {
        // Given
        String adql = "SELECT TOP 10 alpha, delta FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))";

        // When
        String sql = translate(adql);

        // Then
        assertEquals("SELECT alpha, delta FROM ppmx.data"
                + " WHERE q3c_join_symmetric(10, 20, alpha, delta, 0.5) LIMIT 10", sql);
    }

    @Test
    void coneSearchWithoutQ3cUsesPgSphere() {
        // Given
        configService.setConfigValue(AdqlConfigService.USE_Q3C, false);

        // When
        String sql = translate("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(POINT('ICRS', alpha, delta), CIRCLE('ICRS', 10, 20, 0.5))");

        // Then
        assertEquals("SELECT alpha FROM ppmx.data WHERE ((spoint(RADIANS(alpha), RADIANS(delta)))"
                + " @ (scircle(spoint(RADIANS(10), RADIANS(20)), RADIANS(0.5))))", sql);
    }

    @Test
    void outputColumnsCarryMetadata() {
        // When
        TranslationResult result = service.transform("SELECT alpha, mag*2 AS m2, COUNT(*) FROM ppmx.data"
                + " GROUP BY alpha, mag", CATALOG);

        // Then
        assertTrue(result.isSuccess(), result.getErrorMessage());
        List<OutputColumn> columns = result.getOutputColumns();
        assertEquals(List.of("alpha", "m2", "count"), columns.stream().map(OutputColumn::getName).toList());
        assertEquals("deg", columns.get(0).getFieldInfo().getUnit());
        assertTrue(columns.get(1).getFieldInfo().isTainted());
        assertEquals("meta.number", columns.get(2).getFieldInfo().getUcd());
    }

    @Test
    void percentSignsAreEscaped() {
        assertEquals("SELECT objid FROM objects WHERE objid LIKE 'a%%'",
                translate("SELECT objid FROM tap_upload.objects WHERE objid LIKE 'a%'"));
    }

    @Test
    void percentEscapingCanBeDisabled() {
        configService.setConfigValue(AdqlConfigService.ESCAPE_PERCENT, false);

        assertEquals("SELECT objid FROM objects WHERE objid LIKE 'a%'",
                translate("SELECT objid FROM tap_upload.objects WHERE objid LIKE 'a%'"));
    }

    @Test
    void uploadSchemaIsRemovedFromJoins() {
        assertEquals("SELECT p.alpha FROM ppmx.data AS p JOIN objects AS o ON p.objid = o.objid",
                translate("SELECT p.alpha FROM ppmx.data AS p JOIN TAP_UPLOAD.objects AS o ON p.objid = o.objid"));
    }

    @Test
    void userFunctionsAreExpanded() {
        assertEquals("SELECT (CASE WHEN UPPER(objid)=UPPER('abc') THEN 1 ELSE 0 END) AS \"ivo_nocasecmp\""
                        + " FROM ppmx.data",
                translate("SELECT ivo_nocasecmp(objid, 'abc') FROM ppmx.data"));
    }

    @Test
    void namedObjectRegions() {
        // Given
        regionResolvers.register(new NamedObjectRegionResolver("simbad",
                name -> "M31".equals(name) ? new double[]{10.6847083, 41.26875} : null));

        // When
        String sql = translate("SELECT alpha FROM ppmx.data"
                + " WHERE 1=CONTAINS(REGION('simbad M 31'), CIRCLE('ICRS', alpha, delta, 1))");

        // Then
        assertEquals("SELECT alpha FROM ppmx.data"
                + " WHERE q3c_join_symmetric(10.6847083000, 41.2687500000, alpha, delta, 1)", sql);
    }

    @Test
    void defaultLimitProducesWarning() {
        // Given
        configService.setConfigValue(AdqlConfigService.DEFAULT_LIMIT, "2000");

        // When
        TranslationResult result = service.transform("SELECT alpha FROM ppmx.data", CATALOG);

        // Then
        assertEquals("SELECT alpha FROM ppmx.data LIMIT 2000", normalize(result.getSql()));
        assertEquals(List.of("No TOP given, result probably truncated to 2000 rows"), result.getWarnings());
    }

    @Test
    void annotationProblemsAreWarnings() {
        TranslationResult result = service.transform("SELECT POINT('GALACTIC', alpha, delta) FROM ppmx.data",
                CATALOG);

        assertTrue(result.isSuccess(), result.getErrorMessage());
        assertTrue(result.getWarnings().contains("When constructing POINT: Argument 1 has incompatible STC"));
    }

    @Test
    void nodeTreeIsIncludedOnRequest() {
        TranslationResult result = service.transform("SELECT alpha FROM ppmx.data", CATALOG, true);

        assertTrue(result.hasNodeTree());
        assertTrue(result.getNodeTree().startsWith("QUERY_SPECIFICATION"));
        assertTrue(result.getNodeTree().contains("[unit=deg, ucd=pos.eq.ra;meta.main, stc=ICRS]"));
        assertFalse(service.transform("SELECT alpha FROM ppmx.data", CATALOG).hasNodeTree());
    }

    @Test
    void syntaxErrorIsReportedAsFailure() {
        // When
        TranslationResult result = service.transform("SELECT FROM WHERE", CATALOG);

        // Then
        assertTrue(result.isFailure());
        assertNull(result.getSql());
        assertTrue(result.getErrorMessage().startsWith("Could not parse your query"));
    }

    @Test
    void unknownTableIsReportedAsFailure() {
        TranslationResult result = service.transform("SELECT x FROM nowhere.t", CATALOG);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("No table nowhere.t known"));
    }

    @Test
    void unexpectedExceptionsAreReportedAsFailure() {
        TableCatalog broken = name -> {
            throw new IllegalStateException("catalog offline");
        };

        TranslationResult result = service.transform("SELECT alpha FROM ppmx.data", broken);

        assertTrue(result.isFailure());
        assertEquals("Unexpected error: catalog offline", result.getErrorMessage());
    }

    @Test
    void invalidInputs() {
        assertEquals("ADQL statement cannot be null or empty", service.transform("  ", CATALOG).getErrorMessage());
        assertEquals("ADQL statement cannot be null or empty", service.transform(null, CATALOG).getErrorMessage());
        assertEquals("Table catalog cannot be null",
                service.transform("SELECT alpha FROM ppmx.data", null).getErrorMessage());
    }

    @Test
    void translateThrows() {
        assertThrows(AdqlSyntaxException.class, () -> service.translate("SELECT FROM", CATALOG));
    }

    @Test
    void userFunctionPrefixesComeFromConfiguration() {
        // Given
        configService.setConfigValue(AdqlConfigService.UFUNC_PREFIX, "");

        // When
        TranslationResult result = service.transform("SELECT gavo_match('a', objid) FROM ppmx.data", CATALOG);

        // Then
        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Unknown function gavo_match"));
    }
}
