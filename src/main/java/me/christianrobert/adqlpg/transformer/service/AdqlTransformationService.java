package me.christianrobert.adqlpg.transformer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.adqlpg.config.service.AdqlConfigService;
import me.christianrobert.adqlpg.transformer.builder.AdqlTreeBuilder;
import me.christianrobert.adqlpg.transformer.context.AdqlException;
import me.christianrobert.adqlpg.transformer.context.TranslationResult;
import me.christianrobert.adqlpg.transformer.fieldinfo.AnnotationContext;
import me.christianrobert.adqlpg.transformer.fieldinfo.Annotator;
import me.christianrobert.adqlpg.transformer.fieldinfo.OutputColumn;
import me.christianrobert.adqlpg.transformer.fieldinfo.TableCatalog;
import me.christianrobert.adqlpg.transformer.morph.MorphResult;
import me.christianrobert.adqlpg.transformer.morph.PgSphereMorpher;
import me.christianrobert.adqlpg.transformer.morph.Q3cMorpher;
import me.christianrobert.adqlpg.transformer.morph.SyntaxMorpher;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnBearing;
import me.christianrobert.adqlpg.transformer.parser.AntlrParser;
import me.christianrobert.adqlpg.transformer.parser.ParseResult;
import me.christianrobert.adqlpg.transformer.region.RegionResolverRegistry;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import me.christianrobert.adqlpg.transformer.util.NodeTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * High-level service translating ADQL into PostgreSQL with pgSphere and q3c.
 * This is the main entry point of the translator.
 *
 * <p>Architecture:
 * <pre>
 * ADQL → ANTLR parse → node tree → regions → annotation → q3c → pgSphere → syntax → SQL
 *            ↓             ↓                     ↓
 *        AdqlParser  AdqlTreeBuilder         Annotator (TableCatalog)
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * TranslationResult result = service.transform(adql, catalog);
 * if (result.isSuccess()) {
 *     String sql = result.getSql();
 *     List&lt;OutputColumn&gt; columns = result.getOutputColumns();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 */
@ApplicationScoped
public class AdqlTransformationService {

    private static final Logger log = LoggerFactory.getLogger(AdqlTransformationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    AdqlConfigService configService;

    @Inject
    RegionResolverRegistry regionResolvers;

    @Inject
    UserFunctionRegistry userFunctions;

    public AdqlTransformationService() {
    }

    public AdqlTransformationService(AntlrParser parser, AdqlConfigService configService,
                                     RegionResolverRegistry regionResolvers, UserFunctionRegistry userFunctions) {
        this.parser = parser;
        this.configService = configService;
        this.regionResolvers = regionResolvers;
        this.userFunctions = userFunctions;
    }

    /**
     * Parses one statement into a node tree; REGION calls are not resolved yet.
     *
     * @throws me.christianrobert.adqlpg.transformer.context.AdqlSyntaxException if the statement is rejected
     */
    public AdqlNode parse(String adql) {
        ParseResult parseResult = parser.parseStatement(adql);
        AdqlTreeBuilder builder = new AdqlTreeBuilder(userFunctions, configService.getUserFunctionPrefixes());
        return builder.build(parseResult);
    }

    /**
     * Translates ADQL to PostgreSQL, reporting failures in the result.
     *
     * @param adql one ADQL statement
     * @param catalog column metadata of the referenced tables
     * @return TranslationResult containing either the SQL or error details
     */
    public TranslationResult transform(String adql, TableCatalog catalog) {
        return transform(adql, catalog, false);
    }

    /**
     * Same as {@link #transform(String, TableCatalog)} with an optional node tree dump
     * of the annotated tree in the result.
     */
    public TranslationResult transform(String adql, TableCatalog catalog, boolean includeTree) {
        if (adql == null || adql.trim().isEmpty()) {
            return TranslationResult.failure(adql, "ADQL statement cannot be null or empty");
        }
        if (catalog == null) {
            return TranslationResult.failure(adql, "Table catalog cannot be null");
        }

        try {
            return translate(adql, catalog, includeTree);
        } catch (AdqlException e) {
            log.error("Translation failed: {}", e.getDetailedMessage());
            return TranslationResult.failure(adql, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error during translation", e);
            return TranslationResult.failure(adql, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Translates ADQL to PostgreSQL.
     *
     * @throws AdqlException for any statement that cannot be translated
     */
    public TranslationResult translate(String adql, TableCatalog catalog) {
        return translate(adql, catalog, false);
    }

    private TranslationResult translate(String adql, TableCatalog catalog, boolean includeTree) {
        log.trace("ADQL: {}", adql);

        // STEP 1: Parse and build the node tree
        log.debug("Step 1: Parsing ADQL");
        AdqlNode tree = parse(adql);

        // STEP 2: Replace REGION calls
        log.debug("Step 2: Resolving regions");
        tree = regionResolvers.resolveAll(tree);

        // STEP 3: Resolve columns and infer units, UCDs and frames
        log.debug("Step 3: Annotating");
        AnnotationContext annotationContext = new Annotator(catalog, userFunctions).annotate(tree);
        List<String> warnings = new ArrayList<>(annotationContext.getDiagnostics());
        List<OutputColumn> outputColumns = ((ColumnBearing) tree).getFieldInfos().getSeq();
        String nodeTree = includeTree ? NodeTreeFormatter.format(tree, true) : null;

        // STEP 4: q3c
        if (configService.isUseQ3c()) {
            log.debug("Step 4: Applying q3c morphs");
            MorphResult q3c = new Q3cMorpher().morph(tree);
            warnings.addAll(q3c.getWarnings());
            tree = q3c.getNode();
        } else {
            log.debug("Step 4: q3c disabled");
        }

        // STEP 5: pgSphere and PostgreSQL functions
        log.debug("Step 5: Applying pgSphere morphs");
        MorphResult pgSphere = new PgSphereMorpher(userFunctions).morph(tree);
        warnings.addAll(pgSphere.getWarnings());
        tree = pgSphere.getNode();

        // STEP 6: ADQL-only syntax
        log.debug("Step 6: Applying syntax morphs");
        MorphResult syntax = new SyntaxMorpher(configService.getUploadSchema(), configService.getDefaultLimit())
                .morph(tree);
        warnings.addAll(syntax.getWarnings());
        tree = syntax.getNode();

        // STEP 7: Flatten
        log.debug("Step 7: Flattening");
        String sql = tree.flatten();
        if (configService.isEscapePercent()) {
            sql = sql.replace("%", "%%");
        }

        log.info("Successfully translated ADQL statement with {} output columns", outputColumns.size());
        log.debug("PostgreSQL SQL: {}", sql);
        return TranslationResult.successWithTree(adql, sql, outputColumns, warnings, nodeTree);
    }
}
