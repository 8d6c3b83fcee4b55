package me.christianrobert.adqlpg.transformer.fieldinfo;

import me.christianrobert.adqlpg.transformer.context.ColumnNotFoundException;
import me.christianrobert.adqlpg.transformer.context.TableNotFoundException;
import me.christianrobert.adqlpg.transformer.fieldinfo.helpers.ResolveFunction;
import me.christianrobert.adqlpg.transformer.fieldinfo.helpers.ResolveGeometry;
import me.christianrobert.adqlpg.transformer.fieldinfo.helpers.ResolveOperator;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.CompoundRegion;
import me.christianrobert.adqlpg.transformer.node.DerivedColumn;
import me.christianrobert.adqlpg.transformer.node.DerivedTable;
import me.christianrobert.adqlpg.transformer.node.Factor;
import me.christianrobert.adqlpg.transformer.node.FieldInfoed;
import me.christianrobert.adqlpg.transformer.node.FromClause;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.GeometryNode;
import me.christianrobert.adqlpg.transformer.node.Identifier;
import me.christianrobert.adqlpg.transformer.node.JoinSpecification;
import me.christianrobert.adqlpg.transformer.node.JoinedTable;
import me.christianrobert.adqlpg.transformer.node.OperatorExpression;
import me.christianrobert.adqlpg.transformer.node.ParenthesizedExpression;
import me.christianrobert.adqlpg.transformer.node.PlainTableRef;
import me.christianrobert.adqlpg.transformer.node.QualifiedStar;
import me.christianrobert.adqlpg.transformer.node.QuerySpecification;
import me.christianrobert.adqlpg.transformer.node.SetExpression;
import me.christianrobert.adqlpg.transformer.node.Subquery;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Attaches {@link FieldInfo}s to expressions and {@link FieldInfos} to tables
 * and queries of a node tree.
 * <p>
 * Each query specification is handled in three steps:
 * </p>
 * <ol>
 *   <li>the FROM clause, table by table; every plain table is looked up in the
 *       catalog exactly once</li>
 *   <li>the select list, resolved against the FROM clause only</li>
 *   <li>WHERE, GROUP BY, HAVING and ORDER BY, which also see the select list names</li>
 * </ol>
 * <p>
 * Subqueries in predicates are annotated with the resolvers of their enclosing
 * queries still on the stack, so correlated references resolve outward.
 * Column and table lookup failures are thrown; inconsistent metadata only
 * produces errors and warnings on the returned {@link AnnotationContext}.
 * </p>
 */
public class Annotator {

    private static final Logger log = LoggerFactory.getLogger(Annotator.class);

    private final TableCatalog catalog;
    private final UserFunctionRegistry userFunctions;

    public Annotator(TableCatalog catalog) {
        this(catalog, null);
    }

    /**
     * @param userFunctions source of units and UCDs of user defined functions; may be null
     */
    public Annotator(TableCatalog catalog, UserFunctionRegistry userFunctions) {
        this.catalog = catalog;
        this.userFunctions = userFunctions;
    }

    /**
     * Annotates a statement tree in place.
     *
     * @return the context holding the collected errors and warnings
     * @throws ColumnNotFoundException if a column reference cannot be resolved
     * @throws me.christianrobert.adqlpg.transformer.context.AmbiguousColumnException
     *         if a column reference matches more than one column
     * @throws TableNotFoundException if a table or qualifier is unknown
     */
    public AnnotationContext annotate(AdqlNode tree) {
        AnnotationContext context = new AnnotationContext(catalog);
        FieldInfos result = annotateQuery(tree, context);
        log.debug("Annotated query with output columns {}", result.getColumnNames());
        return context;
    }

    // ========== QUERIES ==========

    private FieldInfos annotateQuery(AdqlNode query, AnnotationContext context) {
        if (query instanceof QuerySpecification) {
            return annotateSpecification((QuerySpecification) query, context);
        }
        if (query instanceof SetExpression) {
            SetExpression setExpression = (SetExpression) query;
            FieldInfos first = null;
            for (AdqlNode operand : setExpression.getOperands()) {
                FieldInfos operandInfos = annotateQuery(operand, context);
                if (first == null) {
                    first = operandInfos;
                }
            }
            QueryFieldInfos infos = QueryFieldInfos.copyOf(first);
            setExpression.setFieldInfos(infos);
            return infos;
        }
        if (query instanceof Subquery) {
            Subquery subquery = (Subquery) query;
            FieldInfos infos = annotateQuery(subquery.getQuery(), context);
            subquery.setFieldInfos(infos);
            return infos;
        }
        throw new IllegalArgumentException("Not a query: " + query.kind());
    }

    private FieldInfos annotateSpecification(QuerySpecification query, AnnotationContext context) {
        // Step 1: FROM clause
        FieldInfos fromInfos = annotateFromClause(query.getFromClause(), context);
        QueryFieldInfos queryInfos = new QueryFieldInfos(fromInfos);

        // Step 2: select list, against the FROM clause only
        context.pushResolver(queryInfos::getFieldInfoFromSources);
        try {
            if (query.getSelectList().isStar()) {
                for (OutputColumn column : fromInfos.getSeq()) {
                    queryInfos.addOutputColumn(column.getName(), column.getFieldInfo());
                }
            } else {
                for (AdqlNode item : query.getSelectList().getItems()) {
                    annotateSelectItem(item, fromInfos, queryInfos, context);
                }
            }
        } finally {
            context.popResolver();
        }

        // Step 3: the remaining clauses, which also see the select list
        context.pushResolver(queryInfos::getFieldInfo);
        try {
            annotateOptional(query.getWhereClause(), context);
            annotateOptional(query.getGroupByClause(), context);
            annotateOptional(query.getHavingClause(), context);
            annotateOptional(query.getOrderByClause(), context);
        } finally {
            context.popResolver();
        }

        query.setFieldInfos(queryInfos);
        return queryInfos;
    }

    private void annotateSelectItem(AdqlNode item, FieldInfos fromInfos, QueryFieldInfos queryInfos,
                                    AnnotationContext context) {
        if (item instanceof QualifiedStar) {
            String qualifier = ((QualifiedStar) item).getQualifier();
            TableSource source;
            try {
                source = fromInfos.locateTable(qualifier);
            } catch (TableNotFoundException e) {
                throw new ColumnNotFoundException("No table " + qualifier + " to draw columns from", qualifier);
            }
            for (OutputColumn column : source.getFieldInfos().getSeq()) {
                queryInfos.addOutputColumn(column.getName(), column.getFieldInfo());
            }
            return;
        }

        DerivedColumn column = (DerivedColumn) item;
        FieldInfo info = annotateExpression(column.getExpression(), context);
        column.setFieldInfo(info);
        queryInfos.addOutputColumn(column.getName(), info);
    }

    private void annotateOptional(AdqlNode clause, AnnotationContext context) {
        if (clause != null) {
            annotateExpression(clause, context);
        }
    }

    // ========== FROM CLAUSE ==========

    private FieldInfos annotateFromClause(FromClause from, AnnotationContext context) {
        List<FieldInfos> elements = new ArrayList<>();
        for (AdqlNode table : from.getTables()) {
            elements.add(annotateTableReference(table, context));
        }
        return TableFieldInfos.forFromClause(elements);
    }

    private FieldInfos annotateTableReference(AdqlNode table, AnnotationContext context) {
        if (table instanceof PlainTableRef) {
            PlainTableRef ref = (PlainTableRef) table;
            String name = ref.getTableName().getQualifiedName();
            List<CatalogColumn> columns = context.getCatalog().getColumns(name);
            if (columns == null) {
                throw new TableNotFoundException("No table " + name + " known", name);
            }
            String alias = ref.getAlias() == null ? null : ref.getAlias().normalized();
            TableFieldInfos infos = TableFieldInfos.forTable(name, alias, columns);
            ref.setFieldInfos(infos);
            return infos;
        }

        if (table instanceof DerivedTable) {
            DerivedTable derived = (DerivedTable) table;
            FieldInfos queryInfos = annotateQuery(derived.getSubquery(), context);
            TableFieldInfos infos = TableFieldInfos.forDerivedTable(derived.getAlias().normalized(), queryInfos);
            derived.setFieldInfos(infos);
            return infos;
        }

        if (table instanceof JoinedTable) {
            return annotateJoin((JoinedTable) table, context);
        }
        throw new IllegalArgumentException("Not a table reference: " + table.kind());
    }

    private FieldInfos annotateJoin(JoinedTable join, AnnotationContext context) {
        FieldInfos left = annotateTableReference(join.getLeft(), context);
        FieldInfos right = annotateTableReference(join.getRight(), context);

        Set<String> commonColumns = new HashSet<>();
        JoinSpecification spec = join.getSpecification();
        if (join.isNatural()) {
            commonColumns.addAll(left.getColumnNames());
            commonColumns.retainAll(new HashSet<>(right.getColumnNames()));
        } else if (spec != null && spec.isUsing()) {
            for (Identifier column : spec.getUsingColumns()) {
                commonColumns.add(column.normalized());
            }
        }

        TableFieldInfos infos = TableFieldInfos.forJoin(left, right, commonColumns);
        if (spec != null && !spec.isUsing()) {
            // ON conditions see the columns of the join
            context.pushResolver(infos::getFieldInfo);
            try {
                annotateExpression(spec.getCondition(), context);
            } finally {
                context.popResolver();
            }
        }
        join.setFieldInfos(infos);
        return infos;
    }

    // ========== EXPRESSIONS ==========

    /**
     * Postorder walk over an expression or condition; returns the metadata of
     * the node if it carries one, null otherwise.
     */
    private FieldInfo annotateExpression(AdqlNode node, AnnotationContext context) {
        if (node instanceof Subquery) {
            annotateQuery(node, context);
            return null;
        }
        for (AdqlNode child : node.children()) {
            annotateExpression(child, context);
        }
        if (!(node instanceof FieldInfoed)) {
            return null;
        }
        FieldInfo info = computeFieldInfo(node, context);
        ((FieldInfoed) node).setFieldInfo(info);
        return info;
    }

    private FieldInfo computeFieldInfo(AdqlNode node, AnnotationContext context) {
        switch (node.kind()) {
            case COLUMN_REFERENCE: {
                ColumnReference ref = (ColumnReference) node;
                return context.getFieldInfo(ref.getColumnName(), ref.getQualifier());
            }
            case NUMERIC_VALUE_EXPRESSION:
                return ResolveOperator.additive(infosOf(node.children()), context);
            case TERM:
                return ResolveOperator.multiplicative(infosOf(node.children()),
                        ((OperatorExpression) node).getOperators(), context);
            case CHARACTER_VALUE_EXPRESSION:
                return ResolveOperator.concatenation(infosOf(node.children()));
            case FACTOR:
                return infoOf(((Factor) node).getPrimary());
            case PARENTHESIZED_EXPRESSION:
                return infoOf(((ParenthesizedExpression) node).getInner());
            case COUNT_ALL:
                return ResolveFunction.setFunction("COUNT", null);
            case SET_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return ResolveFunction.setFunction(function.getFunctionName(), infoOf(function.getArg(0)));
            }
            case NUMERIC_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return ResolveFunction.numericFunction(function.getFunctionName(), infosOf(function.getArgs()));
            }
            case USER_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return ResolveFunction.userFunction(function.getFunctionName(), infosOf(function.getArgs()),
                        userFunctions);
            }
            case POINT:
            case CIRCLE:
            case BOX:
            case POLYGON: {
                GeometryNode geometry = (GeometryNode) node;
                return ResolveGeometry.constructor(node.kind().name(), geometry.getFrame(),
                        infosOf(geometry.getCoordinates()), context);
            }
            case REGION_UNION:
            case REGION_INTERSECTION:
            case REGION_NOT:
                return new FieldInfo("", "", ((CompoundRegion) node).getFrame(), false,
                        FieldInfo.collectUserData(infosOf(node.children())));
            case CENTROID:
                return infoOf(((FunctionNode) node).getArg(0));
            case PREDICATE_GEOMETRY_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return ResolveGeometry.predicate(function.getFunctionName(),
                        infoOf(function.getArg(0)), infoOf(function.getArg(1)), context);
            }
            case DISTANCE_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return ResolveGeometry.distance(infoOf(function.getArg(0)), infoOf(function.getArg(1)));
            }
            case AREA:
                return ResolveGeometry.area(infoOf(((FunctionNode) node).getArg(0)));
            case POINT_FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                if ("COORDSYS".equals(function.getFunctionName())) {
                    return ResolveGeometry.coordSys();
                }
                int index = "COORD1".equals(function.getFunctionName()) ? 0 : 1;
                return ResolveGeometry.coordinate(index, infoOf(function.getArg(0)));
            }
            default:
                // Literals, unresolved regions and anything already carrying metadata
                FieldInfo existing = ((FieldInfoed) node).getFieldInfo();
                return existing != null ? existing : FieldInfo.DIMENSIONLESS;
        }
    }

    private static FieldInfo infoOf(AdqlNode node) {
        if (node instanceof FieldInfoed && ((FieldInfoed) node).getFieldInfo() != null) {
            return ((FieldInfoed) node).getFieldInfo();
        }
        return FieldInfo.DIMENSIONLESS;
    }

    private static List<FieldInfo> infosOf(List<AdqlNode> nodes) {
        List<FieldInfo> result = new ArrayList<>();
        for (AdqlNode node : nodes) {
            result.add(infoOf(node));
        }
        return result;
    }
}
