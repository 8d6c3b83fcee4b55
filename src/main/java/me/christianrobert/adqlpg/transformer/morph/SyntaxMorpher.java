package me.christianrobert.adqlpg.transformer.morph;

import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.DerivedColumn;
import me.christianrobert.adqlpg.transformer.node.Identifier;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.QualifiedStar;
import me.christianrobert.adqlpg.transformer.node.QuerySpecification;
import me.christianrobert.adqlpg.transformer.node.SetExpression;
import me.christianrobert.adqlpg.transformer.node.Subquery;
import me.christianrobert.adqlpg.transformer.node.TableName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final pass turning ADQL-only syntax into PostgreSQL.
 * <p>Rules:</p>
 * <ul>
 *   <li>{@code TOP n} becomes a trailing {@code LIMIT n}</li>
 *   <li>an explicit {@code ALL} quantifier adds {@code OFFSET 0} unless an OFFSET is given</li>
 *   <li>the upload schema is dropped from table names and column qualifiers</li>
 *   <li>unaliased computed select list entries are aliased with their generated names</li>
 *   <li>the TOP of the first operand of a set operation limits the whole operation</li>
 *   <li>a configured default limit is added to a statement without one</li>
 * </ul>
 */
public class SyntaxMorpher {

    private static final Logger log = LoggerFactory.getLogger(SyntaxMorpher.class);

    private final String uploadSchema;
    private final Integer defaultLimit;
    private final Morpher morpher;

    public SyntaxMorpher() {
        this("TAP_UPLOAD", null);
    }

    /**
     * @param uploadSchema schema of uploaded tables, null to keep all schemas
     * @param defaultLimit row limit for statements without TOP, null for none
     */
    public SyntaxMorpher(String uploadSchema, Integer defaultLimit) {
        this.uploadSchema = uploadSchema;
        this.defaultLimit = defaultLimit;
        Map<NodeKind, MorphHandler> handlers = new EnumMap<>(NodeKind.class);
        handlers.put(NodeKind.TABLE_NAME, this::morphTableName);
        handlers.put(NodeKind.COLUMN_REFERENCE, this::morphColumnReference);
        handlers.put(NodeKind.QUALIFIED_STAR, this::morphQualifiedStar);
        handlers.put(NodeKind.DERIVED_COLUMN, SyntaxMorpher::morphDerivedColumn);
        handlers.put(NodeKind.QUERY_SPECIFICATION, SyntaxMorpher::morphQuerySpecification);
        handlers.put(NodeKind.SET_EXPRESSION, SyntaxMorpher::morphSetExpression);
        this.morpher = new Morpher(handlers);
    }

    public MorphResult morph(AdqlNode tree) {
        MorphResult result = morpher.morph(tree);
        AdqlNode root = result.getNode();
        if (defaultLimit != null) {
            root = applyDefaultLimit(root, result.getState());
        }
        return new MorphResult(result.getState(), root);
    }

    private AdqlNode applyDefaultLimit(AdqlNode root, MorphState state) {
        if (root instanceof QuerySpecification && ((QuerySpecification) root).getLimit() == null) {
            state.addWarning("No TOP given, result probably truncated to " + defaultLimit + " rows");
            log.debug("Adding default limit {}", defaultLimit);
            return ((QuerySpecification) root).withLimit(defaultLimit);
        }
        if (root instanceof SetExpression && ((SetExpression) root).getLimit() == null) {
            state.addWarning("No TOP given, result probably truncated to " + defaultLimit + " rows");
            log.debug("Adding default limit {}", defaultLimit);
            return ((SetExpression) root).withLimit(defaultLimit);
        }
        return root;
    }

    // ---- upload schema

    private boolean isUploadSchema(Identifier schema) {
        return uploadSchema != null && schema != null && schema.normalized().equalsIgnoreCase(uploadSchema);
    }

    private AdqlNode morphTableName(AdqlNode node, MorphState state) {
        TableName tableName = (TableName) node;
        if (!isUploadSchema(tableName.getSchema())) {
            return node;
        }
        return tableName.withParts(List.of(tableName.getTable()));
    }

    private AdqlNode morphColumnReference(AdqlNode node, MorphState state) {
        ColumnReference column = (ColumnReference) node;
        List<Identifier> stripped = stripQualifier(column.getQualifierParts());
        if (stripped == null) {
            return node;
        }
        List<Identifier> parts = new ArrayList<>(stripped);
        parts.add(column.getColumn());
        return column.withParts(parts);
    }

    private AdqlNode morphQualifiedStar(AdqlNode node, MorphState state) {
        QualifiedStar star = (QualifiedStar) node;
        List<Identifier> stripped = stripQualifier(star.getQualifierParts());
        return stripped == null ? node : star.withQualifierParts(stripped);
    }

    /**
     * @return the qualifier without the upload schema, null if there is nothing to strip
     */
    private List<Identifier> stripQualifier(List<Identifier> qualifier) {
        if (qualifier.size() < 2 || !isUploadSchema(qualifier.get(qualifier.size() - 2))) {
            return null;
        }
        return List.of(qualifier.get(qualifier.size() - 1));
    }

    // ---- select lists and limits

    private static AdqlNode morphDerivedColumn(AdqlNode node, MorphState state) {
        DerivedColumn column = (DerivedColumn) node;
        if (column.getAlias() != null || column.getExpression() instanceof ColumnReference
                || column.getGeneratedName() == null) {
            return node;
        }
        return column.withAlias(Identifier.delimited(column.getGeneratedName()));
    }

    private static AdqlNode morphQuerySpecification(AdqlNode node, MorphState state) {
        QuerySpecification query = (QuerySpecification) node;
        if (query.getSetLimit() != null) {
            query = query.withSetLimit(null).withLimit(query.getSetLimit());
        }
        // Keeps the planner from pulling the query into an outer one
        if ("ALL".equals(query.getSetQuantifier()) && query.getOffset() == null) {
            query = query.withOffset(0);
        }
        return query;
    }

    private static AdqlNode morphSetExpression(AdqlNode node, MorphState state) {
        SetExpression expression = (SetExpression) node;
        List<AdqlNode> operands = new ArrayList<>(expression.getOperands());
        Integer limit = expression.getLimit();
        if (limit == null && operands.get(0) instanceof QuerySpecification) {
            QuerySpecification first = (QuerySpecification) operands.get(0);
            if (first.getLimit() != null) {
                limit = first.getLimit();
                operands.set(0, first.withLimit(null));
            }
        }
        // LIMIT and OFFSET of an operand must not apply to the whole expression
        for (int i = 0; i < operands.size(); i++) {
            AdqlNode operand = operands.get(i);
            if (operand instanceof QuerySpecification
                    && (((QuerySpecification) operand).getLimit() != null
                    || ((QuerySpecification) operand).getOffset() != null)) {
                operands.set(i, new Subquery(operand));
            }
        }
        return expression.withOperands(operands).withLimit(limit);
    }
}
