package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlBaseVisitor;
import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.context.AdqlSyntaxException;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.parser.ParseResult;
import me.christianrobert.adqlpg.transformer.ufunc.UserFunctionRegistry;
import org.antlr.v4.runtime.Token;

import java.util.List;
import java.util.Locale;

/**
 * Turns an ADQL parse tree into the node tree.
 * <p>
 * Every grammar rule the tree needs is mapped to a static helper
 * ({@code Visit*.v(ctx, builder)}); the helpers call back into {@link #visit}
 * for sub-rules. Value-expression levels that contain a single operand are
 * collapsed into that operand.
 * </p>
 * <p>
 * One builder handles one statement; it is not thread-safe.
 * </p>
 */
public class AdqlTreeBuilder extends AdqlBaseVisitor<AdqlNode> {

    // no logging is desired, this would create an overkill of logs

    private final UserFunctionRegistry userFunctions;
    private final List<String> userFunctionPrefixes;
    private String source;

    /**
     * @param userFunctionPrefixes name prefixes that mark user defined functions, e.g. gavo_ and ivo_
     */
    public AdqlTreeBuilder(UserFunctionRegistry userFunctions, List<String> userFunctionPrefixes) {
        this.userFunctions = userFunctions;
        this.userFunctionPrefixes = userFunctionPrefixes.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Builds the node tree of a successfully parsed statement.
     *
     * @throws AdqlSyntaxException if the parse had errors or an identifier is not allowed
     */
    public AdqlNode build(ParseResult parseResult) {
        if (parseResult.hasErrors()) {
            throw parseResult.toException();
        }
        this.source = parseResult.getOriginalAdql();
        return visit(parseResult.getTree());
    }

    public UserFunctionRegistry getUserFunctions() {
        return userFunctions;
    }

    public boolean hasUserFunctionPrefix(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String prefix : userFunctionPrefixes) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Syntax error located at the given token.
     */
    public AdqlSyntaxException syntaxError(String message, Token token) {
        return new AdqlSyntaxException(message, source, token.getStartIndex(), token.getLine(),
                token.getCharPositionInLine());
    }

    // ========== QUERIES ==========

    @Override
    public AdqlNode visitStatement(AdqlParser.StatementContext ctx) {
        return visit(ctx.query_expression());
    }

    @Override
    public AdqlNode visitQuery_expression(AdqlParser.Query_expressionContext ctx) {
        return VisitQueryExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitQuery_term(AdqlParser.Query_termContext ctx) {
        return VisitQueryExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitQuery_primary(AdqlParser.Query_primaryContext ctx) {
        return VisitQueryExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitSubquery(AdqlParser.SubqueryContext ctx) {
        return VisitQueryExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitQuery_specification(AdqlParser.Query_specificationContext ctx) {
        return VisitQuerySpecification.v(ctx, this);
    }

    @Override
    public AdqlNode visitSelect_list(AdqlParser.Select_listContext ctx) {
        return VisitSelectList.v(ctx, this);
    }

    // ========== FROM CLAUSE ==========

    @Override
    public AdqlNode visitFrom_clause(AdqlParser.From_clauseContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitTable_reference(AdqlParser.Table_referenceContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitPlainTable(AdqlParser.PlainTableContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitDerivedTable(AdqlParser.DerivedTableContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitParenthesizedJoin(AdqlParser.ParenthesizedJoinContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitQualifiedJoin(AdqlParser.QualifiedJoinContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    @Override
    public AdqlNode visitJoin_operand(AdqlParser.Join_operandContext ctx) {
        return VisitTableReference.v(ctx, this);
    }

    // ========== OTHER CLAUSES ==========

    @Override
    public AdqlNode visitWhere_clause(AdqlParser.Where_clauseContext ctx) {
        return VisitClauses.v(ctx, this);
    }

    @Override
    public AdqlNode visitGroup_by_clause(AdqlParser.Group_by_clauseContext ctx) {
        return VisitClauses.v(ctx, this);
    }

    @Override
    public AdqlNode visitHaving_clause(AdqlParser.Having_clauseContext ctx) {
        return VisitClauses.v(ctx, this);
    }

    @Override
    public AdqlNode visitOrder_by_clause(AdqlParser.Order_by_clauseContext ctx) {
        return VisitClauses.v(ctx, this);
    }

    @Override
    public AdqlNode visitSort_specification(AdqlParser.Sort_specificationContext ctx) {
        return VisitClauses.v(ctx, this);
    }

    // ========== SEARCH CONDITIONS ==========

    @Override
    public AdqlNode visitSearch_condition(AdqlParser.Search_conditionContext ctx) {
        return VisitSearchCondition.v(ctx, this);
    }

    @Override
    public AdqlNode visitBoolean_term(AdqlParser.Boolean_termContext ctx) {
        return VisitSearchCondition.v(ctx, this);
    }

    @Override
    public AdqlNode visitBoolean_factor(AdqlParser.Boolean_factorContext ctx) {
        return VisitSearchCondition.v(ctx, this);
    }

    @Override
    public AdqlNode visitParenthesizedCondition(AdqlParser.ParenthesizedConditionContext ctx) {
        return VisitSearchCondition.v(ctx, this);
    }

    @Override
    public AdqlNode visitPlainPredicate(AdqlParser.PlainPredicateContext ctx) {
        return visit(ctx.predicate());
    }

    @Override
    public AdqlNode visitComparisonPredicate(AdqlParser.ComparisonPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitBetweenPredicate(AdqlParser.BetweenPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitInSubqueryPredicate(AdqlParser.InSubqueryPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitInListPredicate(AdqlParser.InListPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitLikePredicate(AdqlParser.LikePredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitNullPredicate(AdqlParser.NullPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    @Override
    public AdqlNode visitExistsPredicate(AdqlParser.ExistsPredicateContext ctx) {
        return VisitPredicate.v(ctx, this);
    }

    // ========== VALUE EXPRESSIONS ==========

    @Override
    public AdqlNode visitValue_expression(AdqlParser.Value_expressionContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitNumeric_value_expression(AdqlParser.Numeric_value_expressionContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitTerm(AdqlParser.TermContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitFactor(AdqlParser.FactorContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitNumeric_primary(AdqlParser.Numeric_primaryContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitNumericLiteral(AdqlParser.NumericLiteralContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitColumnPrimary(AdqlParser.ColumnPrimaryContext ctx) {
        return visit(ctx.column_reference());
    }

    @Override
    public AdqlNode visitSetFunctionPrimary(AdqlParser.SetFunctionPrimaryContext ctx) {
        return visit(ctx.set_function_specification());
    }

    @Override
    public AdqlNode visitParenthesizedValue(AdqlParser.ParenthesizedValueContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitSigned_integer(AdqlParser.Signed_integerContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitString_value_expression(AdqlParser.String_value_expressionContext ctx) {
        return visit(ctx.character_value_expression());
    }

    @Override
    public AdqlNode visitCharacter_value_expression(AdqlParser.Character_value_expressionContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitCharacter_primary(AdqlParser.Character_primaryContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitCharacter_string_literal(AdqlParser.Character_string_literalContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    @Override
    public AdqlNode visitColumn_reference(AdqlParser.Column_referenceContext ctx) {
        return VisitValueExpression.v(ctx, this);
    }

    // ========== FUNCTIONS ==========

    @Override
    public AdqlNode visitCountAll(AdqlParser.CountAllContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitGeneralSetFunction(AdqlParser.GeneralSetFunctionContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitNumeric_value_function(AdqlParser.Numeric_value_functionContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitTrigOneArg(AdqlParser.TrigOneArgContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitTrigAtan2(AdqlParser.TrigAtan2Context ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitMathNoArg(AdqlParser.MathNoArgContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitMathRand(AdqlParser.MathRandContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitMathOneArg(AdqlParser.MathOneArgContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitMathOptPrec(AdqlParser.MathOptPrecContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitMathTwoArg(AdqlParser.MathTwoArgContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    @Override
    public AdqlNode visitUser_defined_function(AdqlParser.User_defined_functionContext ctx) {
        return VisitFunction.v(ctx, this);
    }

    // ========== GEOMETRY ==========

    @Override
    public AdqlNode visitGeometry_value_expression(AdqlParser.Geometry_value_expressionContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitGeometry_expression(AdqlParser.Geometry_expressionContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitCoord_sys(AdqlParser.Coord_sysContext ctx) {
        return visit(ctx.string_value_expression());
    }

    @Override
    public AdqlNode visitPoint(AdqlParser.PointContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitCircle(AdqlParser.CircleContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitBox(AdqlParser.BoxContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitPolygon(AdqlParser.PolygonContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitRegion(AdqlParser.RegionContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitCoord_value(AdqlParser.Coord_valueContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public AdqlNode visitCentroid(AdqlParser.CentroidContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitPredicateGeometryFunction(AdqlParser.PredicateGeometryFunctionContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitDistanceFunction(AdqlParser.DistanceFunctionContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitPointFunction(AdqlParser.PointFunctionContext ctx) {
        return VisitGeometry.v(ctx, this);
    }

    @Override
    public AdqlNode visitAreaFunction(AdqlParser.AreaFunctionContext ctx) {
        return VisitGeometry.v(ctx, this);
    }
}
