package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.FromClause;
import me.christianrobert.adqlpg.transformer.node.QuerySpecification;
import me.christianrobert.adqlpg.transformer.node.SelectList;
import org.antlr.v4.runtime.Token;

import java.util.Locale;

/**
 * Static helper for SELECT ... FROM ... query specifications.
 */
public class VisitQuerySpecification {

  public static AdqlNode v(AdqlParser.Query_specificationContext ctx, AdqlTreeBuilder b) {
    // Grammar: SELECT set_quantifier? set_limit? select_list table_expression
    String quantifier = ctx.set_quantifier() == null
        ? null
        : ctx.set_quantifier().getText().toUpperCase(Locale.ROOT);
    Integer top = ctx.set_limit() == null
        ? null
        : parseCount(ctx.set_limit().UNSIGNED_INTEGER().getSymbol(), b);

    SelectList selectList = (SelectList) b.visit(ctx.select_list());

    AdqlParser.Table_expressionContext tableExpr = ctx.table_expression();
    FromClause from = (FromClause) b.visit(tableExpr.from_clause());
    AdqlNode where = tableExpr.where_clause() == null ? null : b.visit(tableExpr.where_clause());
    AdqlNode groupBy = tableExpr.group_by_clause() == null ? null : b.visit(tableExpr.group_by_clause());
    AdqlNode having = tableExpr.having_clause() == null ? null : b.visit(tableExpr.having_clause());
    AdqlNode orderBy = tableExpr.order_by_clause() == null ? null : b.visit(tableExpr.order_by_clause());
    Integer offset = tableExpr.offset_clause() == null
        ? null
        : parseCount(tableExpr.offset_clause().UNSIGNED_INTEGER().getSymbol(), b);

    return new QuerySpecification(quantifier, top, selectList, from, where, groupBy, having, orderBy,
        offset, null);
  }

  /**
   * Row counts for TOP and OFFSET.
   */
  static int parseCount(Token token, AdqlTreeBuilder b) {
    try {
      return Integer.parseInt(token.getText());
    } catch (NumberFormatException e) {
      throw b.syntaxError("Row count out of range: " + token.getText(), token);
    }
  }
}
