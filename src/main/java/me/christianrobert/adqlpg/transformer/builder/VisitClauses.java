package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.GenericNode;
import me.christianrobert.adqlpg.transformer.node.Lexeme;
import me.christianrobert.adqlpg.transformer.node.NodeKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for WHERE, GROUP BY, HAVING and ORDER BY.
 */
public class VisitClauses {

  public static AdqlNode v(AdqlParser.Where_clauseContext ctx, AdqlTreeBuilder b) {
    return new GenericNode(NodeKind.WHERE_CLAUSE, List.of(Lexeme.of("WHERE"), b.visit(ctx.search_condition())));
  }

  public static AdqlNode v(AdqlParser.Having_clauseContext ctx, AdqlTreeBuilder b) {
    return new GenericNode(NodeKind.HAVING_CLAUSE, List.of(Lexeme.of("HAVING"), b.visit(ctx.search_condition())));
  }

  public static AdqlNode v(AdqlParser.Group_by_clauseContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    children.add(Lexeme.of("GROUP BY"));
    List<AdqlParser.Value_expressionContext> expressions = ctx.value_expression();
    for (int i = 0; i < expressions.size(); i++) {
      if (i > 0) {
        children.add(Lexeme.of(","));
      }
      children.add(b.visit(expressions.get(i)));
    }
    return new GenericNode(NodeKind.GROUP_BY_CLAUSE, children);
  }

  public static AdqlNode v(AdqlParser.Order_by_clauseContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    children.add(Lexeme.of("ORDER BY"));
    List<AdqlParser.Sort_specificationContext> specs = ctx.sort_specification();
    for (int i = 0; i < specs.size(); i++) {
      if (i > 0) {
        children.add(Lexeme.of(","));
      }
      children.add(b.visit(specs.get(i)));
    }
    return new GenericNode(NodeKind.ORDER_BY_CLAUSE, children);
  }

  public static AdqlNode v(AdqlParser.Sort_specificationContext ctx, AdqlTreeBuilder b) {
    AdqlNode expression = b.visit(ctx.value_expression());
    if (ctx.ASC() == null && ctx.DESC() == null) {
      return expression;
    }
    String direction = (ctx.ASC() != null ? ctx.ASC() : ctx.DESC()).getText().toUpperCase(Locale.ROOT);
    return new GenericNode(NodeKind.SORT_SPECIFICATION, List.of(expression, Lexeme.of(direction)));
  }
}
