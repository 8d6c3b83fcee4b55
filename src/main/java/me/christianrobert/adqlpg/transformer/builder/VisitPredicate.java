package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.Comparison;
import me.christianrobert.adqlpg.transformer.node.GenericNode;
import me.christianrobert.adqlpg.transformer.node.Lexeme;
import me.christianrobert.adqlpg.transformer.node.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for predicates.
 */
public class VisitPredicate {

  public static AdqlNode v(AdqlParser.ComparisonPredicateContext ctx, AdqlTreeBuilder b) {
    return new Comparison(b.visit(ctx.value_expression(0)), ctx.comp_op().getText(),
        b.visit(ctx.value_expression(1)));
  }

  public static AdqlNode v(AdqlParser.BetweenPredicateContext ctx, AdqlTreeBuilder b) {
    // Grammar: value_expression NOT? BETWEEN value_expression AND value_expression
    List<AdqlNode> children = new ArrayList<>();
    children.add(b.visit(ctx.value_expression(0)));
    if (ctx.NOT() != null) {
      children.add(Lexeme.of("NOT"));
    }
    children.add(Lexeme.of("BETWEEN"));
    children.add(b.visit(ctx.value_expression(1)));
    children.add(Lexeme.of("AND"));
    children.add(b.visit(ctx.value_expression(2)));
    return new GenericNode(NodeKind.BETWEEN_PREDICATE, children);
  }

  public static AdqlNode v(AdqlParser.InSubqueryPredicateContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    children.add(b.visit(ctx.value_expression()));
    if (ctx.NOT() != null) {
      children.add(Lexeme.of("NOT"));
    }
    children.add(Lexeme.of("IN"));
    children.add(b.visit(ctx.subquery()));
    return new GenericNode(NodeKind.IN_PREDICATE, children);
  }

  public static AdqlNode v(AdqlParser.InListPredicateContext ctx, AdqlTreeBuilder b) {
    // Grammar: value_expression NOT? IN '(' value_expression (',' value_expression)* ')'
    List<AdqlParser.Value_expressionContext> expressions = ctx.value_expression();
    List<AdqlNode> children = new ArrayList<>();
    children.add(b.visit(expressions.get(0)));
    if (ctx.NOT() != null) {
      children.add(Lexeme.of("NOT"));
    }
    children.add(Lexeme.of("IN"));
    children.add(Lexeme.of("("));
    for (int i = 1; i < expressions.size(); i++) {
      if (i > 1) {
        children.add(Lexeme.of(","));
      }
      children.add(b.visit(expressions.get(i)));
    }
    children.add(Lexeme.of(")"));
    return new GenericNode(NodeKind.IN_PREDICATE, children);
  }

  public static AdqlNode v(AdqlParser.LikePredicateContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    children.add(b.visit(ctx.character_value_expression(0)));
    if (ctx.NOT() != null) {
      children.add(Lexeme.of("NOT"));
    }
    children.add(Lexeme.of("LIKE"));
    children.add(b.visit(ctx.character_value_expression(1)));
    return new GenericNode(NodeKind.LIKE_PREDICATE, children);
  }

  public static AdqlNode v(AdqlParser.NullPredicateContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    children.add(b.visit(ctx.column_reference()));
    children.add(Lexeme.of("IS"));
    if (ctx.NOT() != null) {
      children.add(Lexeme.of("NOT"));
    }
    children.add(Lexeme.of("NULL"));
    return new GenericNode(NodeKind.NULL_PREDICATE, children);
  }

  public static AdqlNode v(AdqlParser.ExistsPredicateContext ctx, AdqlTreeBuilder b) {
    return new GenericNode(NodeKind.EXISTS_PREDICATE, List.of(Lexeme.of("EXISTS"), b.visit(ctx.subquery())));
  }
}
