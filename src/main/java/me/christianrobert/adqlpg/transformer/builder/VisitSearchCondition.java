package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.GenericNode;
import me.christianrobert.adqlpg.transformer.node.Lexeme;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for boolean structure: OR, AND, NOT and parentheses.
 * Levels with a single operand collapse into it.
 */
public class VisitSearchCondition {

  public static AdqlNode v(AdqlParser.Search_conditionContext ctx, AdqlTreeBuilder b) {
    // Grammar: boolean_term (OR boolean_term)*
    if (ctx.boolean_term().size() == 1) {
      return b.visit(ctx.boolean_term(0));
    }
    return joined(NodeKind.SEARCH_CONDITION, "OR", ctx.boolean_term(), b);
  }

  public static AdqlNode v(AdqlParser.Boolean_termContext ctx, AdqlTreeBuilder b) {
    // Grammar: boolean_factor (AND boolean_factor)*
    if (ctx.boolean_factor().size() == 1) {
      return b.visit(ctx.boolean_factor(0));
    }
    return joined(NodeKind.BOOLEAN_TERM, "AND", ctx.boolean_factor(), b);
  }

  public static AdqlNode v(AdqlParser.Boolean_factorContext ctx, AdqlTreeBuilder b) {
    AdqlNode primary = b.visit(ctx.boolean_primary());
    if (ctx.NOT() == null) {
      return primary;
    }
    return new GenericNode(NodeKind.BOOLEAN_FACTOR, List.of(Lexeme.of("NOT"), primary));
  }

  public static AdqlNode v(AdqlParser.ParenthesizedConditionContext ctx, AdqlTreeBuilder b) {
    return new GenericNode(NodeKind.PARENTHESIZED_CONDITION,
        List.of(Lexeme.of("("), b.visit(ctx.search_condition()), Lexeme.of(")")));
  }

  private static AdqlNode joined(NodeKind kind, String operator,
                                 List<? extends ParserRuleContext> operands,
                                 AdqlTreeBuilder b) {
    List<AdqlNode> children = new ArrayList<>();
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        children.add(Lexeme.of(operator));
      }
      children.add(b.visit(operands.get(i)));
    }
    return new GenericNode(kind, children);
  }
}
