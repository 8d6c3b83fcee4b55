package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.SetExpression;
import me.christianrobert.adqlpg.transformer.node.Subquery;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for query expressions: set operations, parenthesized queries and subqueries.
 */
public class VisitQueryExpression {

  public static AdqlNode v(AdqlParser.Query_expressionContext ctx, AdqlTreeBuilder b) {
    // Grammar: query_term (set_operator query_term)*
    List<AdqlParser.Query_termContext> terms = ctx.query_term();
    if (terms.size() == 1) {
      return b.visit(terms.get(0));
    }

    List<AdqlNode> operands = new ArrayList<>();
    for (AdqlParser.Query_termContext term : terms) {
      operands.add(b.visit(term));
    }
    List<String> operators = new ArrayList<>();
    for (AdqlParser.Set_operatorContext op : ctx.set_operator()) {
      String keyword = op.getChild(0).getText().toUpperCase(Locale.ROOT);
      operators.add(op.ALL() != null ? keyword + " ALL" : keyword);
    }
    return new SetExpression(operands, operators, null);
  }

  public static AdqlNode v(AdqlParser.Query_termContext ctx, AdqlTreeBuilder b) {
    // Grammar: query_primary (INTERSECT ALL? query_primary)*
    if (ctx.query_primary().size() == 1) {
      return b.visit(ctx.query_primary(0));
    }

    List<AdqlNode> operands = new ArrayList<>();
    List<String> operators = new ArrayList<>();
    for (ParseTree child : ctx.children) {
      if (child instanceof AdqlParser.Query_primaryContext) {
        operands.add(b.visit(child));
      } else if (child instanceof TerminalNode) {
        TerminalNode terminal = (TerminalNode) child;
        if (terminal.getSymbol().getType() == AdqlParser.INTERSECT) {
          operators.add("INTERSECT");
        } else if (terminal.getSymbol().getType() == AdqlParser.ALL) {
          operators.set(operators.size() - 1, "INTERSECT ALL");
        }
      }
    }
    return new SetExpression(operands, operators, null);
  }

  public static AdqlNode v(AdqlParser.Query_primaryContext ctx, AdqlTreeBuilder b) {
    return b.visit(ctx.getChild(0));
  }

  public static AdqlNode v(AdqlParser.SubqueryContext ctx, AdqlTreeBuilder b) {
    return new Subquery(b.visit(ctx.query_expression()));
  }
}
