package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.Factor;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.node.OperatorExpression;
import me.christianrobert.adqlpg.transformer.node.ParenthesizedExpression;
import me.christianrobert.adqlpg.transformer.node.StringLiteral;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for value expressions, literals and column references.
 */
public class VisitValueExpression {

  public static AdqlNode v(AdqlParser.Numeric_value_expressionContext ctx, AdqlTreeBuilder b) {
    // Grammar: term (additive_operator term)*
    if (ctx.term().size() == 1) {
      return b.visit(ctx.term(0));
    }
    List<AdqlNode> operands = new ArrayList<>();
    for (AdqlParser.TermContext term : ctx.term()) {
      operands.add(b.visit(term));
    }
    List<String> operators = new ArrayList<>();
    for (AdqlParser.Additive_operatorContext op : ctx.additive_operator()) {
      operators.add(op.getText());
    }
    return new OperatorExpression(NodeKind.NUMERIC_VALUE_EXPRESSION, operands, operators);
  }

  public static AdqlNode v(AdqlParser.TermContext ctx, AdqlTreeBuilder b) {
    // Grammar: factor (multiplicative_operator factor)*
    if (ctx.factor().size() == 1) {
      return b.visit(ctx.factor(0));
    }
    List<AdqlNode> operands = new ArrayList<>();
    for (AdqlParser.FactorContext factor : ctx.factor()) {
      operands.add(b.visit(factor));
    }
    List<String> operators = new ArrayList<>();
    for (AdqlParser.Multiplicative_operatorContext op : ctx.multiplicative_operator()) {
      operators.add(op.getText());
    }
    return new OperatorExpression(NodeKind.TERM, operands, operators);
  }

  public static AdqlNode v(AdqlParser.FactorContext ctx, AdqlTreeBuilder b) {
    AdqlNode primary = b.visit(ctx.numeric_primary());
    if (ctx.sign() == null) {
      return primary;
    }
    return new Factor(ctx.sign().getText(), primary);
  }

  public static AdqlNode v(AdqlParser.NumericLiteralContext ctx, AdqlTreeBuilder b) {
    return new NumericLiteral(ctx.getText());
  }

  public static AdqlNode v(AdqlParser.ParenthesizedValueContext ctx, AdqlTreeBuilder b) {
    return new ParenthesizedExpression(b.visit(ctx.value_expression()));
  }

  public static AdqlNode v(AdqlParser.Signed_integerContext ctx, AdqlTreeBuilder b) {
    NumericLiteral literal = new NumericLiteral(ctx.UNSIGNED_INTEGER().getText());
    if (ctx.sign() == null) {
      return literal;
    }
    return new Factor(ctx.sign().getText(), literal);
  }

  public static AdqlNode v(AdqlParser.Character_value_expressionContext ctx, AdqlTreeBuilder b) {
    // Grammar: character_primary ('||' character_primary)*
    List<AdqlParser.Character_primaryContext> primaries = ctx.character_primary();
    if (primaries.size() == 1) {
      return b.visit(primaries.get(0));
    }
    List<AdqlNode> operands = new ArrayList<>();
    List<String> operators = new ArrayList<>();
    for (AdqlParser.Character_primaryContext primary : primaries) {
      if (!operands.isEmpty()) {
        operators.add("||");
      }
      operands.add(b.visit(primary));
    }
    return new OperatorExpression(NodeKind.CHARACTER_VALUE_EXPRESSION, operands, operators);
  }

  public static AdqlNode v(AdqlParser.Character_string_literalContext ctx, AdqlTreeBuilder b) {
    List<String> tokens = new ArrayList<>();
    for (TerminalNode token : ctx.STRING_LITERAL()) {
      tokens.add(token.getText());
    }
    return StringLiteral.fromTokens(tokens);
  }

  public static AdqlNode v(AdqlParser.Column_referenceContext ctx, AdqlTreeBuilder b) {
    return new ColumnReference(VisitIdentifier.qualifiedName(ctx.qualified_name(), b, 4, "column"));
  }
}
