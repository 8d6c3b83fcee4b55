package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.FunctionNode;
import me.christianrobert.adqlpg.transformer.node.NodeKind;
import me.christianrobert.adqlpg.transformer.node.NumericLiteral;
import me.christianrobert.adqlpg.transformer.parser.ReservedWords;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for aggregates, numeric functions and user defined functions.
 */
public class VisitFunction {

  public static AdqlNode v(AdqlParser.CountAllContext ctx, AdqlTreeBuilder b) {
    return new FunctionNode(NodeKind.COUNT_ALL, "COUNT", List.of());
  }

  public static AdqlNode v(AdqlParser.GeneralSetFunctionContext ctx, AdqlTreeBuilder b) {
    String quantifier = ctx.set_quantifier() == null
        ? null
        : ctx.set_quantifier().getText().toUpperCase(Locale.ROOT);
    return new FunctionNode(NodeKind.SET_FUNCTION, ctx.set_function_type().getText(), quantifier,
        List.of(b.visit(ctx.value_expression())));
  }

  public static AdqlNode v(AdqlParser.TrigOneArgContext ctx, AdqlTreeBuilder b) {
    return numeric(ctx.trig1_function_name().getText(), List.of(b.visit(ctx.numeric_value_expression())));
  }

  public static AdqlNode v(AdqlParser.TrigAtan2Context ctx, AdqlTreeBuilder b) {
    return numeric("ATAN2", List.of(
        b.visit(ctx.numeric_value_expression(0)),
        b.visit(ctx.numeric_value_expression(1))));
  }

  public static AdqlNode v(AdqlParser.MathNoArgContext ctx, AdqlTreeBuilder b) {
    return numeric("PI", List.of());
  }

  public static AdqlNode v(AdqlParser.MathRandContext ctx, AdqlTreeBuilder b) {
    if (ctx.UNSIGNED_INTEGER() == null) {
      return numeric("RAND", List.of());
    }
    return numeric("RAND", List.of(new NumericLiteral(ctx.UNSIGNED_INTEGER().getText())));
  }

  public static AdqlNode v(AdqlParser.MathOneArgContext ctx, AdqlTreeBuilder b) {
    return numeric(ctx.math1_function_name().getText(), List.of(b.visit(ctx.numeric_value_expression())));
  }

  public static AdqlNode v(AdqlParser.MathOptPrecContext ctx, AdqlTreeBuilder b) {
    // Grammar: (ROUND | TRUNCATE) '(' numeric_value_expression (',' signed_integer)? ')'
    List<AdqlNode> args = new ArrayList<>();
    args.add(b.visit(ctx.numeric_value_expression()));
    if (ctx.signed_integer() != null) {
      args.add(b.visit(ctx.signed_integer()));
    }
    return numeric(ctx.opt_prec_function_name().getText(), args);
  }

  public static AdqlNode v(AdqlParser.MathTwoArgContext ctx, AdqlTreeBuilder b) {
    return numeric(ctx.math2_function_name().getText(), List.of(
        b.visit(ctx.numeric_value_expression(0)),
        b.visit(ctx.numeric_value_expression(1))));
  }

  public static AdqlNode v(AdqlParser.User_defined_functionContext ctx, AdqlTreeBuilder b) {
    Token nameToken = ctx.REGULAR_IDENTIFIER().getSymbol();
    String name = nameToken.getText();
    if (ReservedWords.isReserved(name)) {
      throw b.syntaxError("'" + name + "' is a reserved word and cannot be used as a function name", nameToken);
    }
    if (!b.hasUserFunctionPrefix(name)) {
      throw b.syntaxError("Unknown function " + name
          + " (user defined functions need a registered prefix)", nameToken);
    }

    List<AdqlNode> args = new ArrayList<>();
    for (AdqlParser.Value_expressionContext arg : ctx.value_expression()) {
      args.add(b.visit(arg));
    }
    b.getUserFunctions().checkCall(name, args.size());
    return new FunctionNode(NodeKind.USER_FUNCTION, name, args);
  }

  private static AdqlNode numeric(String name, List<AdqlNode> args) {
    return new FunctionNode(NodeKind.NUMERIC_FUNCTION, name, args);
  }
}
