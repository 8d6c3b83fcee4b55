package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.Identifier;
import me.christianrobert.adqlpg.transformer.parser.ReservedWords;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for identifiers and dotted names.
 */
public class VisitIdentifier {

  public static Identifier identifier(AdqlParser.IdentifierContext ctx, AdqlTreeBuilder b) {
    if (ctx.DELIMITED_IDENTIFIER() != null) {
      // Quoted names may be anything, reserved words included
      return Identifier.fromToken(ctx.DELIMITED_IDENTIFIER().getText());
    }
    Token token = ctx.REGULAR_IDENTIFIER().getSymbol();
    if (ReservedWords.isReserved(token.getText())) {
      throw b.syntaxError("'" + token.getText() + "' is a reserved word and cannot be used as a name"
          + " (put it into double quotes if you need it)", token);
    }
    return Identifier.regular(token.getText());
  }

  /**
   * Parts of a dotted name, checking the number of parts allowed for what it names.
   */
  public static List<Identifier> qualifiedName(AdqlParser.Qualified_nameContext ctx, AdqlTreeBuilder b,
                                               int maxParts, String what) {
    List<Identifier> parts = new ArrayList<>();
    for (AdqlParser.IdentifierContext part : ctx.identifier()) {
      parts.add(identifier(part, b));
    }
    if (parts.size() > maxParts) {
      throw b.syntaxError("A " + what + " reference can have at most " + maxParts + " parts: "
          + ctx.getText(), ctx.getStart());
    }
    return parts;
  }
}
