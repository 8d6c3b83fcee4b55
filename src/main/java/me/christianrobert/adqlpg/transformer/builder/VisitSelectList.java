package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.ColumnReference;
import me.christianrobert.adqlpg.transformer.node.DerivedColumn;
import me.christianrobert.adqlpg.transformer.node.Functional;
import me.christianrobert.adqlpg.transformer.node.Identifier;
import me.christianrobert.adqlpg.transformer.node.QualifiedStar;
import me.christianrobert.adqlpg.transformer.node.SelectList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static helper for select lists.
 *
 * <p>Derived columns without alias that are not plain column references get a
 * generated name: the lower-cased function name, or "expr", with a numeric suffix
 * if the name is already used in the same select list.</p>
 */
public class VisitSelectList {

  public static AdqlNode v(AdqlParser.Select_listContext ctx, AdqlTreeBuilder b) {
    // Grammar: '*' | select_sublist (',' select_sublist)*
    if (ctx.select_sublist().isEmpty()) {
      return SelectList.star();
    }

    List<AdqlNode> expressions = new ArrayList<>();
    List<Identifier> aliases = new ArrayList<>();
    Set<String> takenNames = new HashSet<>();

    for (AdqlParser.Select_sublistContext sublist : ctx.select_sublist()) {
      if (sublist instanceof AdqlParser.QualifiedStarContext) {
        AdqlParser.QualifiedStarContext star = (AdqlParser.QualifiedStarContext) sublist;
        expressions.add(new QualifiedStar(VisitIdentifier.qualifiedName(star.qualified_name(), b, 3, "table")));
        aliases.add(null);
        continue;
      }
      AdqlParser.DerivedColumnContext derived = (AdqlParser.DerivedColumnContext) sublist;
      AdqlNode expression = b.visit(derived.value_expression());
      Identifier alias = derived.as_clause() == null
          ? null
          : VisitIdentifier.identifier(derived.as_clause().identifier(), b);
      if (alias != null) {
        takenNames.add(alias.normalized());
      } else if (expression instanceof ColumnReference) {
        takenNames.add(((ColumnReference) expression).getColumnName());
      }
      expressions.add(expression);
      aliases.add(alias);
    }

    List<AdqlNode> items = new ArrayList<>();
    for (int i = 0; i < expressions.size(); i++) {
      AdqlNode expression = expressions.get(i);
      if (expression instanceof QualifiedStar) {
        items.add(expression);
        continue;
      }
      Identifier alias = aliases.get(i);
      String generatedName = null;
      if (alias == null && !(expression instanceof ColumnReference)) {
        generatedName = uniqueName(baseName(expression), takenNames);
        takenNames.add(generatedName);
      }
      items.add(new DerivedColumn(expression, alias, generatedName));
    }
    return SelectList.of(items);
  }

  private static String baseName(AdqlNode expression) {
    if (expression instanceof Functional) {
      return ((Functional) expression).getFunctionName().toLowerCase(Locale.ROOT);
    }
    return "expr";
  }

  private static String uniqueName(String base, Set<String> takenNames) {
    if (!takenNames.contains(base)) {
      return base;
    }
    int suffix = 1;
    while (takenNames.contains(base + suffix)) {
      suffix++;
    }
    return base + suffix;
  }
}
