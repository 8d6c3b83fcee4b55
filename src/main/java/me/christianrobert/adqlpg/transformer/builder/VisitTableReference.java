package me.christianrobert.adqlpg.transformer.builder;

import me.christianrobert.adqlpg.antlr.AdqlParser;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.DerivedTable;
import me.christianrobert.adqlpg.transformer.node.FromClause;
import me.christianrobert.adqlpg.transformer.node.Identifier;
import me.christianrobert.adqlpg.transformer.node.JoinSpecification;
import me.christianrobert.adqlpg.transformer.node.JoinedTable;
import me.christianrobert.adqlpg.transformer.node.PlainTableRef;
import me.christianrobert.adqlpg.transformer.node.Subquery;
import me.christianrobert.adqlpg.transformer.node.TableName;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for the FROM clause: tables, derived tables and joins.
 * Join chains are folded to the left.
 */
public class VisitTableReference {

  public static AdqlNode v(AdqlParser.From_clauseContext ctx, AdqlTreeBuilder b) {
    List<AdqlNode> tables = new ArrayList<>();
    for (AdqlParser.Table_referenceContext ref : ctx.table_reference()) {
      tables.add(b.visit(ref));
    }
    return new FromClause(tables);
  }

  public static AdqlNode v(AdqlParser.Table_referenceContext ctx, AdqlTreeBuilder b) {
    return b.visit(ctx.getChild(0));
  }

  public static AdqlNode v(AdqlParser.PlainTableContext ctx, AdqlTreeBuilder b) {
    TableName name = new TableName(VisitIdentifier.qualifiedName(ctx.qualified_name(), b, 3, "table"));
    return new PlainTableRef(name, alias(ctx.correlation_specification(), b));
  }

  public static AdqlNode v(AdqlParser.DerivedTableContext ctx, AdqlTreeBuilder b) {
    Subquery subquery = (Subquery) b.visit(ctx.subquery());
    return new DerivedTable(subquery, alias(ctx.correlation_specification(), b));
  }

  public static AdqlNode v(AdqlParser.ParenthesizedJoinContext ctx, AdqlTreeBuilder b) {
    // Grammar: '(' joined_table ')' join_tail*
    AdqlNode left = ((JoinedTable) b.visit(ctx.joined_table())).asParenthesized();
    return foldTails(left, ctx.join_tail(), b);
  }

  public static AdqlNode v(AdqlParser.QualifiedJoinContext ctx, AdqlTreeBuilder b) {
    // Grammar: nojoin_table_reference join_tail+
    AdqlNode left = b.visit(ctx.nojoin_table_reference());
    return foldTails(left, ctx.join_tail(), b);
  }

  public static AdqlNode v(AdqlParser.Join_operandContext ctx, AdqlTreeBuilder b) {
    if (ctx.nojoin_table_reference() != null) {
      return b.visit(ctx.nojoin_table_reference());
    }
    return ((JoinedTable) b.visit(ctx.joined_table())).asParenthesized();
  }

  private static AdqlNode foldTails(AdqlNode left, List<AdqlParser.Join_tailContext> tails, AdqlTreeBuilder b) {
    AdqlNode result = left;
    for (AdqlParser.Join_tailContext tail : tails) {
      // Grammar: NATURAL? join_type? JOIN join_operand join_specification?
      boolean natural = tail.NATURAL() != null;
      AdqlNode right = b.visit(tail.join_operand());
      JoinSpecification spec = tail.join_specification() == null
          ? null
          : joinSpecification(tail.join_specification(), b);
      if (natural && spec != null) {
        throw b.syntaxError("A NATURAL join cannot have an ON or USING clause", tail.join_specification().getStart());
      }
      result = new JoinedTable(result, right, natural, joinType(tail.join_type()), spec, false);
    }
    return result;
  }

  private static String joinType(AdqlParser.Join_typeContext ctx) {
    if (ctx == null) {
      return null;
    }
    List<String> words = new ArrayList<>();
    for (ParseTree child : ctx.children) {
      words.add(child.getText().toUpperCase(Locale.ROOT));
    }
    return String.join(" ", words);
  }

  private static JoinSpecification joinSpecification(AdqlParser.Join_specificationContext ctx, AdqlTreeBuilder b) {
    if (ctx instanceof AdqlParser.JoinConditionContext) {
      return JoinSpecification.on(b.visit(((AdqlParser.JoinConditionContext) ctx).search_condition()));
    }
    List<Identifier> columns = new ArrayList<>();
    for (AdqlParser.IdentifierContext id : ((AdqlParser.NamedColumnsJoinContext) ctx).identifier()) {
      columns.add(VisitIdentifier.identifier(id, b));
    }
    return JoinSpecification.using(columns);
  }

  private static Identifier alias(AdqlParser.Correlation_specificationContext ctx, AdqlTreeBuilder b) {
    return ctx == null ? null : VisitIdentifier.identifier(ctx.identifier(), b);
  }
}
