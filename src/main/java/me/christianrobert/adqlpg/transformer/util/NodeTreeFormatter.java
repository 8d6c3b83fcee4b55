package me.christianrobert.adqlpg.transformer.util;

import me.christianrobert.adqlpg.transformer.fieldinfo.FieldInfo;
import me.christianrobert.adqlpg.transformer.node.AdqlNode;
import me.christianrobert.adqlpg.transformer.node.FieldInfoed;

/**
 * Formats node trees into human-readable, indented text.
 *
 * <p>Useful for debugging the tree builder and the morph passes.</p>
 *
 * <p>Example output (with annotations):</p>
 * <pre>
 * QUERY_SPECIFICATION
 *   SELECT_LIST
 *     DERIVED_COLUMN [unit=deg, ucd=pos.eq.ra]
 *       COLUMN_REFERENCE "ra" [unit=deg, ucd=pos.eq.ra]
 *   FROM_CLAUSE
 *     PLAIN_TABLE_REFERENCE
 *       TABLE_NAME "ppmx.data"
 * </pre>
 */
public class NodeTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a node tree without annotations.
   */
  public static String format(AdqlNode tree) {
    return format(tree, false);
  }

  /**
   * Formats a node tree, optionally appending the unit, UCD and frame of annotated nodes.
   */
  public static String format(AdqlNode tree, boolean withAnnotations) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, withAnnotations);
    return sb.toString();
  }

  private static void formatNode(AdqlNode node, int depth, StringBuilder sb, boolean withAnnotations) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(node.kind().name());

    // Leaves show their text, inner nodes would only repeat their children
    if (node.children().isEmpty()) {
      sb.append(" \"").append(escapeAndTruncate(node.flatten())).append("\"");
    }

    if (withAnnotations && node instanceof FieldInfoed) {
      FieldInfo info = ((FieldInfoed) node).getFieldInfo();
      if (info != null) {
        sb.append(" [unit=").append(info.getUnit()).append(", ucd=").append(info.getUcd());
        if (info.getStc() != null) {
          sb.append(", stc=").append(info.getStc());
        }
        sb.append("]");
      }
    }
    sb.append("\n");

    for (AdqlNode child : node.children()) {
      formatNode(child, depth + 1, sb, withAnnotations);
    }
  }

  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }
    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");
    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
