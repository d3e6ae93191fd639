package me.christianrobert.semgraph.util;

import me.christianrobert.semgraph.source.SourceNode;

/**
 * Formats source trees into human-readable, indented text.
 *
 * <p>Useful for checking what the upstream parser actually handed over.</p>
 *
 * <p>Example output for {@code x > 5 and y < 10}:</p>
 * <pre>
 * OPERATOR and
 *   OPERATOR &gt;
 *     VARIABLE x
 *     LITERAL integer 5
 *   OPERATOR &lt;
 *     VARIABLE y
 *     LITERAL integer 10
 * </pre>
 */
public class SourceTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  public static String format(SourceNode tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SourceNode node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(node.getKind()).append(' ').append(node.getTag());
    if (node.getValue() != null) {
      sb.append(' ').append(truncate(node.getValueAsString()));
    }
    if (node.getPosition() != null) {
      sb.append(" [").append(node.getPosition()).append(']');
    }
    sb.append('\n');
    for (SourceNode child : node.getChildren()) {
      formatNode(child, depth + 1, sb);
    }
  }

  private static String truncate(String text) {
    String escaped = text.replace("\n", "\\n");
    if (escaped.length() > MAX_TEXT_LENGTH) {
      return escaped.substring(0, MAX_TEXT_LENGTH - 3) + "...";
    }
    return escaped;
  }
}
