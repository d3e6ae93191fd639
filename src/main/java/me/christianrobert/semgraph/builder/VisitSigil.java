package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * Sigils such as {@code ~r/abc/i}. Source shape: value = letter, children = [content, modifiers].
 */
public class VisitSigil {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    GraphNode self = b.getContext().newNode(id, NodeType.SIGIL_LITERAL, node);
    self.setProperty(Properties.SIGIL_CHAR, node.getValueAsString());

    SourceNode content = node.child(0);
    if (content.is(SourceNode.Kind.LITERAL, "string")) {
      self.setProperty(Properties.CONTENT, content.getValue() != null ? content.getValueAsString() : "");
    } else {
      // Interpolated content
      self.addRelation(Relations.CONTENT, b.build(content, NodeAddress.of(id, "content"), depth + 1));
    }

    self.setProperty(Properties.MODIFIERS, decodeModifiers(node.child(1)));
    return id;
  }

  /**
   * Decodes the modifier character codes into a plain string, e.g. [105, 120] to "ix".
   * Charlist and string forms are taken as they are.
   */
  static String decodeModifiers(SourceNode modifiers) {
    if (modifiers.getKind() == SourceNode.Kind.LITERAL) {
      return modifiers.getValue() != null ? modifiers.getValueAsString() : "";
    }
    StringBuilder sb = new StringBuilder();
    for (SourceNode code : modifiers.getChildren()) {
      if (code.getValue() instanceof Long) {
        long value = (Long) code.getValue();
        if (value >= 0 && value <= Character.MAX_CODE_POINT) {
          sb.appendCodePoint((int) value);
        }
      }
    }
    return sb.toString();
  }
}
