package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * Scalar literals. Values are stored as already evaluated by the parser; an integer beyond
 * 64 bits keeps its decimal string as {@code integerValue}.
 */
public class VisitLiteral {
  public static String v(SourceNode node, NodeShape shape, String id, SemanticGraphBuilder b) {
    switch (shape) {
      case INTEGER:
        b.getContext().newNode(id, NodeType.INTEGER_LITERAL, node)
            .setProperty(Properties.INTEGER_VALUE, node.getValue());
        break;
      case FLOAT:
        b.getContext().newNode(id, NodeType.FLOAT_LITERAL, node)
            .setProperty(Properties.FLOAT_VALUE, ((Number) node.getValue()).doubleValue());
        break;
      case STRING:
        b.getContext().newNode(id, NodeType.STRING_LITERAL, node)
            .setProperty(Properties.STRING_VALUE, textOf(node));
        break;
      case CHARLIST:
        b.getContext().newNode(id, NodeType.CHARLIST_LITERAL, node)
            .setProperty(Properties.CHARLIST_VALUE, textOf(node));
        break;
      case BOOLEAN:
        b.getContext().newNode(id, NodeType.BOOLEAN_LITERAL, node)
            .setProperty(Properties.BOOLEAN_VALUE, node.getValue());
        break;
      case NIL:
        b.getContext().newNode(id, NodeType.NIL_LITERAL, node);
        break;
      case ATOM:
        atom(node.getValueAsString(), id, b).setPosition(node.getPosition());
        break;
      default:
        throw new IllegalArgumentException("Not a scalar literal shape: " + shape);
    }
    return id;
  }

  /**
   * Creates an atom node. Also used for the normalized keys of {@code key: value} entries.
   */
  public static GraphNode atom(String name, String id, SemanticGraphBuilder b) {
    return b.getContext().newNode(id, NodeType.ATOM_LITERAL)
        .setProperty(Properties.ATOM_VALUE, renderAtom(name));
  }

  /**
   * {@code true}, {@code false} and {@code nil} render bare, every other atom as {@code :name}.
   */
  public static String renderAtom(String name) {
    if ("true".equals(name) || "false".equals(name) || "nil".equals(name)) {
      return name;
    }
    return ":" + name;
  }

  // Empty strings are omitted from the JSON input form
  private static String textOf(SourceNode node) {
    return node.getValue() != null ? node.getValueAsString() : "";
  }
}
