package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * Variables, module attributes and module aliases.
 */
public class VisitReference {
  public static String v(SourceNode node, NodeShape shape, String id, int depth, SemanticGraphBuilder b) {
    switch (shape) {
      case VARIABLE:
        b.getContext().newNode(id, NodeType.VARIABLE, node)
            .setProperty(Properties.NAME, node.getTag());
        break;
      case ALIAS:
        b.getContext().newNode(id, NodeType.MODULE_REFERENCE, node)
            .setProperty(Properties.NAME, node.getValueAsString());
        break;
      case MODULE_ATTRIBUTE: {
        GraphNode self = b.getContext().newNode(id, NodeType.MODULE_ATTRIBUTE, node)
            .setProperty(Properties.NAME, node.getValueAsString());
        // @name value defines the attribute
        if (node.childCount() == 1) {
          self.addRelation(Relations.VALUE, b.build(node.child(0), NodeAddress.of(id, "value"), depth + 1));
        }
        break;
      }
      default:
        throw new IllegalArgumentException("Not a reference shape: " + shape);
    }
    return id;
  }
}
