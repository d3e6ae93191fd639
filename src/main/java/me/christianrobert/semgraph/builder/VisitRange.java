package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

public class VisitRange {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    GraphNode self = b.getContext().newNode(id, NodeType.RANGE_LITERAL, node);

    bound(self, node.child(0), "first", Relations.RANGE_START, Properties.FIRST, depth, b);
    bound(self, node.child(1), "last", Relations.RANGE_END, Properties.LAST, depth, b);
    if (node.childCount() == 3) {
      bound(self, node.child(2), "step", Relations.RANGE_STEP, Properties.STEP, depth, b);
    }
    return id;
  }

  // Integer bounds are also copied to properties so ranges can be compared without joins
  private static void bound(GraphNode self, SourceNode bound, String label, String relation, String property,
                            int depth, SemanticGraphBuilder b) {
    String boundId = b.build(bound, NodeAddress.of(self.getId(), label), depth + 1);
    self.addRelation(relation, boundId);
    if (NodeShape.classify(bound) == NodeShape.INTEGER) {
      self.setProperty(property, bound.getValue());
    }
  }
}
