package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * Statement sequences. A block opens no scope: matches bind into the enclosing region.
 */
public class VisitBlock {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> statements = node.getChildren();
    b.getContext().checkFanOut(statements.size(), node, id);

    GraphNode self = b.getContext().newNode(id, NodeType.BLOCK, node);
    self.setProperty(Properties.SIZE, statements.size());
    for (int i = 0; i < statements.size(); i++) {
      String statementId = NodeAddress.of(id, "statements", i);
      self.addRelation(Relations.STATEMENT, b.build(statements.get(i), statementId, depth + 1));
    }
    return id;
  }
}
