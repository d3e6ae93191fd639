package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * Local calls {@code f(a)} and remote calls {@code Mod.f(a)}.
 *
 * <p>The callee is a FunctionReference at {@code self/callee} carrying the name as written;
 * no attempt is made to resolve which module actually defines it.</p>
 */
public class VisitCall {
  public static String v(SourceNode node, NodeShape shape, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> arguments = node.getChildren();
    b.getContext().checkFanOut(arguments.size(), node, id);

    String qualifier = shape == NodeShape.REMOTE_CALL ? node.getValueAsString() : null;
    String name = qualifiedName(qualifier, node.getTag());

    NodeType type = shape == NodeShape.REMOTE_CALL ? NodeType.REMOTE_CALL : NodeType.LOCAL_CALL;
    GraphNode self = b.getContext().newNode(id, type, node);
    self.setProperty(Properties.NAME, name);
    self.setProperty(Properties.QUALIFIER, qualifier);
    self.setProperty(Properties.ARITY, arguments.size());

    String calleeId = NodeAddress.of(id, "callee");
    functionReference(calleeId, qualifier, node.getTag(), arguments.size(), b);
    self.addRelation(Relations.CALLEE, calleeId);

    for (int i = 0; i < arguments.size(); i++) {
      String argumentId = NodeAddress.of(id, "arguments", i);
      self.addRelation(Relations.ARGUMENT, b.build(arguments.get(i), argumentId, depth + 1));
    }
    return id;
  }

  static GraphNode functionReference(String id, String qualifier, String function, int arity, SemanticGraphBuilder b) {
    return b.getContext().newNode(id, NodeType.FUNCTION_REFERENCE)
        .setProperty(Properties.NAME, qualifiedName(qualifier, function))
        .setProperty(Properties.QUALIFIER, qualifier)
        .setProperty(Properties.FUNCTION, function)
        .setProperty(Properties.ARITY, arity);
  }

  static String qualifiedName(String qualifier, String function) {
    return qualifier != null ? qualifier + "." + function : function;
  }
}
