package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * Placeholder for shapes the builder does not understand. Soft: the build continues.
 */
public class VisitUnknown {
  public static String v(SourceNode node, String id, String reason, SemanticGraphBuilder b) {
    String tag = node != null ? node.getTag() : "(null)";
    b.getContext().newNode(id, NodeType.UNKNOWN_EXPRESSION, node)
        .setProperty(Properties.ORIGINAL_TAG, tag);
    b.getContext().addDiagnostic(BuildErrorKind.UNRECOGNIZED_NODE_SHAPE, id, reason + ": " + tag);
    return id;
  }
}
