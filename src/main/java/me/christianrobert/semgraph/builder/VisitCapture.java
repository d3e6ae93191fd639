package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Capture expressions.
 *
 * <ul>
 *   <li>{@code &name/2}, {@code &Mod.name/2} - named captures, with a FunctionReference at {@code self/callee}</li>
 *   <li>{@code &(&1 + &2)} - shorthand; arity is the highest placeholder index, missing indices are gaps</li>
 * </ul>
 */
public class VisitCapture {

  public static final int MIN_PLACEHOLDER = 1;
  public static final int MAX_PLACEHOLDER = 255;

  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    SourceNode target = node.child(0);
    if (isNamedCapture(target)) {
      return named(node, target, id, b);
    }

    TreeSet<Integer> indices = new TreeSet<>();
    collectPlaceholders(target, indices, id);
    int maxCaptures = b.getContext().getLimits().getMaxCaptures();
    if (indices.size() > maxCaptures) {
      throw new GraphBuildException(BuildErrorKind.SIZE_EXCEEDED,
          indices.size() + " capture placeholders exceed maximum of " + maxCaptures, node.getTag(), id);
    }

    int arity = indices.isEmpty() ? 0 : indices.last();
    StringJoiner gaps = new StringJoiner(",");
    for (int i = 1; i < arity; i++) {
      if (!indices.contains(i)) {
        gaps.add(String.valueOf(i));
      }
    }

    GraphNode self = b.getContext().newNode(id, NodeType.CAPTURE, node)
        .setProperty(Properties.CAPTURE_KIND, "shorthand")
        .setProperty(Properties.ARITY, arity)
        .setProperty(Properties.PLACEHOLDER_COUNT, indices.size())
        .setProperty(Properties.HAS_GAPS, gaps.length() > 0)
        .setProperty(Properties.GAPS, gaps.toString());

    b.pushCapture();
    List<String> placeholders;
    try {
      self.addRelation(Relations.BODY, b.build(target, NodeAddress.of(id, "body"), depth + 1));
    } finally {
      placeholders = b.popCapture();
    }
    for (String placeholderId : placeholders) {
      self.addRelation(Relations.PLACEHOLDER, placeholderId);
    }
    return id;
  }

  static String placeholder(SourceNode node, String id, SemanticGraphBuilder b) {
    b.getContext().newNode(id, NodeType.CAPTURE_PLACEHOLDER, node)
        .setProperty(Properties.PLACEHOLDER_INDEX, node.getValue());
    b.registerPlaceholder(id);
    return id;
  }

  // name/arity where name is a bare call, a remote call without arguments or a variable
  private static boolean isNamedCapture(SourceNode target) {
    if (target.getKind() != SourceNode.Kind.OPERATOR || !"/".equals(target.getTag()) || target.childCount() != 2) {
      return false;
    }
    SourceNode function = target.child(0);
    boolean callable = (function.getKind() == SourceNode.Kind.CALL && function.childCount() == 0)
        || NodeShape.classify(function) == NodeShape.VARIABLE;
    return callable && NodeShape.classify(target.child(1)) == NodeShape.INTEGER
        && target.child(1).getValue() instanceof Long;
  }

  private static String named(SourceNode node, SourceNode target, String id, SemanticGraphBuilder b) {
    SourceNode function = target.child(0);
    String qualifier = function.getKind() == SourceNode.Kind.CALL ? function.getValueAsString() : null;
    int arity = ((Long) target.child(1).getValue()).intValue();

    GraphNode self = b.getContext().newNode(id, NodeType.CAPTURE, node)
        .setProperty(Properties.CAPTURE_KIND, qualifier != null ? "named_remote" : "named_local")
        .setProperty(Properties.FUNCTION, VisitCall.qualifiedName(qualifier, function.getTag()))
        .setProperty(Properties.ARITY, arity);

    String calleeId = NodeAddress.of(id, "callee");
    VisitCall.functionReference(calleeId, qualifier, function.getTag(), arity, b);
    self.addRelation(Relations.CALLEE, calleeId);
    return id;
  }

  // Nested captures are not valid source and are not searched
  private static void collectPlaceholders(SourceNode node, TreeSet<Integer> indices, String captureId) {
    if (NodeShape.classify(node) == NodeShape.PLACEHOLDER) {
      long index = (Long) node.getValue();
      if (index < MIN_PLACEHOLDER || index > MAX_PLACEHOLDER) {
        throw new GraphBuildException(BuildErrorKind.INVALID_CAPTURE_INDEX,
            "Capture placeholder &" + index + " is outside " + MIN_PLACEHOLDER + ".." + MAX_PLACEHOLDER,
            node.getTag(), captureId);
      }
      indices.add((int) index);
      return;
    }
    if (node.isConstruct("capture")) {
      return;
    }
    for (SourceNode child : node.getChildren()) {
      collectPlaceholders(child, indices, captureId);
    }
  }
}
