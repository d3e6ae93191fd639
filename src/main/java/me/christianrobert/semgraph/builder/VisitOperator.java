package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.pattern.PatternResult;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * Unary and binary operators.
 *
 * <p>Pipes need no special handling: {@code a |> f() |> g()} arrives as a left-nested
 * binary tree and is built like any other operator.</p>
 */
public class VisitOperator {

  public static String binary(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    String symbol = node.getTag();
    OperatorCategory category = OperatorCategory.of(symbol);

    GraphNode self = b.getContext().newNode(id, category.getNodeType(), node);
    self.setProperty(Properties.OPERATOR_SYMBOL, symbol);

    String leftId = NodeAddress.of(id, "left");
    String rightId = NodeAddress.of(id, "right");

    if (category == OperatorCategory.MATCH) {
      // Right side sees the bindings from before the match
      b.build(node.child(1), rightId, depth + 1);
      PatternResult pattern = b.getPatternDecomposer().decompose(node.child(0), leftId, depth + 1);
      b.bindInCurrentScope(pattern.getBindingNames());
      self.setProperty(Properties.BINDING_COUNT, pattern.getBindings().size());
    } else {
      b.build(node.child(0), leftId, depth + 1);
      b.build(node.child(1), rightId, depth + 1);
    }

    self.addRelation(Relations.LEFT_OPERAND, leftId);
    self.addRelation(Relations.RIGHT_OPERAND, rightId);
    return id;
  }

  public static String unary(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    String symbol = node.getTag();
    OperatorCategory category = OperatorCategory.of(symbol);

    GraphNode self = b.getContext().newNode(id, category.getNodeType(), node);
    self.addAuxiliaryType(NodeType.UNARY_OPERATOR);
    self.setProperty(Properties.OPERATOR_SYMBOL, symbol);
    self.addRelation(Relations.OPERAND, b.build(node.child(0), NodeAddress.of(id, "operand"), depth + 1));
    return id;
  }
}
