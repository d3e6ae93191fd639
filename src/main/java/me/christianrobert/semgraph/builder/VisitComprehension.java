package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.PatternResult;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * {@code for} comprehensions. Source shape: children = [qualifier..., body]; a qualifier is
 * either {@code generator[pattern, enumerable]} or a filter expression.
 *
 * <p>The comprehension opens one block frame. Each generator's enumerable is built before its
 * pattern binds, so it only sees bindings of earlier generators.</p>
 */
public class VisitComprehension {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    int qualifierCount = node.childCount() - 1;
    b.getContext().checkFanOut(qualifierCount, node, id);

    GraphNode self = b.getContext().newNode(id, NodeType.COMPREHENSION, node);
    ScopeFrame frame = b.pushScope(ScopeKind.BLOCK, "for", id);
    try {
      int generators = 0;
      int filters = 0;
      for (int i = 0; i < qualifierCount; i++) {
        SourceNode qualifier = node.child(i);
        if (qualifier.isConstruct("generator") && qualifier.childCount() == 2) {
          String generatorId = NodeAddress.of(id, "generators", generators++);
          GraphNode generator = b.getContext().newNode(generatorId, NodeType.GENERATOR, qualifier);
          String enumerableId = b.build(qualifier.child(1), NodeAddress.of(generatorId, "enumerable"), depth + 2);
          PatternResult pattern = b.getPatternDecomposer()
              .decompose(qualifier.child(0), NodeAddress.of(generatorId, "pattern"), depth + 2);
          frame.bindAll(pattern.getBindingNames());
          generator.addRelation(Relations.PATTERN, pattern.getNodeId());
          generator.addRelation(Relations.ENUMERABLE, enumerableId);
          self.addRelation(Relations.GENERATOR, generatorId);
        } else {
          String filterId = NodeAddress.of(id, "filters", filters++);
          self.addRelation(Relations.FILTER, b.build(qualifier, filterId, depth + 1));
        }
      }
      self.addRelation(Relations.BODY, b.build(node.child(qualifierCount), NodeAddress.of(id, "body"), depth + 1));
    } finally {
      b.popScope();
    }
    return id;
  }
}
