package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.builder.pattern.PatternResult;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * One clause of a {@code fn}, {@code def} or {@code case}.
 *
 * <p>Each clause gets its own scope frame holding its parameter bindings, so a guard sees
 * the bindings of its own clause and never those of a sibling clause. Parameters are
 * separate top-level patterns: {@code fn x, x -> ...} is an equality constraint, not a
 * duplicate binding.</p>
 */
public class VisitClause {
  public static String v(SourceNode clause, ClauseParts parts, String id, int order, int depth,
                         ScopeKind scopeKind, String scopeName, SemanticGraphBuilder b) {
    GraphNode self = b.getContext().newNode(id, NodeType.CLAUSE, clause);
    self.setProperty(Properties.ORDER, order);
    self.setProperty(Properties.ARITY, parts.getArity());

    ScopeFrame frame = b.pushScope(scopeKind, scopeName, id);
    try {
      List<SourceNode> parameters = parts.getParameters();
      b.getContext().checkFanOut(parameters.size(), clause, id);
      int bindingCount = 0;
      for (int i = 0; i < parameters.size(); i++) {
        String parameterId = NodeAddress.of(id, "parameters", i);
        PatternResult pattern = b.getPatternDecomposer().decompose(parameters.get(i), parameterId, depth + 1);
        frame.bindAll(pattern.getBindingNames());
        bindingCount += pattern.getBindings().size();
        self.addRelation(Relations.PARAMETER, parameterId);
      }
      self.setProperty(Properties.BINDING_COUNT, bindingCount);

      if (parts.hasGuard()) {
        self.addRelation(Relations.GUARD, b.build(parts.getGuard(), NodeAddress.of(id, "guard"), depth + 1));
      }
      self.addRelation(Relations.BODY, b.build(parts.getBody(), NodeAddress.of(id, "body"), depth + 1));
    } finally {
      b.popScope();
    }
    return id;
  }
}
