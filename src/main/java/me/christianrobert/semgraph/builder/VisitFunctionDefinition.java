package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code def}/{@code defp}. Source shape: value = function name, children = clauses.
 * All clauses must take the same number of parameters.
 */
public class VisitFunctionDefinition {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> clauses = node.getChildren();
    b.getContext().checkFanOut(clauses.size(), node, id);

    String name = node.getValueAsString();
    List<ClauseParts> parts = new ArrayList<>();
    for (int i = 0; i < clauses.size(); i++) {
      parts.add(ClauseParts.of(clauses.get(i), NodeAddress.of(id, "clauses", i)));
    }
    int arity = ClauseParts.checkArity(parts, node.getTag() + " " + name, id);

    GraphNode self = b.getContext().newNode(id, NodeType.FUNCTION_DEFINITION, node)
        .setProperty(Properties.NAME, name)
        .setProperty(Properties.ARITY, arity)
        .setProperty(Properties.VISIBILITY, "defp".equals(node.getTag()) ? "private" : "public")
        .setProperty(Properties.CLAUSE_COUNT, clauses.size());

    String scopeName = name + "/" + arity;
    for (int i = 0; i < clauses.size(); i++) {
      String clauseId = NodeAddress.of(id, "clauses", i);
      self.addRelation(Relations.CLAUSE,
          VisitClause.v(clauses.get(i), parts.get(i), clauseId, i, depth + 1, ScopeKind.FUNCTION, scopeName, b));
    }
    return id;
  }
}
