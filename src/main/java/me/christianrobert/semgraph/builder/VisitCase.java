package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

/**
 * {@code case subject do pattern -> body end}. Source shape: children = [subject, clause...],
 * every clause with exactly one parameter pattern.
 */
public class VisitCase {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    int clauseCount = node.childCount() - 1;
    b.getContext().checkFanOut(clauseCount, node, id);

    GraphNode self = b.getContext().newNode(id, NodeType.CASE_EXPRESSION, node);
    self.setProperty(Properties.CLAUSE_COUNT, clauseCount);
    self.addRelation(Relations.SUBJECT, b.build(node.child(0), NodeAddress.of(id, "subject"), depth + 1));

    for (int i = 0; i < clauseCount; i++) {
      SourceNode clause = node.child(i + 1);
      String clauseId = NodeAddress.of(id, "clauses", i);
      ClauseParts parts = ClauseParts.of(clause, clauseId);
      if (parts.getArity() != 1) {
        throw new GraphBuildException(BuildErrorKind.MALFORMED_PATTERN,
            "Case clause " + i + " must have exactly one pattern, found " + parts.getArity(),
            clause.getTag(), clauseId);
      }
      self.addRelation(Relations.CLAUSE,
          VisitClause.v(clause, parts, clauseId, i, depth + 1, ScopeKind.BLOCK, null, b));
    }
    return id;
  }
}
