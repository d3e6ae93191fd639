package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ClosureAnalysis;
import me.christianrobert.semgraph.builder.closure.FreeVariableRecord;
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
 * Anonymous functions {@code fn ... end}.
 *
 * <p>The closure analysis runs against the scope stack as it is at this point of the build,
 * before the clauses are built. Output:</p>
 * <pre>
 * self                  AnonymousFunction (+ Closure when it captures)
 * self/clauses/i        Clause
 * self/captures/i       CapturedVariable, sorted by name
 * </pre>
 */
public class VisitClosure {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> clauses = node.getChildren();
    b.getContext().checkFanOut(clauses.size(), node, id);

    List<ClauseParts> parts = new ArrayList<>();
    for (int i = 0; i < clauses.size(); i++) {
      parts.add(ClauseParts.of(clauses.get(i), NodeAddress.of(id, "clauses", i)));
    }
    int arity = ClauseParts.checkArity(parts, "fn", id);

    ClosureAnalysis analysis = b.getClosureAnalyzer()
        .analyze(parts, b.currentScope(), b.getContext().getLimits(), id);

    GraphNode self = b.getContext().newNode(id, NodeType.ANONYMOUS_FUNCTION, node);
    if (analysis.hasCaptures()) {
      self.addAuxiliaryType(NodeType.CLOSURE);
    }
    self.setProperty(Properties.ARITY, arity);
    self.setProperty(Properties.CLAUSE_COUNT, clauses.size());
    self.setProperty(Properties.HAS_CAPTURES, analysis.hasCaptures());
    self.setProperty(Properties.CAPTURE_COUNT, analysis.getCaptureCount());
    self.setProperty(Properties.REFERENCE_COUNT, analysis.getTotalCaptureReferences());
    self.setProperty(Properties.CROSSES_FUNCTION_BOUNDARY, analysis.crossesFunctionBoundary());

    for (int i = 0; i < clauses.size(); i++) {
      String clauseId = NodeAddress.of(id, "clauses", i);
      self.addRelation(Relations.CLAUSE,
          VisitClause.v(clauses.get(i), parts.get(i), clauseId, i, depth + 1, ScopeKind.CLOSURE, "fn", b));
    }

    List<FreeVariableRecord> captured = analysis.getFreeVariables();
    for (int i = 0; i < captured.size(); i++) {
      String captureId = NodeAddress.of(id, "captures", i);
      capturedVariable(captured.get(i), captureId, b);
      self.addRelation(Relations.CAPTURED_VARIABLE, captureId);
    }
    return id;
  }

  private static void capturedVariable(FreeVariableRecord record, String captureId, SemanticGraphBuilder b) {
    GraphNode node = b.getContext().newNode(captureId, NodeType.CAPTURED_VARIABLE)
        .setProperty(Properties.NAME, record.getName())
        .setProperty(Properties.REFERENCE_COUNT, record.getReferenceCount())
        .setProperty(Properties.MUTATION, record.getMutation().getLabel())
        .setProperty(Properties.CAPTURE_DEPTH, record.getCaptureDepth())
        .setProperty(Properties.RESOLVED, record.isResolved())
        .setProperty(Properties.CROSSES_FUNCTION_BOUNDARY, record.crossesFunctionBoundary());
    if (!record.getPositions().isEmpty()) {
      node.setPosition(record.getPositions().get(0));
    }
    if (record.isResolved()) {
      node.setProperty(Properties.SCOPE_KIND, record.getSourceFrame().getKind().getLabel());
      String ownerId = record.getSourceFrame().getOwnerNodeId();
      if (ownerId != null) {
        node.addRelation(Relations.CAPTURED_FROM, ownerId);
      }
    }
  }
}
