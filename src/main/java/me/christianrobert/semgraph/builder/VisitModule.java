package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.context.BuildContext;
import me.christianrobert.semgraph.context.ConstructFailure;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * {@code defmodule}. Source shape: value = module name, children = top-level constructs.
 *
 * <p>Every top-level construct is built in a forked context. A construct that fails hard is
 * dropped with all of its nodes and reported as a {@link ConstructFailure}; its siblings are
 * kept and linked through {@code contains}. Module-level bindings a construct makes are staged
 * and only reach the module frame once the construct has been merged.</p>
 */
public class VisitModule {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> body = node.getChildren();
    BuildContext context = b.getContext();
    context.checkFanOut(body.size(), node, id);

    GraphNode self = context.newNode(id, NodeType.MODULE_DEFINITION, node)
        .setProperty(Properties.NAME, node.getValueAsString());

    ScopeFrame frame = b.pushScope(ScopeKind.MODULE, node.getValueAsString(), id);
    try {
      int built = 0;
      for (int i = 0; i < body.size(); i++) {
        SourceNode construct = body.get(i);
        String constructId = NodeAddress.of(id, "body", i);
        BuildContext fork = context.fork();
        ScopeFrame staged = frame.staging();
        try {
          new SemanticGraphBuilder(fork, staged).build(construct, constructId, depth + 1);
          context.merge(fork);
          frame.commit(staged);
          self.addRelation(Relations.CONTAINS, constructId);
          built++;
        } catch (GraphBuildException e) {
          String constructName = SemanticGraphBuilder.describeConstruct(construct);
          e.inConstruct(constructName);
          context.addFailure(ConstructFailure.from(constructName, constructId, e));
        }
      }
      self.setProperty(Properties.SIZE, built);
    } finally {
      b.popScope();
    }
    return id;
  }
}
