package me.christianrobert.semgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.semgraph.builder.SemanticGraphBuilder;
import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.PatternResult;
import me.christianrobert.semgraph.config.GraphConfigService;
import me.christianrobert.semgraph.context.BuildContext;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.BuildLimits;
import me.christianrobert.semgraph.context.ConstructFailure;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.context.GraphBuildResult;
import me.christianrobert.semgraph.graph.GraphJsonWriter;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;
import me.christianrobert.semgraph.util.SourceTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for turning source trees into semantic graphs.
 *
 * <p>Architecture:</p>
 * <pre>
 * SourceNode → NodeShape.classify → SemanticGraphBuilder → Visit* helpers → GraphNode list
 *                                          ↓
 *                             PatternDecomposer / ClosureAnalyzer
 * </pre>
 *
 * <p>Every call builds in a fresh {@link BuildContext}, so the service holds no build state
 * and may be called from several threads for independent constructs. A hard failure turns
 * the whole call into a failure result; no partial node set is ever returned. Inside a
 * module, failures are contained per top-level construct instead.</p>
 */
@ApplicationScoped
public class SemanticGraphService {

    private static final Logger log = LoggerFactory.getLogger(SemanticGraphService.class);

    public static final String DEFAULT_ROOT_PREFIX = "expr";

    @Inject
    GraphConfigService configService;

    @Inject
    GraphJsonWriter jsonWriter;

    // ==================== EXPRESSIONS ====================

    /**
     * Builds one expression with the configured default limits.
     */
    public GraphBuildResult buildExpression(SourceNode node, String rootId) {
        return buildExpression(node, rootId, defaultLimits());
    }

    /**
     * Builds one expression.
     *
     * @param node Expression source tree
     * @param rootId Id of the root graph node, e.g. {@code expr/0}
     * @param limits Limits for this call only
     * @return success with root id and nodes, or failure with kind and message
     */
    public GraphBuildResult buildExpression(SourceNode node, String rootId, BuildLimits limits) {
        if (node == null) {
            return GraphBuildResult.failure("Source node cannot be null");
        }
        if (rootId == null || rootId.trim().isEmpty()) {
            return GraphBuildResult.failure("Root id cannot be null or empty");
        }

        log.debug("Building expression {} rooted at {} with {}", node.getTag(), rootId, limits);
        BuildContext context = new BuildContext(limits);
        SemanticGraphBuilder builder = new SemanticGraphBuilder(context, ScopeFrame.root(ScopeKind.BLOCK, null, rootId));
        try {
            builder.build(node, rootId, 1);
            return succeeded(rootId, context);
        } catch (GraphBuildException e) {
            return failed(node, rootId, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while building graph for {}", rootId, e);
            return GraphBuildResult.failure("Graph build failed: " + e.getMessage());
        }
    }

    /**
     * Builds each expression as its own construct with ids {@code prefix/0}, {@code prefix/1}, ...
     * A failing expression does not affect the others.
     */
    public List<GraphBuildResult> buildExpressions(List<SourceNode> nodes, String prefix, BuildLimits limits) {
        String rootPrefix = prefix != null && !prefix.trim().isEmpty() ? prefix : DEFAULT_ROOT_PREFIX;
        List<GraphBuildResult> results = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            results.add(buildExpression(nodes.get(i), NodeAddress.root(rootPrefix, i), limits));
        }
        long failures = results.stream().filter(GraphBuildResult::isFailure).count();
        log.info("Built {} expressions under {} ({} failed)", nodes.size(), rootPrefix, failures);
        return results;
    }

    // ==================== PATTERNS ====================

    /**
     * Decomposes a pattern on its own, returning its nodes and bindings.
     */
    public GraphBuildResult buildPattern(SourceNode pattern, String rootId, BuildLimits limits) {
        if (pattern == null) {
            return GraphBuildResult.failure("Pattern cannot be null");
        }
        log.debug("Decomposing pattern {} rooted at {}", pattern.getTag(), rootId);
        BuildContext context = new BuildContext(limits);
        SemanticGraphBuilder builder = new SemanticGraphBuilder(context, ScopeFrame.root(ScopeKind.BLOCK, null, rootId));
        try {
            PatternResult result = builder.getPatternDecomposer().decompose(pattern, rootId, 1);
            log.debug("Pattern {} binds {}", rootId, result.getBindingNames());
            return GraphBuildResult.success(rootId, context, new ArrayList<>(result.getBindingNames()));
        } catch (GraphBuildException e) {
            return failed(pattern, rootId, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while decomposing pattern {}", rootId, e);
            return GraphBuildResult.failure("Pattern decomposition failed: " + e.getMessage());
        }
    }

    // ==================== MODULES ====================

    /**
     * Builds a module definition. Each top-level construct of the module succeeds or fails on
     * its own; failures are listed in {@link GraphBuildResult#getConstructFailures()}.
     */
    public GraphBuildResult buildModule(SourceNode module, String rootId, BuildLimits limits) {
        if (module == null || NodeShape.classify(module) != NodeShape.MODULE_DEFINITION) {
            String tag = module != null ? module.getTag() : "null";
            log.warn("Module build requested for non-module node {}", tag);
            return GraphBuildResult.failure(BuildErrorKind.UNRECOGNIZED_NODE_SHAPE,
                    "Expected a module definition, found " + tag);
        }
        GraphBuildResult result = buildExpression(module, rootId, limits);
        for (ConstructFailure failure : result.getConstructFailures()) {
            log.warn("Dropped construct {} in module {}: [{}] {}",
                    failure.getConstruct(), module.getValueAsString(), failure.getCode(), failure.getMessage());
        }
        return result;
    }

    // ==================== OUTPUT ====================

    /**
     * Adds the formatted source tree to a result, for debugging.
     */
    public GraphBuildResult withSourceTree(GraphBuildResult result, SourceNode node) {
        return result.withSourceTree(SourceTreeFormatter.format(node));
    }

    /**
     * Serializes a result in bulk-load form. Failures become a small error document.
     */
    public String exportJson(GraphBuildResult result) {
        if (result.isFailure()) {
            return jsonWriter.toFailureJson(result.getErrorCode(), result.getErrorMessage());
        }
        return jsonWriter.toJson(result.getRootNodeId(), result.getNodes());
    }

    private BuildLimits defaultLimits() {
        return configService != null ? configService.currentLimits() : BuildLimits.defaults();
    }

    private GraphBuildResult succeeded(String rootId, BuildContext context) {
        log.info("Built graph {} with {} nodes", rootId, context.nodeCount());
        if (!context.getDiagnostics().isEmpty()) {
            log.debug("Graph {} has {} diagnostics: {}", rootId, context.getDiagnostics().size(), context.getDiagnostics());
        }
        return GraphBuildResult.success(rootId, context);
    }

    private GraphBuildResult failed(SourceNode node, String rootId, GraphBuildException e) {
        e.inConstruct(SemanticGraphBuilder.describeConstruct(node));
        log.warn("Graph build for {} failed: {}", rootId, e.getDetailedMessage());
        return GraphBuildResult.failure(e);
    }
}
