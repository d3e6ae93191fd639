package me.christianrobert.semgraph.context;

import me.christianrobert.semgraph.graph.GraphNode;

import java.util.Collections;
import java.util.List;

/**
 * Result of one build request.
 * Contains either the root id and the flat node list of the built construct, or the
 * failure kind and message. Optionally includes the formatted source tree for debugging.
 */
public class GraphBuildResult {

    private final boolean success;
    private final String rootNodeId;
    private final List<GraphNode> nodes;
    private final List<String> bindings;
    private final List<BuildDiagnostic> diagnostics;
    private final List<ConstructFailure> constructFailures;
    private final String errorCode;
    private final String errorMessage;
    private final String construct;
    private final String sourceTree;  // Optional source tree representation (null by default)

    private GraphBuildResult(boolean success, String rootNodeId, List<GraphNode> nodes, List<String> bindings,
                             List<BuildDiagnostic> diagnostics, List<ConstructFailure> constructFailures,
                             String errorCode, String errorMessage, String construct, String sourceTree) {
        this.success = success;
        this.rootNodeId = rootNodeId;
        this.nodes = nodes != null ? Collections.unmodifiableList(nodes) : Collections.emptyList();
        this.bindings = bindings != null ? Collections.unmodifiableList(bindings) : Collections.emptyList();
        this.diagnostics = diagnostics != null ? Collections.unmodifiableList(diagnostics) : Collections.emptyList();
        this.constructFailures = constructFailures != null
                ? Collections.unmodifiableList(constructFailures) : Collections.emptyList();
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.construct = construct;
        this.sourceTree = sourceTree;
    }

    /**
     * Creates a successful result from everything a build context accumulated.
     */
    public static GraphBuildResult success(String rootNodeId, BuildContext context) {
        return new GraphBuildResult(true, rootNodeId, context.getNodes(), null,
                context.getDiagnostics(), context.getFailures(), null, null, null, null);
    }

    /**
     * Creates a successful pattern result carrying the binding names in introduction order.
     */
    public static GraphBuildResult success(String rootNodeId, BuildContext context, List<String> bindings) {
        return new GraphBuildResult(true, rootNodeId, context.getNodes(), bindings,
                context.getDiagnostics(), context.getFailures(), null, null, null, null);
    }

    /**
     * Creates a failed result from a hard build failure. No nodes are returned.
     */
    public static GraphBuildResult failure(GraphBuildException exception) {
        return new GraphBuildResult(false, null, null, null, null, null,
                exception.getKind().getCode(), exception.getDetailedMessage(), exception.getConstruct(), null);
    }

    /**
     * Creates a failed result with a specific kind and message.
     */
    public static GraphBuildResult failure(BuildErrorKind kind, String errorMessage) {
        return new GraphBuildResult(false, null, null, null, null, null,
                kind.getCode(), errorMessage, null, null);
    }

    /**
     * Creates a failed result for an unexpected error outside the build error taxonomy.
     */
    public static GraphBuildResult failure(String errorMessage) {
        return new GraphBuildResult(false, null, null, null, null, null,
                null, errorMessage, null, null);
    }

    /**
     * Returns a copy of this result carrying the formatted source tree.
     */
    public GraphBuildResult withSourceTree(String tree) {
        return new GraphBuildResult(success, rootNodeId, nodes, bindings, diagnostics, constructFailures,
                errorCode, errorMessage, construct, tree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getRootNodeId() {
        return rootNodeId;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    /**
     * Looks up a node of this result by id, null when absent.
     */
    public GraphNode findNode(String id) {
        for (GraphNode node : nodes) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public List<String> getBindings() {
        return bindings;
    }

    public List<BuildDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<ConstructFailure> getConstructFailures() {
        return constructFailures;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getConstruct() {
        return construct;
    }

    public String getSourceTree() {
        return sourceTree;
    }

    public boolean hasSourceTree() {
        return sourceTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "GraphBuildResult{success=true, rootNodeId='" + rootNodeId + "', nodes=" + nodes.size() +
                   (constructFailures.isEmpty() ? "" : ", constructFailures=" + constructFailures.size()) + "}";
        } else {
            return "GraphBuildResult{success=false, errorCode=" + errorCode + ", error='" + errorMessage + "'}";
        }
    }
}
