package me.christianrobert.semgraph.context;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one build call.
 *
 * <p><strong>Layers:</strong></p>
 * <ul>
 *   <li>Immutable: the {@link BuildLimits} passed in at the root</li>
 *   <li>Accumulating: the node map, soft diagnostics and dropped-construct failures</li>
 * </ul>
 *
 * <p>Recursion depth is NOT stored here; every builder method receives it as an argument.
 * A context is never shared between concurrent builds. Constructs that must succeed or
 * fail as a unit are built in a {@link #fork()} and {@link #merge(BuildContext) merged}
 * back only on success.</p>
 */
public class BuildContext {

    private final BuildLimits limits;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<BuildDiagnostic> diagnostics = new ArrayList<>();
    private final List<ConstructFailure> failures = new ArrayList<>();

    public BuildContext(BuildLimits limits) {
        if (limits == null) {
            throw new IllegalArgumentException("Build limits cannot be null");
        }
        this.limits = limits;
    }

    public BuildLimits getLimits() {
        return limits;
    }

    // ========== Node registry ==========

    /**
     * Creates and registers a node.
     *
     * @throws IllegalStateException if the id is already taken in this build
     */
    public GraphNode newNode(String id, NodeType primaryType) {
        GraphNode node = new GraphNode(id, primaryType);
        if (nodes.putIfAbsent(id, node) != null) {
            throw new IllegalStateException("Duplicate graph node id in one build: " + id);
        }
        return node;
    }

    /**
     * Creates a node and copies the source position onto it.
     */
    public GraphNode newNode(String id, NodeType primaryType, SourceNode source) {
        GraphNode node = newNode(id, primaryType);
        if (source != null) {
            node.setPosition(source.getPosition());
        }
        return node;
    }

    public GraphNode getNode(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    public int nodeCount() {
        return nodes.size();
    }

    // ========== Guards ==========

    /**
     * Fails with {@code depth-exceeded} when {@code depth} is above the configured ceiling.
     */
    public void checkDepth(int depth, SourceNode source, String nodeId) {
        if (depth > limits.getMaxDepth()) {
            throw new GraphBuildException(BuildErrorKind.DEPTH_EXCEEDED,
                    "Nesting depth " + depth + " exceeds maximum of " + limits.getMaxDepth(),
                    source != null ? source.getTag() : null, nodeId);
        }
    }

    /**
     * Fails with {@code size-exceeded} when a single node fans out to more children than allowed.
     */
    public void checkFanOut(int count, SourceNode source, String nodeId) {
        if (count > limits.getMaxFanOut()) {
            throw new GraphBuildException(BuildErrorKind.SIZE_EXCEEDED,
                    count + " children exceed maximum fan-out of " + limits.getMaxFanOut(),
                    source != null ? source.getTag() : null, nodeId);
        }
    }

    // ========== Diagnostics and construct isolation ==========

    public void addDiagnostic(BuildErrorKind kind, String nodeId, String message) {
        diagnostics.add(new BuildDiagnostic(kind, nodeId, message));
    }

    public List<BuildDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void addFailure(ConstructFailure failure) {
        failures.add(failure);
    }

    public List<ConstructFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * Empty context with the same limits, for building a construct in isolation.
     */
    public BuildContext fork() {
        return new BuildContext(limits);
    }

    /**
     * Adopts everything a successfully built fork produced.
     *
     * @throws IllegalStateException if the fork produced an id this context already has
     */
    public void merge(BuildContext child) {
        for (GraphNode node : child.nodes.values()) {
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalStateException("Duplicate graph node id on merge: " + node.getId());
            }
        }
        diagnostics.addAll(child.diagnostics);
        failures.addAll(child.failures);
    }
}
