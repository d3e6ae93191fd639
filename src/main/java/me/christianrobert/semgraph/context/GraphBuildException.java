package me.christianrobert.semgraph.context;

/**
 * Hard build failure. Thrown from anywhere inside a construct's recursive build and
 * caught at the construct boundary, where all nodes of that construct are discarded.
 */
public class GraphBuildException extends RuntimeException {

    private final BuildErrorKind kind;
    private final String sourceTag;
    private final String nodeId;
    private String construct;

    public GraphBuildException(BuildErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public GraphBuildException(BuildErrorKind kind, String message, String sourceTag, String nodeId) {
        super(message);
        if (kind == null) {
            throw new IllegalArgumentException("Error kind cannot be null");
        }
        this.kind = kind;
        this.sourceTag = sourceTag;
        this.nodeId = nodeId;
    }

    public BuildErrorKind getKind() {
        return kind;
    }

    public String getSourceTag() {
        return sourceTag;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getConstruct() {
        return construct;
    }

    /**
     * Names the construct that was aborted. Only the innermost construct boundary sets it.
     */
    public GraphBuildException inConstruct(String constructName) {
        if (this.construct == null) {
            this.construct = constructName;
        }
        return this;
    }

    /**
     * Gets a detailed error message including kind, construct and source location.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind.getCode()).append("] ").append(getMessage());
        if (construct != null) {
            sb.append("\nConstruct: ").append(construct);
        }
        if (nodeId != null) {
            sb.append("\nNode: ").append(nodeId);
        }
        if (sourceTag != null) {
            sb.append("\nSource tag: ").append(sourceTag);
        }
        return sb.toString();
    }
}
