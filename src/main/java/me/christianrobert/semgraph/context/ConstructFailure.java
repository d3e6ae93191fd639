package me.christianrobert.semgraph.context;

/**
 * A construct that was dropped from an otherwise successful build because of a hard failure.
 */
public class ConstructFailure {

    private final String construct;
    private final String nodeId;
    private final BuildErrorKind kind;
    private final String message;

    public ConstructFailure(String construct, String nodeId, BuildErrorKind kind, String message) {
        this.construct = construct;
        this.nodeId = nodeId;
        this.kind = kind;
        this.message = message;
    }

    public static ConstructFailure from(String construct, String nodeId, GraphBuildException e) {
        return new ConstructFailure(construct, nodeId, e.getKind(), e.getMessage());
    }

    public String getConstruct() {
        return construct;
    }

    public String getNodeId() {
        return nodeId;
    }

    public BuildErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return kind.getCode();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ConstructFailure{" + construct + " (" + nodeId + "): " + kind.getCode() + " - " + message + "}";
    }
}
