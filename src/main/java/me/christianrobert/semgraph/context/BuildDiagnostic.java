package me.christianrobert.semgraph.context;

/**
 * Soft problem recorded during a build; the build continued past it.
 */
public class BuildDiagnostic {

    private final BuildErrorKind kind;
    private final String nodeId;
    private final String message;

    public BuildDiagnostic(BuildErrorKind kind, String nodeId, String message) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.message = message;
    }

    public BuildErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return kind.getCode();
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "BuildDiagnostic{" + kind.getCode() + " at " + nodeId + ": " + message + "}";
    }
}
