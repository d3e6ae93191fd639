package me.christianrobert.semgraph.context;

/**
 * Failure kinds reported by the graph builders.
 *
 * <p>Only {@link #UNRECOGNIZED_NODE_SHAPE} is soft: it becomes a placeholder node and a
 * diagnostic. All other kinds abort the smallest enclosing construct.</p>
 */
public enum BuildErrorKind {

    UNRECOGNIZED_NODE_SHAPE("unrecognized-node-shape", false),
    MALFORMED_PATTERN("malformed-pattern", true),
    INCONSISTENT_CLAUSE_ARITY("inconsistent-clause-arity", true),
    DEPTH_EXCEEDED("depth-exceeded", true),
    SIZE_EXCEEDED("size-exceeded", true),
    INVALID_CAPTURE_INDEX("invalid-capture-index", true);

    private final String code;
    private final boolean hard;

    BuildErrorKind(String code, boolean hard) {
        this.code = code;
        this.hard = hard;
    }

    public String getCode() {
        return code;
    }

    public boolean isHard() {
        return hard;
    }

    @Override
    public String toString() {
        return code;
    }
}
