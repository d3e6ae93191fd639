package me.christianrobert.semgraph.builder.closure;

/**
 * Kind of lexical region a {@link ScopeFrame} stands for.
 */
public enum ScopeKind {
    MODULE("module"),
    FUNCTION("function"),
    CLOSURE("closure"),
    BLOCK("block");

    private final String label;

    ScopeKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether a capture that walks past a frame of this kind leaves a function body.
     */
    public boolean isFunctionBoundary() {
        return this == FUNCTION || this == CLOSURE;
    }

    @Override
    public String toString() {
        return label;
    }
}
