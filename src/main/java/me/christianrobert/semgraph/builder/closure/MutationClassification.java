package me.christianrobert.semgraph.builder.closure;

/**
 * How a closure body re-uses the name of a variable it captured.
 */
public enum MutationClassification {

    /** The name is rebound without reading the captured value. */
    SHADOW("shadow"),

    /** The name is rebound from an expression that reads the captured value ({@code x = x + 1}). */
    REBIND("rebind"),

    /** The name is only read. */
    IMMUTABLE("immutable");

    private final String label;

    MutationClassification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
