package me.christianrobert.semgraph.context;

/**
 * Immutable ceilings applied to one build call.
 *
 * <ul>
 *   <li>{@code maxDepth} - recursion depth of the builders and length of a closure's scope walk</li>
 *   <li>{@code maxCaptures} - captured variables per closure and distinct placeholders per capture</li>
 *   <li>{@code maxFanOut} - elements/entries/segments of a single collection or compound pattern</li>
 * </ul>
 *
 * <p>A limits value is passed in at the root of every build and never changes during it;
 * the {@code with*} methods return modified copies.</p>
 */
public final class BuildLimits {

    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_CAPTURES = 255;
    public static final int DEFAULT_MAX_FAN_OUT = 10_000;

    private static final BuildLimits DEFAULTS =
            new BuildLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_CAPTURES, DEFAULT_MAX_FAN_OUT);

    private final int maxDepth;
    private final int maxCaptures;
    private final int maxFanOut;

    public BuildLimits(int maxDepth, int maxCaptures, int maxFanOut) {
        requirePositive("maxDepth", maxDepth);
        requirePositive("maxCaptures", maxCaptures);
        requirePositive("maxFanOut", maxFanOut);
        this.maxDepth = maxDepth;
        this.maxCaptures = maxCaptures;
        this.maxFanOut = maxFanOut;
    }

    public static BuildLimits defaults() {
        return DEFAULTS;
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, was " + value);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxCaptures() {
        return maxCaptures;
    }

    public int getMaxFanOut() {
        return maxFanOut;
    }

    public BuildLimits withMaxDepth(int newMaxDepth) {
        return new BuildLimits(newMaxDepth, maxCaptures, maxFanOut);
    }

    public BuildLimits withMaxCaptures(int newMaxCaptures) {
        return new BuildLimits(maxDepth, newMaxCaptures, maxFanOut);
    }

    public BuildLimits withMaxFanOut(int newMaxFanOut) {
        return new BuildLimits(maxDepth, maxCaptures, newMaxFanOut);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BuildLimits that = (BuildLimits) o;
        return maxDepth == that.maxDepth && maxCaptures == that.maxCaptures && maxFanOut == that.maxFanOut;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * maxDepth + maxCaptures) + maxFanOut;
    }

    @Override
    public String toString() {
        return "BuildLimits{maxDepth=" + maxDepth + ", maxCaptures=" + maxCaptures + ", maxFanOut=" + maxFanOut + "}";
    }
}
