package me.christianrobert.semgraph.graph;

/**
 * Deterministic node identifiers derived from a parent id and a relation label.
 *
 * <p>Ids are a pure function of the path from the build root:</p>
 * <pre>
 * root("expr", 3)                    → expr/3
 * of("expr/3", "left")               → expr/3/left
 * of("pattern/1", "elements", 2)     → pattern/1/elements/2
 * </pre>
 *
 * <p>Labels may not contain the separator, so two different (parent, label, index)
 * triples below one root can never produce the same id.</p>
 */
public final class NodeAddress {

    public static final String SEPARATOR = "/";

    private NodeAddress() {
    }

    /**
     * Id of a single child reached through {@code relation}.
     */
    public static String of(String parentId, String relation) {
        requireParent(parentId);
        requireLabel(relation);
        return parentId + SEPARATOR + relation;
    }

    /**
     * Id of the {@code index}-th child reached through {@code relation}.
     */
    public static String of(String parentId, String relation, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be >= 0, was " + index);
        }
        return of(parentId, relation) + SEPARATOR + index;
    }

    /**
     * Id of a top-level build root, e.g. {@code expr/0}.
     */
    public static String root(String prefix, int counter) {
        requireLabel(prefix);
        if (counter < 0) {
            throw new IllegalArgumentException("Counter must be >= 0, was " + counter);
        }
        return prefix + SEPARATOR + counter;
    }

    private static void requireParent(String parentId) {
        if (parentId == null || parentId.isEmpty()) {
            throw new IllegalArgumentException("Parent id cannot be null or empty");
        }
    }

    private static void requireLabel(String label) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException("Relation label cannot be null or empty");
        }
        if (label.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Relation label cannot contain '" + SEPARATOR + "': " + label);
        }
    }
}
