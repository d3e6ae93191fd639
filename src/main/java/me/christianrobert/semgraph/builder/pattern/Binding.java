package me.christianrobert.semgraph.builder.pattern;

import me.christianrobert.semgraph.source.SourcePosition;

import java.util.Objects;

/**
 * A symbol introduced by a pattern, with the pattern node that introduced it.
 */
public class Binding {

    private final String name;
    private final String nodeId;
    private final SourcePosition position;

    public Binding(String name, String nodeId, SourcePosition position) {
        this.name = name;
        this.nodeId = nodeId;
        this.position = position;
    }

    public String getName() {
        return name;
    }

    public String getNodeId() {
        return nodeId;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * Underscore-prefixed names bind but mark the value as intentionally unused.
     */
    public boolean isIgnored() {
        return name.startsWith("_");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Binding binding = (Binding) o;
        return name.equals(binding.name) && Objects.equals(nodeId, binding.nodeId)
                && Objects.equals(position, binding.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nodeId, position);
    }

    @Override
    public String toString() {
        return name + "@" + nodeId;
    }
}
