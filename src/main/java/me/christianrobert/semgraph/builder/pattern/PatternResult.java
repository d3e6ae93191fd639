package me.christianrobert.semgraph.builder.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Root node id of a decomposed pattern and the bindings it introduced, in source order.
 */
public class PatternResult {

    private final String nodeId;
    private final List<Binding> bindings;

    public PatternResult(String nodeId, List<Binding> bindings) {
        this.nodeId = nodeId;
        this.bindings = Collections.unmodifiableList(new ArrayList<>(bindings));
    }

    public String getNodeId() {
        return nodeId;
    }

    public List<Binding> getBindings() {
        return bindings;
    }

    public Set<String> getBindingNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Binding binding : bindings) {
            names.add(binding.getName());
        }
        return names;
    }

    @Override
    public String toString() {
        return "PatternResult{" + nodeId + ", bindings=" + bindings + "}";
    }
}
