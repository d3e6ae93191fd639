package me.christianrobert.semgraph.builder.pattern;

import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names a pattern would bind, computed without building any graph nodes.
 *
 * <p>Mirrors {@link PatternDecomposer}: variables bind (except {@code _}), pins and literals
 * do not, map keys and segment specifiers never bind.</p>
 */
public final class BindingCollector {

    private BindingCollector() {
    }

    public static Set<String> collect(SourceNode pattern) {
        Set<String> names = new LinkedHashSet<>();
        collect(pattern, names);
        return names;
    }

    public static Set<String> collectAll(List<SourceNode> patterns) {
        Set<String> names = new LinkedHashSet<>();
        for (SourceNode pattern : patterns) {
            collect(pattern, names);
        }
        return names;
    }

    private static void collect(SourceNode node, Set<String> names) {
        switch (NodeShape.classify(node)) {
            case VARIABLE:
                names.add(node.getTag());
                break;
            case LIST:
            case TUPLE:
            case CONS:
                for (SourceNode child : node.getChildren()) {
                    collect(child, names);
                }
                break;
            case MAP:
            case STRUCT:
                for (SourceNode entry : node.getChildren()) {
                    if (entry.isConstruct("entry") && entry.childCount() == 2) {
                        collect(entry.child(1), names);
                    } else if (entry.isConstruct("kw_entry") && entry.childCount() == 1) {
                        collect(entry.child(0), names);
                    }
                }
                break;
            case BINARY:
                for (SourceNode segment : node.getChildren()) {
                    collect(segment.isConstruct("segment") && segment.childCount() == 2 ? segment.child(0) : segment, names);
                }
                break;
            case BINARY_OPERATOR:
                if ("=".equals(node.getTag())) {
                    collect(node.child(0), names);
                    collect(node.child(1), names);
                } else if ("<>".equals(node.getTag())) {
                    collect(node.child(1), names);
                }
                break;
            case GUARD:
                collect(node.child(0), names);
                break;
            default:
                // literals, pins, wildcards and non-pattern shapes bind nothing
                break;
        }
    }
}
