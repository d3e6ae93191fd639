package me.christianrobert.semgraph.builder.closure;

import me.christianrobert.semgraph.builder.pattern.BindingCollector;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;
import me.christianrobert.semgraph.source.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects variable reads inside a closure with their positions.
 *
 * <p>Not collected: call targets, aliases and struct names, module attributes, reserved
 * compile-time names, the wildcard, and names bound inside a nested region (clauses of a
 * nested {@code fn} or {@code case}, comprehension generators) within that region.
 * Pinned variables are reads.</p>
 *
 * <p>Matches at the top level of a clause body do not hide later reads. The collector
 * instead remembers which names were read before the body first bound them, so the
 * analyzer can tell a body-local variable from a captured one that is later rebound.</p>
 */
public class ReferenceCollector {

    public static final Set<String> RESERVED_NAMES = Set.of(
            "__MODULE__", "__ENV__", "__CALLER__", "__DIR__", "__STACKTRACE__");

    private final Map<String, Integer> counts = new LinkedHashMap<>();
    private final Map<String, List<SourcePosition>> positions = new LinkedHashMap<>();
    private final Set<String> readBeforeBinding = new HashSet<>();
    private Set<String> clauseBound = new HashSet<>();

    /**
     * Collects pins of the clause parameters, then the guard and the body.
     */
    public void collectClause(ClauseParts clause) {
        clauseBound = new HashSet<>();
        Set<String> region = new HashSet<>();
        for (SourceNode parameter : clause.getParameters()) {
            collectPins(parameter, region);
        }
        if (clause.hasGuard()) {
            walk(clause.getGuard(), region, true);
        }
        walk(clause.getBody(), region, true);
    }

    /**
     * Collects a free-standing expression.
     */
    public void collect(SourceNode expression) {
        walk(expression, new HashSet<>(), true);
    }

    public Set<String> getReferencedSymbols() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public boolean references(String name) {
        return counts.containsKey(name);
    }

    public int getCount(String name) {
        Integer count = counts.get(name);
        return count != null ? count : 0;
    }

    public List<SourcePosition> getPositions(String name) {
        List<SourcePosition> found = positions.get(name);
        return found != null ? Collections.unmodifiableList(found) : Collections.emptyList();
    }

    /**
     * Whether the name was read at a point where no top-level match of the clause body had bound it yet.
     */
    public boolean isReadBeforeBinding(String name) {
        return readBeforeBinding.contains(name);
    }

    private void read(SourceNode variable, Set<String> local) {
        String name = variable.getTag();
        if ("_".equals(name) || RESERVED_NAMES.contains(name) || local.contains(name)) {
            return;
        }
        counts.merge(name, 1, Integer::sum);
        List<SourcePosition> found = positions.computeIfAbsent(name, k -> new ArrayList<>());
        if (variable.getPosition() != null) {
            found.add(variable.getPosition());
        }
        if (!clauseBound.contains(name)) {
            readBeforeBinding.add(name);
        }
    }

    private void walk(SourceNode node, Set<String> local, boolean topLevel) {
        switch (NodeShape.classify(node)) {
            case VARIABLE:
                read(node, local);
                break;
            case PIN:
                if (node.child(0).isVariable()) {
                    read(node.child(0), local);
                }
                break;
            case BINARY_OPERATOR:
                if ("=".equals(node.getTag())) {
                    walkMatch(node, local, topLevel);
                } else {
                    walkAll(node.getChildren(), local, topLevel);
                }
                break;
            case MAP:
            case STRUCT:
                for (SourceNode entry : node.getChildren()) {
                    walkAll(entry.getChildren(), local, topLevel);
                }
                break;
            case SIGIL:
                if (!node.child(0).is(SourceNode.Kind.LITERAL, "string")) {
                    walk(node.child(0), local, topLevel);
                }
                break;
            case BINARY:
                for (SourceNode segment : node.getChildren()) {
                    if (segment.isConstruct("segment") && segment.childCount() == 2) {
                        walk(segment.child(0), local, topLevel);
                        walkSpecifier(segment.child(1), local);
                    } else {
                        walk(segment, local, topLevel);
                    }
                }
                break;
            case CASE:
                walk(node.child(0), local, topLevel);
                for (int i = 1; i < node.childCount(); i++) {
                    walkClause(ClauseParts.of(node.child(i), null), local);
                }
                break;
            case COMPREHENSION:
                walkComprehension(node, local);
                break;
            case CLOSURE:
            case FUNCTION_DEFINITION:
                for (SourceNode clause : node.getChildren()) {
                    walkClause(ClauseParts.of(clause, null), local);
                }
                break;
            case MODULE_DEFINITION:
            case MODULE_ATTRIBUTE:
            case ALIAS:
            case WILDCARD:
            case PLACEHOLDER:
                break;
            default:
                // operators, calls (arguments only), collections, blocks, ranges, captures, unknown shapes
                walkAll(node.getChildren(), local, topLevel);
                break;
        }
    }

    private void walkAll(List<SourceNode> nodes, Set<String> local, boolean topLevel) {
        for (SourceNode child : nodes) {
            walk(child, local, topLevel);
        }
    }

    private void walkMatch(SourceNode match, Set<String> local, boolean topLevel) {
        walk(match.child(1), local, topLevel);
        collectPins(match.child(0), local);
        Set<String> names = BindingCollector.collect(match.child(0));
        if (topLevel) {
            clauseBound.addAll(names);
        } else {
            local.addAll(names);
        }
    }

    private void walkClause(ClauseParts clause, Set<String> local) {
        Set<String> region = new HashSet<>(local);
        for (SourceNode parameter : clause.getParameters()) {
            collectPins(parameter, local);
        }
        region.addAll(BindingCollector.collectAll(clause.getParameters()));
        if (clause.hasGuard()) {
            walk(clause.getGuard(), region, false);
        }
        walk(clause.getBody(), region, false);
    }

    private void walkComprehension(SourceNode comprehension, Set<String> local) {
        Set<String> region = new HashSet<>(local);
        int last = comprehension.childCount() - 1;
        for (int i = 0; i < last; i++) {
            SourceNode qualifier = comprehension.child(i);
            if (qualifier.isConstruct("generator") && qualifier.childCount() == 2) {
                walk(qualifier.child(1), region, false);
                collectPins(qualifier.child(0), region);
                region.addAll(BindingCollector.collect(qualifier.child(0)));
            } else {
                walk(qualifier, region, false);
            }
        }
        walk(comprehension.child(last), region, false);
    }

    // Specifier words like binary or size look like variables; only call arguments are reads
    private void walkSpecifier(SourceNode specifier, Set<String> local) {
        if (specifier.getKind() == SourceNode.Kind.CALL) {
            walkAll(specifier.getChildren(), local, false);
        } else if (specifier.getKind() == SourceNode.Kind.OPERATOR) {
            for (SourceNode child : specifier.getChildren()) {
                walkSpecifier(child, local);
            }
        }
    }

    private void collectPins(SourceNode pattern, Set<String> local) {
        if (pattern.isConstruct("pin") && pattern.childCount() == 1 && pattern.child(0).isVariable()) {
            read(pattern.child(0), local);
            return;
        }
        for (SourceNode child : pattern.getChildren()) {
            collectPins(child, local);
        }
    }
}
