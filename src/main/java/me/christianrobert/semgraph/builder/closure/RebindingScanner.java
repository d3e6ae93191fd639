package me.christianrobert.semgraph.builder.closure;

import me.christianrobert.semgraph.builder.pattern.BindingCollector;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies how a closure body re-uses each captured name.
 *
 * <p>Every match whose left side binds a captured name counts: a right side that reads the
 * name makes it {@link MutationClassification#REBIND}, otherwise
 * {@link MutationClassification#SHADOW}. REBIND wins over SHADOW. Nested {@code fn}
 * bodies are not scanned. Inside a {@code case} clause or a comprehension, a name bound by
 * the clause parameters, a generator pattern or an earlier match of that region is a new
 * local, and later matches of it are not mutations of the captured variable.</p>
 */
final class RebindingScanner {

    private RebindingScanner() {
    }

    static Map<String, MutationClassification> classify(List<ClauseParts> clauses, Set<String> captured) {
        Map<String, MutationClassification> result = new LinkedHashMap<>();
        for (String name : captured) {
            result.put(name, MutationClassification.IMMUTABLE);
        }
        for (ClauseParts clause : clauses) {
            if (clause.hasGuard()) {
                scan(clause.getGuard(), new HashSet<>(), true, result);
            }
            scan(clause.getBody(), new HashSet<>(), true, result);
        }
        return result;
    }

    private static void scan(SourceNode node, Set<String> local, boolean topLevel,
                             Map<String, MutationClassification> result) {
        switch (NodeShape.classify(node)) {
            case CLOSURE:
                return;
            case BINARY_OPERATOR:
                if ("=".equals(node.getTag())) {
                    scanMatch(node, local, topLevel, result);
                    return;
                }
                break;
            case CASE:
                scan(node.child(0), local, topLevel, result);
                for (int i = 1; i < node.childCount(); i++) {
                    scanClause(ClauseParts.of(node.child(i), null), local, result);
                }
                return;
            case COMPREHENSION:
                scanComprehension(node, local, result);
                return;
            default:
                break;
        }
        for (SourceNode child : node.getChildren()) {
            scan(child, local, topLevel, result);
        }
    }

    private static void scanMatch(SourceNode match, Set<String> local, boolean topLevel,
                                  Map<String, MutationClassification> result) {
        Set<String> rebound = BindingCollector.collect(match.child(0));
        ReferenceCollector rightSide = null;
        for (String name : rebound) {
            if (!result.containsKey(name) || local.contains(name)) {
                continue;
            }
            if (rightSide == null) {
                rightSide = new ReferenceCollector();
                rightSide.collect(match.child(1));
            }
            if (rightSide.references(name)) {
                result.put(name, MutationClassification.REBIND);
            } else if (result.get(name) != MutationClassification.REBIND) {
                result.put(name, MutationClassification.SHADOW);
            }
        }
        scan(match.child(1), local, topLevel, result);
        if (!topLevel) {
            local.addAll(rebound);
        }
    }

    // Names bound by clause parameters are new locals for the whole clause
    private static void scanClause(ClauseParts clause, Set<String> local, Map<String, MutationClassification> result) {
        Set<String> region = new HashSet<>(local);
        region.addAll(BindingCollector.collectAll(clause.getParameters()));
        if (clause.hasGuard()) {
            scan(clause.getGuard(), region, false, result);
        }
        scan(clause.getBody(), region, false, result);
    }

    private static void scanComprehension(SourceNode comprehension, Set<String> local,
                                          Map<String, MutationClassification> result) {
        Set<String> region = new HashSet<>(local);
        int last = comprehension.childCount() - 1;
        for (int i = 0; i < last; i++) {
            SourceNode qualifier = comprehension.child(i);
            if (qualifier.isConstruct("generator") && qualifier.childCount() == 2) {
                scan(qualifier.child(1), region, false, result);
                region.addAll(BindingCollector.collect(qualifier.child(0)));
            } else {
                scan(qualifier, region, false, result);
            }
        }
        scan(comprehension.child(last), region, false, result);
    }
}
