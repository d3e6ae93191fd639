package me.christianrobert.semgraph.builder.closure;

import me.christianrobert.semgraph.builder.pattern.BindingCollector;
import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.BuildLimits;
import me.christianrobert.semgraph.context.GraphBuildException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the captured variables of an anonymous function.
 *
 * <p>Algorithm:</p>
 * <ol>
 *   <li>bound = union of the parameter bindings of all clauses</li>
 *   <li>collect every variable read in guards and bodies ({@link ReferenceCollector})</li>
 *   <li>free = reads - bound; a name that the body binds itself only counts when it was read
 *       before that binding or is visible in an enclosing frame</li>
 *   <li>map each free name to the nearest enclosing frame that binds it; names bound outside
 *       the analyzed unit stay unmapped</li>
 *   <li>classify re-use of each free name ({@link MutationClassification})</li>
 * </ol>
 *
 * <p>The analysis works on source nodes only and builds no graph nodes.</p>
 */
public class ClosureAnalyzer {

    /**
     * Analyzes a closure given its clause nodes.
     *
     * @param enclosing Innermost frame around the closure, null when there is none
     * @throws GraphBuildException {@code malformed-pattern} for malformed clauses,
     *         {@code depth-exceeded} when the scope chain is longer than the depth ceiling,
     *         {@code size-exceeded} when more variables are captured than allowed
     */
    public ClosureAnalysis analyze(List<ClauseParts> clauses, ScopeFrame enclosing, BuildLimits limits, String nodeId) {
        Set<String> bound = new LinkedHashSet<>();
        ReferenceCollector references = new ReferenceCollector();
        for (ClauseParts clause : clauses) {
            bound.addAll(BindingCollector.collectAll(clause.getParameters()));
            references.collectClause(clause);
        }

        List<ScopeFrame> chain = enclosing != null ? enclosing.chain() : Collections.emptyList();
        if (chain.size() > limits.getMaxDepth()) {
            throw new GraphBuildException(BuildErrorKind.DEPTH_EXCEEDED,
                    "Scope chain of " + chain.size() + " frames exceeds maximum of " + limits.getMaxDepth(),
                    "fn", nodeId);
        }

        Set<String> free = new TreeSet<>();
        for (String name : references.getReferencedSymbols()) {
            if (bound.contains(name)) {
                continue;
            }
            if (references.isReadBeforeBinding(name) || (enclosing != null && enclosing.isVisible(name))) {
                free.add(name);
            }
        }
        if (free.size() > limits.getMaxCaptures()) {
            throw new GraphBuildException(BuildErrorKind.SIZE_EXCEEDED,
                    free.size() + " captured variables exceed maximum of " + limits.getMaxCaptures(),
                    "fn", nodeId);
        }

        Map<String, MutationClassification> mutations = RebindingScanner.classify(clauses, free);
        List<FreeVariableRecord> records = new ArrayList<>();
        for (String name : free) {
            records.add(resolve(name, chain, references, mutations.get(name)));
        }
        return new ClosureAnalysis(bound, new LinkedHashSet<>(references.getReferencedSymbols()), records, chain);
    }

    private static FreeVariableRecord resolve(String name, List<ScopeFrame> chain,
                                              ReferenceCollector references, MutationClassification mutation) {
        boolean crossed = false;
        for (int i = 0; i < chain.size(); i++) {
            ScopeFrame frame = chain.get(i);
            if (frame.binds(name)) {
                return new FreeVariableRecord(name, references.getCount(name), references.getPositions(name),
                        mutation, frame, i + 1, crossed);
            }
            if (frame.getKind().isFunctionBoundary()) {
                crossed = true;
            }
        }
        return new FreeVariableRecord(name, references.getCount(name), references.getPositions(name),
                mutation, null, FreeVariableRecord.UNRESOLVED_DEPTH, false);
    }
}
