package me.christianrobert.semgraph.builder.closure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Outcome of analyzing one closure: what it binds, what it references, and what it captures.
 */
public class ClosureAnalysis {

    private final Set<String> boundSymbols;
    private final Set<String> referencedSymbols;
    private final List<FreeVariableRecord> freeVariables;
    private final List<ScopeFrame> scopeChain;

    public ClosureAnalysis(Set<String> boundSymbols, Set<String> referencedSymbols,
                           List<FreeVariableRecord> freeVariables, List<ScopeFrame> scopeChain) {
        this.boundSymbols = Collections.unmodifiableSet(boundSymbols);
        this.referencedSymbols = Collections.unmodifiableSet(referencedSymbols);
        this.freeVariables = Collections.unmodifiableList(new ArrayList<>(freeVariables));
        this.scopeChain = Collections.unmodifiableList(new ArrayList<>(scopeChain));
    }

    public Set<String> getBoundSymbols() {
        return boundSymbols;
    }

    public Set<String> getReferencedSymbols() {
        return referencedSymbols;
    }

    /**
     * Captured variables sorted by name.
     */
    public List<FreeVariableRecord> getFreeVariables() {
        return freeVariables;
    }

    /**
     * Enclosing frames, innermost first.
     */
    public List<ScopeFrame> getScopeChain() {
        return scopeChain;
    }

    public boolean hasCaptures() {
        return !freeVariables.isEmpty();
    }

    public int getCaptureCount() {
        return freeVariables.size();
    }

    public FreeVariableRecord getFreeVariable(String name) {
        for (FreeVariableRecord record : freeVariables) {
            if (record.getName().equals(name)) {
                return record;
            }
        }
        return null;
    }

    public int getTotalCaptureReferences() {
        int total = 0;
        for (FreeVariableRecord record : freeVariables) {
            total += record.getReferenceCount();
        }
        return total;
    }

    public boolean crossesFunctionBoundary() {
        for (FreeVariableRecord record : freeVariables) {
            if (record.crossesFunctionBoundary()) {
                return true;
            }
        }
        return false;
    }

    public boolean capturesModuleScope() {
        for (FreeVariableRecord record : freeVariables) {
            if (record.isResolved() && record.getSourceFrame().getKind() == ScopeKind.MODULE) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ClosureAnalysis{bound=" + boundSymbols + ", free=" + freeVariables + "}";
    }
}
