package me.christianrobert.semgraph.builder.closure;

import me.christianrobert.semgraph.source.SourcePosition;

import java.util.Collections;
import java.util.List;

/**
 * A variable referenced inside a closure but not bound by the closure's own parameters.
 *
 * <p>{@link #getSourceFrame()} is the nearest enclosing frame binding the name, or null when
 * the binding lies outside what the analysis can see. Unresolved records keep a capture
 * depth of {@code -1}.</p>
 */
public class FreeVariableRecord {

    public static final int UNRESOLVED_DEPTH = -1;

    private final String name;
    private final int referenceCount;
    private final List<SourcePosition> positions;
    private final MutationClassification mutation;
    private final ScopeFrame sourceFrame;
    private final int captureDepth;
    private final boolean crossesFunctionBoundary;

    public FreeVariableRecord(String name, int referenceCount, List<SourcePosition> positions,
                              MutationClassification mutation, ScopeFrame sourceFrame,
                              int captureDepth, boolean crossesFunctionBoundary) {
        this.name = name;
        this.referenceCount = referenceCount;
        this.positions = positions != null ? Collections.unmodifiableList(positions) : Collections.emptyList();
        this.mutation = mutation;
        this.sourceFrame = sourceFrame;
        this.captureDepth = sourceFrame != null ? captureDepth : UNRESOLVED_DEPTH;
        this.crossesFunctionBoundary = crossesFunctionBoundary;
    }

    public String getName() {
        return name;
    }

    public int getReferenceCount() {
        return referenceCount;
    }

    /**
     * Positions of the references that carried one, in traversal order.
     */
    public List<SourcePosition> getPositions() {
        return positions;
    }

    public MutationClassification getMutation() {
        return mutation;
    }

    public ScopeFrame getSourceFrame() {
        return sourceFrame;
    }

    public boolean isResolved() {
        return sourceFrame != null;
    }

    public int getCaptureDepth() {
        return captureDepth;
    }

    public boolean crossesFunctionBoundary() {
        return crossesFunctionBoundary;
    }

    @Override
    public String toString() {
        return "FreeVariableRecord{" + name + ", refs=" + referenceCount + ", " + mutation +
               (isResolved() ? ", from=" + sourceFrame.getKind() + "@" + captureDepth : ", unresolved") + "}";
    }
}
