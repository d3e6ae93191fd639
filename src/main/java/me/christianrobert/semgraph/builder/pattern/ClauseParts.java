package me.christianrobert.semgraph.builder.pattern;

import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * Split view of a {@code clause} construct: parameter patterns, optional guard, body.
 *
 * <p>Source shape: {@code clause[params[p1, ..., pn], guard?, body]}. The body is always
 * the last child; a guard is present when the clause has three children.</p>
 */
public class ClauseParts {

    private final List<SourceNode> parameters;
    private final SourceNode guard;
    private final SourceNode body;

    private ClauseParts(List<SourceNode> parameters, SourceNode guard, SourceNode body) {
        this.parameters = parameters;
        this.guard = guard;
        this.body = body;
    }

    /**
     * @throws GraphBuildException {@code malformed-pattern} if the node is not a well-formed clause
     */
    public static ClauseParts of(SourceNode clause, String nodeId) {
        if (clause == null || !clause.isConstruct("clause")) {
            throw new GraphBuildException(BuildErrorKind.MALFORMED_PATTERN,
                    "Expected a clause but found " + (clause == null ? "nothing" : clause.getTag()),
                    clause != null ? clause.getTag() : null, nodeId);
        }
        int size = clause.childCount();
        if ((size != 2 && size != 3) || !clause.child(0).isConstruct("params")) {
            throw new GraphBuildException(BuildErrorKind.MALFORMED_PATTERN,
                    "Clause must be params, optional guard and body (found " + size + " children)",
                    clause.getTag(), nodeId);
        }
        SourceNode guard = size == 3 ? clause.child(1) : null;
        return new ClauseParts(clause.child(0).getChildren(), guard, clause.child(size - 1));
    }

    /**
     * Verifies that every clause of one construct has the same parameter count.
     *
     * @return the common arity
     * @throws GraphBuildException {@code inconsistent-clause-arity} on mismatch
     */
    public static int checkArity(List<ClauseParts> clauses, String constructName, String nodeId) {
        int arity = clauses.isEmpty() ? 0 : clauses.get(0).getArity();
        for (int i = 1; i < clauses.size(); i++) {
            int clauseArity = clauses.get(i).getArity();
            if (clauseArity != arity) {
                throw new GraphBuildException(BuildErrorKind.INCONSISTENT_CLAUSE_ARITY,
                        "Clause " + i + " of " + constructName + " takes " + clauseArity +
                        " parameters, expected " + arity, null, nodeId);
            }
        }
        return arity;
    }

    public List<SourceNode> getParameters() {
        return parameters;
    }

    public SourceNode getGuard() {
        return guard;
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public SourceNode getBody() {
        return body;
    }

    public int getArity() {
        return parameters.size();
    }
}
