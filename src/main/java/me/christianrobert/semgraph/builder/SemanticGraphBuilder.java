package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ClosureAnalyzer;
import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.builder.pattern.PatternDecomposer;
import me.christianrobert.semgraph.context.BuildContext;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recursive descent from source nodes to graph nodes.
 *
 * <p>{@link #build(SourceNode, String, int)} classifies the node and hands it to one of the
 * static {@code Visit*} helpers, which create the node under the given id, derive child ids
 * with {@link me.christianrobert.semgraph.graph.NodeAddress} and recurse through this
 * builder with {@code depth + 1}.</p>
 *
 * <p>Besides the {@link BuildContext} the builder carries two stacks: the lexical scope frames
 * (pushed by clauses, comprehensions and modules) and the placeholder lists of the capture
 * expressions currently being built.</p>
 */
public class SemanticGraphBuilder {

    // no logging here, one call per source node would flood the log

    private final BuildContext context;
    private final PatternDecomposer patternDecomposer;
    private final ClosureAnalyzer closureAnalyzer;

    // Innermost frame first
    private final Deque<ScopeFrame> scopeStack = new ArrayDeque<>();

    // Placeholder node ids of the capture expressions being built, innermost first
    private final Deque<List<String>> captureStack = new ArrayDeque<>();

    /**
     * Creates a builder whose outermost scope is the given frame.
     */
    public SemanticGraphBuilder(BuildContext context, ScopeFrame rootScope) {
        if (context == null) {
            throw new IllegalArgumentException("Build context cannot be null");
        }
        this.context = context;
        this.patternDecomposer = new PatternDecomposer(this);
        this.closureAnalyzer = new ClosureAnalyzer();
        if (rootScope != null) {
            scopeStack.push(rootScope);
        }
    }

    public SemanticGraphBuilder(BuildContext context) {
        this(context, null);
    }

    public BuildContext getContext() {
        return context;
    }

    public PatternDecomposer getPatternDecomposer() {
        return patternDecomposer;
    }

    public ClosureAnalyzer getClosureAnalyzer() {
        return closureAnalyzer;
    }

    /**
     * Builds the graph for one expression.
     *
     * @param node Source node
     * @param id Id for the node built from {@code node}
     * @param depth Depth of this call, 1 at the build root
     * @return the id of the created node
     */
    public String build(SourceNode node, String id, int depth) {
        context.checkDepth(depth, node, id);

        NodeShape shape = NodeShape.classify(node);
        switch (shape) {
            case INTEGER:
            case FLOAT:
            case STRING:
            case CHARLIST:
            case BOOLEAN:
            case NIL:
            case ATOM:
                return VisitLiteral.v(node, shape, id, this);
            case LIST:
            case TUPLE:
                return VisitCollection.sequence(node, shape, id, depth, this);
            case MAP:
            case STRUCT:
                return VisitCollection.entries(node, shape, id, depth, this);
            case RANGE:
                return VisitRange.v(node, id, depth, this);
            case SIGIL:
                return VisitSigil.v(node, id, depth, this);
            case BINARY:
                return VisitBitstring.v(node, id, depth, this);
            case UNARY_OPERATOR:
                return VisitOperator.unary(node, id, depth, this);
            case BINARY_OPERATOR:
                return VisitOperator.binary(node, id, depth, this);
            case LOCAL_CALL:
            case REMOTE_CALL:
                return VisitCall.v(node, shape, id, depth, this);
            case VARIABLE:
            case MODULE_ATTRIBUTE:
            case ALIAS:
                return VisitReference.v(node, shape, id, depth, this);
            case BLOCK:
                return VisitBlock.v(node, id, depth, this);
            case CASE:
                return VisitCase.v(node, id, depth, this);
            case COMPREHENSION:
                return VisitComprehension.v(node, id, depth, this);
            case CLOSURE:
                return VisitClosure.v(node, id, depth, this);
            case CAPTURE:
                return VisitCapture.v(node, id, depth, this);
            case PLACEHOLDER:
                if (!captureStack.isEmpty()) {
                    return VisitCapture.placeholder(node, id, this);
                }
                return VisitUnknown.v(node, id, "Capture placeholder outside of a capture expression", this);
            case FUNCTION_DEFINITION:
                return VisitFunctionDefinition.v(node, id, depth, this);
            case MODULE_DEFINITION:
                return VisitModule.v(node, id, depth, this);
            case WILDCARD:
            case PIN:
            case CONS:
            case GUARD:
                return VisitUnknown.v(node, id, "Pattern-only form " + shape + " in expression position", this);
            case UNKNOWN:
            default:
                return VisitUnknown.v(node, id, "Unrecognized node shape", this);
        }
    }

    // ========== Scope stack ==========

    /**
     * Innermost scope frame, null when the builder was created without one and none was pushed.
     */
    public ScopeFrame currentScope() {
        return scopeStack.peek();
    }

    public ScopeFrame pushScope(ScopeKind kind, String name, String ownerNodeId) {
        ScopeFrame current = scopeStack.peek();
        ScopeFrame frame = current != null
                ? current.child(kind, name, ownerNodeId)
                : ScopeFrame.root(kind, name, ownerNodeId);
        scopeStack.push(frame);
        return frame;
    }

    public void popScope() {
        if (scopeStack.isEmpty()) {
            throw new IllegalStateException("Cannot pop scope frame: stack is empty");
        }
        scopeStack.pop();
    }

    /**
     * Adds names bound by a match in the current region to the innermost frame.
     */
    public void bindInCurrentScope(Iterable<String> names) {
        ScopeFrame current = scopeStack.peek();
        if (current != null) {
            current.bindAll(names);
        }
    }

    // ========== Capture stack ==========

    void pushCapture() {
        captureStack.push(new ArrayList<>());
    }

    List<String> popCapture() {
        return captureStack.pop();
    }

    void registerPlaceholder(String nodeId) {
        List<String> current = captureStack.peek();
        if (current != null) {
            current.add(nodeId);
        }
    }

    /**
     * Short human-readable name of a construct, used in failure reports.
     */
    public static String describeConstruct(SourceNode node) {
        if (node == null) {
            return "(none)";
        }
        switch (NodeShape.classify(node)) {
            case FUNCTION_DEFINITION:
                return node.getTag() + " " + node.getValueAsString() + "/" + arityOf(node);
            case MODULE_DEFINITION:
                return "module " + node.getValueAsString();
            case CLOSURE:
                return "fn/" + arityOf(node);
            case LOCAL_CALL:
            case REMOTE_CALL:
                return "call " + node.getTag();
            default:
                return node.getTag();
        }
    }

    private static String arityOf(SourceNode definition) {
        SourceNode first = definition.childCount() > 0 ? definition.child(0) : null;
        if (first != null && first.isConstruct("clause") && first.childCount() > 0
                && first.child(0).isConstruct("params")) {
            return String.valueOf(first.child(0).childCount());
        }
        return "?";
    }
}
