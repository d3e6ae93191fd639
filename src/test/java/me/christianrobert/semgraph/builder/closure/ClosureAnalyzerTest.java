package me.christianrobert.semgraph.builder.closure;

import me.christianrobert.semgraph.builder.pattern.ClauseParts;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.BuildLimits;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.source.SourceNode;
import me.christianrobert.semgraph.source.SourcePosition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static me.christianrobert.semgraph.source.SourceNode.*;
import static org.junit.jupiter.api.Assertions.*;

class ClosureAnalyzerTest {

    private ClosureAnalyzer analyzer;
    private ScopeFrame enclosing;

    @BeforeEach
    void setUp() {
        analyzer = new ClosureAnalyzer();
        enclosing = ScopeFrame.root(ScopeKind.BLOCK, null, "expr/0");
    }

    private ClosureAnalysis analyze(ScopeFrame frame, BuildLimits limits, SourceNode... clauses) {
        List<ClauseParts> parts = new ArrayList<>();
        for (int i = 0; i < clauses.length; i++) {
            parts.add(ClauseParts.of(clauses[i], "fn/clauses/" + i));
        }
        return analyzer.analyze(parts, frame, limits, "fn");
    }

    private ClosureAnalysis analyze(SourceNode... clauses) {
        return analyze(enclosing, BuildLimits.defaults(), clauses);
    }

    private static Set<String> freeNames(ClosureAnalysis analysis) {
        return analysis.getFreeVariables().stream()
                .map(FreeVariableRecord::getName)
                .collect(Collectors.toSet());
    }

    // ========== FREE VARIABLES ==========

    @Test
    void freeIsReferencedMinusParameters() {
        // Given: fn x, y -> x + y + z end
        SourceNode body = op("+", op("+", var("x"), var("y")), var("z"));

        ClosureAnalysis analysis = analyze(clause(List.of(var("x"), var("y")), body));

        assertEquals(Set.of("x", "y"), analysis.getBoundSymbols());
        assertEquals(Set.of("x", "y", "z"), analysis.getReferencedSymbols());
        assertEquals(Set.of("z"), freeNames(analysis));
    }

    @Test
    void closureWithoutOuterReadsCapturesNothing() {
        ClosureAnalysis analysis = analyze(clause(List.of(var("a")), op("*", var("a"), integer(2))));

        assertFalse(analysis.hasCaptures());
        assertEquals(0, analysis.getCaptureCount());
        assertFalse(analysis.crossesFunctionBoundary());
    }

    @Test
    void bindingsOfAllClausesCount() {
        // Given: fn {:a, v} -> v; {:b, w} -> w + v end
        ClosureAnalysis analysis = analyze(
                clause(List.of(tuple(atom("a"), var("v"))), var("v")),
                clause(List.of(tuple(atom("b"), var("w"))), op("+", var("w"), var("v"))));

        assertFalse(analysis.hasCaptures());
    }

    @Test
    void freeVariablesAreSortedByName() {
        ClosureAnalysis analysis = analyze(clause(List.of(), tuple(var("zeta"), var("alpha"), var("mid"))));

        List<String> names = analysis.getFreeVariables().stream()
                .map(FreeVariableRecord::getName)
                .collect(Collectors.toList());
        assertEquals(List.of("alpha", "mid", "zeta"), names);
    }

    // ========== MUTATION ==========

    @Test
    void rebindWithoutReadIsShadow() {
        // Given: x bound outside; fn -> log(x); x = 1; x end
        enclosing.bind("x");
        SourceNode body = block(call("log", var("x")), op("=", var("x"), integer(1)), var("x"));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.SHADOW, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void rebindReadingOldValueIsRebind() {
        // Given: fn -> x = x + 1 end
        enclosing.bind("x");
        SourceNode body = op("=", var("x"), op("+", var("x"), integer(1)));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.REBIND, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void readOnlyIsImmutable() {
        enclosing.bind("x");

        ClosureAnalysis analysis = analyze(clause(List.of(), op("*", var("x"), integer(2))));

        assertEquals(MutationClassification.IMMUTABLE, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void rebindWinsOverShadow() {
        enclosing.bind("x");
        SourceNode body = block(
                op("=", var("x"), integer(0)),
                op("=", var("x"), op("+", var("x"), integer(1))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.REBIND, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void nestedClosureMatchesAreNotMutations() {
        enclosing.bind("x");
        SourceNode body = block(var("x"), fn(clause(List.of(), op("=", var("x"), integer(1)))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.IMMUTABLE, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void matchOnCaseClauseParameterIsNotAMutation() {
        // Given: fn -> log(x); case v do x -> x = x + 1 end end
        enclosing.bind("x");
        SourceNode body = block(
                call("log", var("x")),
                caseOf(var("v"), clause(List.of(var("x")),
                        op("=", var("x"), op("+", var("x"), integer(1))))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.IMMUTABLE, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void matchOnGeneratorVariableIsNotAMutation() {
        // Given: fn -> for x <- x, do: (x = x * 2) end
        enclosing.bind("x");
        SourceNode body = comprehension(List.of(generator(var("x"), var("x"))),
                op("=", var("x"), op("*", var("x"), integer(2))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.IMMUTABLE, analysis.getFreeVariable("x").getMutation());
    }

    @Test
    void matchInsideCaseClauseOnCapturedNameStillCounts() {
        // Given: fn -> case v do _ -> x = x + 1 end end
        enclosing.bind("x");
        SourceNode body = caseOf(var("v"), clause(List.of(wildcard()),
                op("=", var("x"), op("+", var("x"), integer(1)))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(MutationClassification.REBIND, analysis.getFreeVariable("x").getMutation());
    }

    // ========== BODY-LOCAL NAMES ==========

    @Test
    void bodyLocalVariableIsNotCaptured() {
        // Given: fn -> y = 1; y end, with no outer y
        ClosureAnalysis analysis = analyze(clause(List.of(), block(op("=", var("y"), integer(1)), var("y"))));

        assertFalse(analysis.hasCaptures());
        assertTrue(analysis.getReferencedSymbols().contains("y"));
    }

    @Test
    void bodyLocalNameVisibleOutsideIsCaptured() {
        enclosing.bind("y");

        ClosureAnalysis analysis = analyze(clause(List.of(), block(op("=", var("y"), integer(1)), var("y"))));

        FreeVariableRecord y = analysis.getFreeVariable("y");
        assertNotNull(y);
        assertEquals(MutationClassification.SHADOW, y.getMutation());
    }

    @Test
    void readBeforeBindingIsCapturedEvenWhenUnresolved() {
        ClosureAnalysis analysis = analyze(clause(List.of(), block(var("y"), op("=", var("y"), integer(1)))));

        FreeVariableRecord y = analysis.getFreeVariable("y");
        assertNotNull(y);
        assertFalse(y.isResolved());
        assertEquals(FreeVariableRecord.UNRESOLVED_DEPTH, y.getCaptureDepth());
    }

    // ========== NESTED REGIONS ==========

    @Test
    void nestedClosureParametersAreLocal() {
        // Given: fn -> fn a -> a + b end end
        SourceNode inner = fn(clause(List.of(var("a")), op("+", var("a"), var("b"))));

        ClosureAnalysis analysis = analyze(clause(List.of(), inner));

        assertEquals(Set.of("b"), freeNames(analysis));
    }

    @Test
    void caseClauseBindingsAreLocal() {
        SourceNode body = caseOf(var("v"), clause(List.of(tuple(var("k"))), var("k")));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(Set.of("v"), freeNames(analysis));
    }

    @Test
    void comprehensionGeneratorBindingsAreLocal() {
        // Given: fn -> for i <- items, do: i * k end
        SourceNode body = comprehension(List.of(generator(var("i"), var("items"))), op("*", var("i"), var("k")));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(Set.of("items", "k"), freeNames(analysis));
    }

    @Test
    void nonVariablesAreNotReferences() {
        SourceNode body = tuple(
                var("__MODULE__"),
                call("helper"),
                remoteCall("Enum", "count"),
                alias("Enum"),
                attribute("limit"),
                struct("User"));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertTrue(analysis.getReferencedSymbols().isEmpty());
    }

    @Test
    void pinnedParameterIsARead() {
        // Given: fn ^expected -> true end
        ClosureAnalysis analysis = analyze(clause(List.of(pin("expected")), bool(true)));

        assertEquals(Set.of("expected"), freeNames(analysis));
        assertTrue(analysis.getBoundSymbols().isEmpty());
    }

    @Test
    void guardReadsCount() {
        ClosureAnalysis analysis = analyze(clause(List.of(var("n")), op(">", var("n"), var("min")), var("n")));

        assertEquals(Set.of("min"), freeNames(analysis));
    }

    @Test
    void segmentSpecifierWordsAreNotReads() {
        SourceNode body = binary(segment(var("data"), op("-", var("binary"), call("size", var("len")))));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        assertEquals(Set.of("data", "len"), freeNames(analysis));
    }

    // ========== FRAME RESOLUTION ==========

    @Test
    void resolvesNearestFrameWithDepthAndBoundaryCrossing() {
        // Given: module M binds m, def f(a), for i <- ...
        ScopeFrame module = ScopeFrame.root(ScopeKind.MODULE, "M", "module/0");
        module.bind("m");
        ScopeFrame function = module.child(ScopeKind.FUNCTION, "f/1", "module/0/body/0/clauses/0");
        function.bind("a");
        ScopeFrame comprehension = function.child(ScopeKind.BLOCK, "for", "for/0");
        comprehension.bind("i");

        // When
        ClosureAnalysis analysis = analyze(comprehension, BuildLimits.defaults(),
                clause(List.of(), tuple(var("i"), var("a"), var("m"))));

        // Then
        FreeVariableRecord i = analysis.getFreeVariable("i");
        assertEquals(1, i.getCaptureDepth());
        assertSame(comprehension, i.getSourceFrame());
        assertFalse(i.crossesFunctionBoundary());

        FreeVariableRecord a = analysis.getFreeVariable("a");
        assertEquals(2, a.getCaptureDepth());
        assertFalse(a.crossesFunctionBoundary());

        FreeVariableRecord m = analysis.getFreeVariable("m");
        assertEquals(3, m.getCaptureDepth());
        assertEquals(ScopeKind.MODULE, m.getSourceFrame().getKind());
        assertTrue(m.crossesFunctionBoundary());

        assertTrue(analysis.crossesFunctionBoundary());
        assertTrue(analysis.capturesModuleScope());
        assertEquals(3, analysis.getScopeChain().size());
    }

    @Test
    void innermostBindingWins() {
        ScopeFrame outer = ScopeFrame.root(ScopeKind.FUNCTION, "f/0", "c/0");
        outer.bind("x");
        ScopeFrame inner = outer.child(ScopeKind.BLOCK, null, "b/0");
        inner.bind("x");

        ClosureAnalysis analysis = analyze(inner, BuildLimits.defaults(), clause(List.of(), var("x")));

        assertSame(inner, analysis.getFreeVariable("x").getSourceFrame());
        assertFalse(analysis.capturesModuleScope());
    }

    @Test
    void noEnclosingFrameLeavesEverythingUnresolved() {
        ClosureAnalysis analysis = analyze(null, BuildLimits.defaults(), clause(List.of(), var("x")));

        assertFalse(analysis.getFreeVariable("x").isResolved());
        assertTrue(analysis.getScopeChain().isEmpty());
    }

    // ========== LIMITS ==========

    @Test
    void tooManyCapturesFails() {
        BuildLimits limits = BuildLimits.defaults().withMaxCaptures(2);

        GraphBuildException e = assertThrows(GraphBuildException.class,
                () -> analyze(enclosing, limits, clause(List.of(), tuple(var("a"), var("b"), var("c")))));
        assertEquals(BuildErrorKind.SIZE_EXCEEDED, e.getKind());
    }

    @Test
    void scopeChainLongerThanDepthFails() {
        ScopeFrame deep = enclosing.child(ScopeKind.BLOCK, null, "b/1").child(ScopeKind.BLOCK, null, "b/2");
        BuildLimits limits = BuildLimits.defaults().withMaxDepth(2);

        GraphBuildException e = assertThrows(GraphBuildException.class,
                () -> analyze(deep, limits, clause(List.of(), var("x"))));
        assertEquals(BuildErrorKind.DEPTH_EXCEEDED, e.getKind());
    }

    // ========== COUNTS ==========

    @Test
    void referenceCountsAndPositions() {
        enclosing.bind("x");
        SourceNode body = op("+", var("x").at(1, 5), op("*", var("x").at(2, 3), var("y")));

        ClosureAnalysis analysis = analyze(clause(List.of(), body));

        FreeVariableRecord x = analysis.getFreeVariable("x");
        assertEquals(2, x.getReferenceCount());
        assertEquals(List.of(SourcePosition.of(1, 5), SourcePosition.of(2, 3)), x.getPositions());
        assertEquals(3, analysis.getTotalCaptureReferences());
    }
}
