package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.context.BuildContext;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.BuildLimits;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.SourceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static me.christianrobert.semgraph.source.SourceNode.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Expression building: operators, calls, literals and collections.
 */
class ExpressionBuilderTest {

    private BuildContext context;

    @BeforeEach
    void setUp() {
        context = new BuildContext(BuildLimits.defaults());
    }

    private String build(SourceNode node) {
        return newBuilder(context).build(node, "expr/0", 1);
    }

    private static SemanticGraphBuilder newBuilder(BuildContext context) {
        return new SemanticGraphBuilder(context, ScopeFrame.root(ScopeKind.BLOCK, null, "expr/0"));
    }

    private GraphNode node(String id) {
        GraphNode node = context.getNode(id);
        assertNotNull(node, "missing node " + id);
        return node;
    }

    // ========== OPERATORS ==========

    @Test
    void logicalOverComparisons() {
        // Given: x > 5 and y < 10
        SourceNode source = op("and",
                op(">", var("x"), integer(5)),
                op("<", var("y"), integer(10)));

        // When
        String rootId = build(source);

        // Then
        GraphNode root = node(rootId);
        assertEquals(NodeType.LOGICAL_OPERATOR, root.getPrimaryType());
        assertEquals("and", root.getProperty(Properties.OPERATOR_SYMBOL));

        GraphNode left = node(root.getSingleRelation(Relations.LEFT_OPERAND));
        GraphNode right = node(root.getSingleRelation(Relations.RIGHT_OPERAND));
        assertEquals(NodeType.COMPARISON_OPERATOR, left.getPrimaryType());
        assertEquals(">", left.getProperty(Properties.OPERATOR_SYMBOL));
        assertEquals("<", right.getProperty(Properties.OPERATOR_SYMBOL));

        assertEquals("x", node("expr/0/left/left").getProperty(Properties.NAME));
        assertEquals(NodeType.VARIABLE, node("expr/0/left/left").getPrimaryType());
        assertEquals(5L, node("expr/0/left/right").getProperty(Properties.INTEGER_VALUE));
        assertEquals(10L, node("expr/0/right/right").getProperty(Properties.INTEGER_VALUE));
        assertEquals(7, context.nodeCount());
    }

    @Test
    void unaryMinusCarriesAuxiliaryType() {
        build(op("-", var("x")));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.ARITHMETIC_OPERATOR, root.getPrimaryType());
        assertTrue(root.hasType(NodeType.UNARY_OPERATOR));
        assertEquals("expr/0/operand", root.getSingleRelation(Relations.OPERAND));
    }

    @Test
    void notIsLogicalUnary() {
        build(op("not", bool(true)));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.LOGICAL_OPERATOR, root.getPrimaryType());
        assertTrue(root.hasType(NodeType.UNARY_OPERATOR));
        assertEquals(true, node("expr/0/operand").getProperty(Properties.BOOLEAN_VALUE));
    }

    @Test
    void pipeChainIsLeftNested() {
        // Given: xs |> Enum.map(f) |> Enum.sum()
        SourceNode source = op("|>",
                op("|>", var("xs"), remoteCall("Enum", "map", var("f"))),
                remoteCall("Enum", "sum"));

        build(source);

        assertEquals(NodeType.PIPE_OPERATOR, node("expr/0").getPrimaryType());
        assertEquals(NodeType.PIPE_OPERATOR, node("expr/0/left").getPrimaryType());
        assertEquals("Enum.sum", node("expr/0/right").getProperty(Properties.NAME));
        assertEquals(0L, node("expr/0/right").getProperty(Properties.ARITY));
    }

    @Test
    void concatAndListOperators() {
        build(op("++", list(integer(1)), op("<>", string("a"), string("b"))));

        assertEquals(NodeType.LIST_OPERATOR, node("expr/0").getPrimaryType());
        assertEquals(NodeType.STRING_CONCAT_OPERATOR, node("expr/0/right").getPrimaryType());
    }

    @Test
    void matchBindsIntoEnclosingScope() {
        // Given: {a, b} = pair
        SemanticGraphBuilder builder = newBuilder(context);

        builder.build(op("=", tuple(var("a"), var("b")), var("pair")), "expr/0", 1);

        GraphNode root = node("expr/0");
        assertEquals(NodeType.MATCH_OPERATOR, root.getPrimaryType());
        assertEquals(2L, root.getProperty(Properties.BINDING_COUNT));
        assertEquals(NodeType.TUPLE_PATTERN, node("expr/0/left").getPrimaryType());
        assertEquals(NodeType.VARIABLE, node("expr/0/right").getPrimaryType());
        assertTrue(builder.currentScope().binds("a"));
        assertTrue(builder.currentScope().binds("b"));
        assertFalse(builder.currentScope().binds("pair"));
    }

    // ========== CALLS ==========

    @Test
    void localCallWithArguments() {
        build(call("foo", integer(1), var("y")));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.LOCAL_CALL, root.getPrimaryType());
        assertEquals("foo", root.getProperty(Properties.NAME));
        assertNull(root.getProperty(Properties.QUALIFIER));
        assertEquals(2L, root.getProperty(Properties.ARITY));
        assertEquals(List.of("expr/0/arguments/0", "expr/0/arguments/1"), root.getRelation(Relations.ARGUMENT));

        GraphNode callee = node(root.getSingleRelation(Relations.CALLEE));
        assertEquals(NodeType.FUNCTION_REFERENCE, callee.getPrimaryType());
        assertEquals("foo", callee.getProperty(Properties.FUNCTION));
    }

    @Test
    void remoteCallKeepsQualifier() {
        build(remoteCall("String", "upcase", var("s")));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.REMOTE_CALL, root.getPrimaryType());
        assertEquals("String.upcase", root.getProperty(Properties.NAME));
        assertEquals("String", root.getProperty(Properties.QUALIFIER));
        assertEquals("String", node("expr/0/callee").getProperty(Properties.QUALIFIER));
    }

    // ========== LITERALS ==========

    @Test
    void atomsRenderWithColonExceptBooleansAndNil() {
        build(tuple(atom("ok"), atom("true"), atom("nil")));

        assertEquals(":ok", node("expr/0/elements/0").getProperty(Properties.ATOM_VALUE));
        assertEquals("true", node("expr/0/elements/1").getProperty(Properties.ATOM_VALUE));
        assertEquals("nil", node("expr/0/elements/2").getProperty(Properties.ATOM_VALUE));
    }

    @Test
    void scalarLiterals() {
        build(list(floating(1.5), string("hi"), charlist("ab"), nil(), bool(false)));

        assertEquals(1.5d, node("expr/0/elements/0").getProperty(Properties.FLOAT_VALUE));
        assertEquals("hi", node("expr/0/elements/1").getProperty(Properties.STRING_VALUE));
        assertEquals("ab", node("expr/0/elements/2").getProperty(Properties.CHARLIST_VALUE));
        assertEquals(NodeType.NIL_LITERAL, node("expr/0/elements/3").getPrimaryType());
        assertEquals(false, node("expr/0/elements/4").getProperty(Properties.BOOLEAN_VALUE));
    }

    @Test
    void integerBeyondSixtyFourBitsKeepsDecimalValue() {
        build(list(integer(new BigInteger("123456789012345678901234567890")),
                integer(BigInteger.valueOf(-7))));

        GraphNode big = node("expr/0/elements/0");
        assertEquals(NodeType.INTEGER_LITERAL, big.getPrimaryType());
        assertEquals("123456789012345678901234567890", big.getProperty(Properties.INTEGER_VALUE));
        assertEquals(-7L, node("expr/0/elements/1").getProperty(Properties.INTEGER_VALUE));
        assertTrue(context.getDiagnostics().isEmpty());
    }

    @Test
    void sigilModifiersAreDecoded() {
        build(sigil('r', "a+b", 105, 120));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.SIGIL_LITERAL, root.getPrimaryType());
        assertEquals("r", root.getProperty(Properties.SIGIL_CHAR));
        assertEquals("a+b", root.getProperty(Properties.CONTENT));
        assertEquals("ix", root.getProperty(Properties.MODIFIERS));
    }

    @Test
    void constantBinaryIsBase64Encoded() {
        build(binary(integer(1), integer(2), integer(255)));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.BINARY_LITERAL, root.getPrimaryType());
        assertEquals("AQL/", root.getProperty(Properties.BINARY_VALUE));
        assertEquals(3L, root.getProperty(Properties.SIZE));
        assertEquals(1, context.nodeCount());
    }

    @Test
    void binaryWithVariablesIsConstruction() {
        // Given: <<x::size(8), 1>>
        build(binary(segment(var("x"), call("size", integer(8))), integer(1)));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.BITSTRING_CONSTRUCTION, root.getPrimaryType());
        GraphNode first = node("expr/0/segments/0");
        assertEquals(NodeType.BINARY_SEGMENT, first.getPrimaryType());
        assertEquals("size(8)", first.getProperty(Properties.SPECIFIER));
        assertEquals("x", node("expr/0/segments/0/value").getProperty(Properties.NAME));
        assertEquals(1L, node("expr/0/segments/1/value").getProperty(Properties.INTEGER_VALUE));
    }

    @Test
    void rangeWithStep() {
        build(range(integer(1), integer(10), integer(2)));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.RANGE_LITERAL, root.getPrimaryType());
        assertEquals(1L, root.getProperty(Properties.FIRST));
        assertEquals(10L, root.getProperty(Properties.LAST));
        assertEquals(2L, root.getProperty(Properties.STEP));
        assertEquals("expr/0/step", root.getSingleRelation(Relations.RANGE_STEP));
    }

    @Test
    void rangeWithVariableBoundHasNoProperty() {
        build(range(integer(1), var("n")));

        GraphNode root = node("expr/0");
        assertNull(root.getProperty(Properties.LAST));
        assertEquals("expr/0/last", root.getSingleRelation(Relations.RANGE_END));
    }

    // ========== COLLECTIONS ==========

    @Test
    void mapEntriesKeepSourceOrder() {
        // Given: %{a: 1, "b" => 2}
        build(map(kwEntry("a", integer(1)), entry(string("b"), integer(2))));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.MAP_LITERAL, root.getPrimaryType());
        assertEquals(List.of("expr/0/entries/0", "expr/0/entries/1"), root.getRelation(Relations.ENTRY));

        GraphNode first = node("expr/0/entries/0");
        assertEquals(true, first.getProperty(Properties.KEYWORD_KEY));
        GraphNode firstKey = node(first.getSingleRelation(Relations.KEY));
        assertEquals(NodeType.ATOM_LITERAL, firstKey.getPrimaryType());
        assertEquals(":a", firstKey.getProperty(Properties.ATOM_VALUE));

        GraphNode second = node("expr/0/entries/1");
        assertEquals(false, second.getProperty(Properties.KEYWORD_KEY));
        assertEquals("b", node("expr/0/entries/1/key").getProperty(Properties.STRING_VALUE));
        assertEquals(2L, node("expr/0/entries/1/value").getProperty(Properties.INTEGER_VALUE));
    }

    @Test
    void structReferencesItsType() {
        build(struct("User", kwEntry("name", string("ann"))));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.STRUCT_LITERAL, root.getPrimaryType());
        assertEquals("User", root.getProperty(Properties.NAME));
        GraphNode type = node(root.getSingleRelation(Relations.REFERENCED_TYPE));
        assertEquals(NodeType.TYPE_REFERENCE, type.getPrimaryType());
        assertEquals("User", type.getProperty(Properties.NAME));
    }

    @Test
    void listWithConsTail() {
        // Given: [1, 2 | rest]
        build(list(integer(1), cons(integer(2), var("rest"))));

        GraphNode root = node("expr/0");
        assertEquals(2, root.getRelation(Relations.ELEMENT).size());
        assertEquals("expr/0/tail", root.getSingleRelation(Relations.TAIL));
        assertEquals("rest", node("expr/0/tail").getProperty(Properties.NAME));
    }

    @Test
    void emptyListHasNoChildren() {
        build(list());

        GraphNode root = node("expr/0");
        assertEquals(0L, root.getProperty(Properties.SIZE));
        assertTrue(root.getRelations().isEmpty());
        assertEquals(1, context.nodeCount());
    }

    @Test
    void moduleAttributeAndAlias() {
        build(tuple(attribute("timeout"), alias("Enum")));

        assertEquals(NodeType.MODULE_ATTRIBUTE, node("expr/0/elements/0").getPrimaryType());
        assertEquals("timeout", node("expr/0/elements/0").getProperty(Properties.NAME));
        assertEquals(NodeType.MODULE_REFERENCE, node("expr/0/elements/1").getPrimaryType());
    }

    // ========== BLOCKS, CASE, COMPREHENSIONS ==========

    @Test
    void blockStatementsInOrder() {
        build(block(op("=", var("a"), integer(1)), var("a")));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.BLOCK, root.getPrimaryType());
        assertEquals(List.of("expr/0/statements/0", "expr/0/statements/1"), root.getRelation(Relations.STATEMENT));
    }

    @Test
    void caseClausesGetOrderAndPatterns() {
        // Given: case r do {:ok, v} -> v; _ -> nil end
        build(caseOf(var("r"),
                clause(List.of(tuple(atom("ok"), var("v"))), var("v")),
                clause(List.of(wildcard()), nil())));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.CASE_EXPRESSION, root.getPrimaryType());
        assertEquals(2L, root.getProperty(Properties.CLAUSE_COUNT));
        assertEquals("expr/0/subject", root.getSingleRelation(Relations.SUBJECT));

        GraphNode first = node("expr/0/clauses/0");
        assertEquals(0L, first.getProperty(Properties.ORDER));
        assertEquals(1L, first.getProperty(Properties.BINDING_COUNT));
        assertEquals(NodeType.TUPLE_PATTERN, node("expr/0/clauses/0/parameters/0").getPrimaryType());
        assertEquals(NodeType.WILDCARD_PATTERN, node("expr/0/clauses/1/parameters/0").getPrimaryType());
    }

    @Test
    void caseClauseWithTwoPatternsIsMalformed() {
        SourceNode source = caseOf(var("r"), clause(List.of(var("a"), var("b")), nil()));

        GraphBuildException e = assertThrows(GraphBuildException.class, () -> build(source));
        assertEquals(BuildErrorKind.MALFORMED_PATTERN, e.getKind());
    }

    @Test
    void comprehensionWithGeneratorAndFilter() {
        // Given: for x <- xs, x > 1, do: x * 2
        build(comprehension(
                List.of(generator(var("x"), var("xs")), op(">", var("x"), integer(1))),
                op("*", var("x"), integer(2))));

        GraphNode root = node("expr/0");
        assertEquals(NodeType.COMPREHENSION, root.getPrimaryType());
        GraphNode generator = node(root.getSingleRelation(Relations.GENERATOR));
        assertEquals(NodeType.VARIABLE_PATTERN, node(generator.getSingleRelation(Relations.PATTERN)).getPrimaryType());
        assertEquals("xs", node(generator.getSingleRelation(Relations.ENUMERABLE)).getProperty(Properties.NAME));
        assertEquals("expr/0/filters/0", root.getSingleRelation(Relations.FILTER));
        assertEquals("expr/0/body", root.getSingleRelation(Relations.BODY));
    }

    // ========== UNKNOWN AND LIMITS ==========

    @Test
    void unknownShapeIsSoft() {
        build(list(construct("quote", null, List.of(var("x"))), integer(1)));

        GraphNode unknown = node("expr/0/elements/0");
        assertEquals(NodeType.UNKNOWN_EXPRESSION, unknown.getPrimaryType());
        assertEquals("quote", unknown.getProperty(Properties.ORIGINAL_TAG));
        assertEquals(1, context.getDiagnostics().size());
        assertEquals(BuildErrorKind.UNRECOGNIZED_NODE_SHAPE, context.getDiagnostics().get(0).getKind());
        assertEquals(1L, node("expr/0/elements/1").getProperty(Properties.INTEGER_VALUE));
    }

    @Test
    void placeholderOutsideCaptureIsUnknown() {
        build(placeholder(1));

        assertEquals(NodeType.UNKNOWN_EXPRESSION, node("expr/0").getPrimaryType());
        assertEquals(1, context.getDiagnostics().size());
    }

    @Test
    void fanOutAboveLimitFails() {
        BuildContext small = new BuildContext(BuildLimits.defaults().withMaxFanOut(2));

        GraphBuildException e = assertThrows(GraphBuildException.class,
                () -> newBuilder(small).build(list(integer(1), integer(2), integer(3)), "expr/0", 1));
        assertEquals(BuildErrorKind.SIZE_EXCEEDED, e.getKind());
    }

    @Test
    void depthAtLimitSucceedsAndOneMoreFails() {
        // Nine nested lists around an integer: ten levels
        SourceNode ten = integer(1);
        for (int i = 0; i < 9; i++) {
            ten = list(ten);
        }
        SourceNode eleven = list(ten);
        BuildLimits limits = BuildLimits.defaults().withMaxDepth(10);

        BuildContext ok = new BuildContext(limits);
        newBuilder(ok).build(ten, "expr/0", 1);
        assertEquals(10, ok.nodeCount());

        GraphBuildException e = assertThrows(GraphBuildException.class,
                () -> newBuilder(new BuildContext(limits)).build(eleven, "expr/0", 1));
        assertEquals(BuildErrorKind.DEPTH_EXCEEDED, e.getKind());
    }

    @Test
    void sameInputBuildsSameGraph() {
        SourceNode source = op("and", op(">", var("x"), integer(5)), call("ok?", map(kwEntry("a", list()))));

        BuildContext first = new BuildContext(BuildLimits.defaults());
        BuildContext second = new BuildContext(BuildLimits.defaults());
        newBuilder(first).build(source, "expr/0", 1);
        newBuilder(second).build(source, "expr/0", 1);

        assertEquals(first.getNodes(), second.getNodes());
    }

    @Test
    void positionsAreCopied() {
        build(var("x").at(4, 9));

        assertEquals(4L, node("expr/0").getProperty(Properties.START_LINE));
        assertEquals(9L, node("expr/0").getProperty(Properties.START_COLUMN));
    }

    @Test
    void describeConstructNames() {
        assertEquals("def run/2", SemanticGraphBuilder.describeConstruct(
                def("run", clause(List.of(var("a"), var("b")), nil()))));
        assertEquals("module Shop", SemanticGraphBuilder.describeConstruct(module("Shop")));
        assertEquals("fn/1", SemanticGraphBuilder.describeConstruct(fn(clause(List.of(var("a")), nil()))));
        assertEquals("call map", SemanticGraphBuilder.describeConstruct(call("map")));
    }
}
