package me.christianrobert.semgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type tags of graph nodes. A node has exactly one primary type and any number of
 * auxiliary types; the label is what downstream schema validation sees.
 */
public enum NodeType {

    // Literals
    INTEGER_LITERAL("IntegerLiteral"),
    FLOAT_LITERAL("FloatLiteral"),
    STRING_LITERAL("StringLiteral"),
    CHARLIST_LITERAL("CharlistLiteral"),
    BOOLEAN_LITERAL("BooleanLiteral"),
    NIL_LITERAL("NilLiteral"),
    ATOM_LITERAL("AtomLiteral"),
    LIST_LITERAL("ListLiteral"),
    TUPLE_LITERAL("TupleLiteral"),
    MAP_LITERAL("MapLiteral"),
    MAP_ENTRY("MapEntry"),
    STRUCT_LITERAL("StructLiteral"),
    TYPE_REFERENCE("TypeReference"),
    RANGE_LITERAL("RangeLiteral"),
    SIGIL_LITERAL("SigilLiteral"),
    BINARY_LITERAL("BinaryLiteral"),
    BITSTRING_CONSTRUCTION("BitstringConstruction"),
    BINARY_SEGMENT("BinarySegment"),

    // Operators
    ARITHMETIC_OPERATOR("ArithmeticOperator"),
    COMPARISON_OPERATOR("ComparisonOperator"),
    LOGICAL_OPERATOR("LogicalOperator"),
    PIPE_OPERATOR("PipeOperator"),
    MATCH_OPERATOR("MatchOperator"),
    LIST_OPERATOR("ListOperator"),
    STRING_CONCAT_OPERATOR("StringConcatOperator"),
    UNARY_OPERATOR("UnaryOperator"),

    // Calls and references
    LOCAL_CALL("LocalCall"),
    REMOTE_CALL("RemoteCall"),
    FUNCTION_REFERENCE("FunctionReference"),
    VARIABLE("Variable"),
    MODULE_ATTRIBUTE("ModuleAttribute"),
    MODULE_REFERENCE("ModuleReference"),

    // Patterns
    LITERAL_PATTERN("LiteralPattern"),
    VARIABLE_PATTERN("VariablePattern"),
    WILDCARD_PATTERN("WildcardPattern"),
    PIN_PATTERN("PinPattern"),
    TUPLE_PATTERN("TuplePattern"),
    LIST_PATTERN("ListPattern"),
    MAP_PATTERN("MapPattern"),
    STRUCT_PATTERN("StructPattern"),
    BINARY_PATTERN("BinaryPattern"),
    AS_PATTERN("AsPattern"),
    GUARDED_PATTERN("GuardedPattern"),

    // Compound expressions
    BLOCK("Block"),
    CASE_EXPRESSION("CaseExpression"),
    COMPREHENSION("Comprehension"),
    GENERATOR("Generator"),
    CLAUSE("Clause"),
    ANONYMOUS_FUNCTION("AnonymousFunction"),
    CLOSURE("Closure"),
    CAPTURED_VARIABLE("CapturedVariable"),
    CAPTURE("Capture"),
    CAPTURE_PLACEHOLDER("CapturePlaceholder"),
    FUNCTION_DEFINITION("FunctionDefinition"),
    MODULE_DEFINITION("ModuleDefinition"),

    UNKNOWN_EXPRESSION("UnknownExpression");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
