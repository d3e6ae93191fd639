package me.christianrobert.semgraph.source;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Closed classification of {@link SourceNode} shapes.
 *
 * <p>Every builder dispatches on this enum instead of inspecting tags directly, so a new
 * shape has to be added here before any builder can see it. Nodes that fit no shape
 * classify as {@link #UNKNOWN}.</p>
 *
 * <p>Order matters in {@link #classify(SourceNode)}: single-operand operator forms are
 * matched before two-operand forms sharing the same symbol, otherwise {@code -x} would be
 * read as a malformed binary minus.</p>
 */
public enum NodeShape {

    // Literals
    INTEGER,
    FLOAT,
    STRING,
    CHARLIST,
    BOOLEAN,
    NIL,
    ATOM,
    LIST,
    TUPLE,
    MAP,
    STRUCT,
    RANGE,
    SIGIL,
    BINARY,

    // Operators and calls
    UNARY_OPERATOR,
    BINARY_OPERATOR,
    LOCAL_CALL,
    REMOTE_CALL,

    // References
    VARIABLE,
    WILDCARD,
    MODULE_ATTRIBUTE,
    ALIAS,

    // Pattern-only constructs
    PIN,
    CONS,
    GUARD,

    // Compound expressions
    BLOCK,
    CASE,
    COMPREHENSION,
    CLOSURE,
    CAPTURE,
    PLACEHOLDER,
    FUNCTION_DEFINITION,
    MODULE_DEFINITION,

    UNKNOWN;

    private static final Pattern BIG_INTEGER = Pattern.compile("-?[0-9]+");

    public static final Set<String> UNARY_SYMBOLS = Set.of("-", "+", "not", "!");

    public static final Set<String> BINARY_SYMBOLS = Set.of(
            "+", "-", "*", "/", "div", "rem",
            "==", "!=", "===", "!==", "<", ">", "<=", ">=",
            "and", "or", "&&", "||",
            "|>", "=", "++", "--", "<>");

    /**
     * Classifies a source node. Never returns null.
     *
     * @param node Node to classify
     * @return Shape of the node, {@link #UNKNOWN} when nothing matches
     */
    public static NodeShape classify(SourceNode node) {
        if (node == null) {
            return UNKNOWN;
        }
        switch (node.getKind()) {
            case LITERAL:
                return classifyLiteral(node);
            case VARIABLE:
                return "_".equals(node.getTag()) ? WILDCARD : VARIABLE;
            case OPERATOR:
                return classifyOperator(node);
            case CALL:
                return node.getValue() != null ? REMOTE_CALL : LOCAL_CALL;
            case CONSTRUCT:
                return classifyConstruct(node);
            default:
                return UNKNOWN;
        }
    }

    // Integers beyond 64 bits travel as their decimal string
    private static boolean isBigInteger(Object value) {
        return value instanceof String && BIG_INTEGER.matcher((String) value).matches();
    }

    private static NodeShape classifyLiteral(SourceNode node) {
        switch (node.getTag()) {
            case "integer":
                return node.getValue() instanceof Long || isBigInteger(node.getValue()) ? INTEGER : UNKNOWN;
            case "float":
                return node.getValue() instanceof Number ? FLOAT : UNKNOWN;
            case "string":
                return STRING;
            case "charlist":
                return CHARLIST;
            case "boolean":
                return node.getValue() instanceof Boolean ? BOOLEAN : UNKNOWN;
            case "nil":
                return NIL;
            case "atom":
                return node.getValue() != null ? ATOM : UNKNOWN;
            default:
                return UNKNOWN;
        }
    }

    private static NodeShape classifyOperator(SourceNode node) {
        String symbol = node.getTag();
        // Unary first: "-" and "+" exist in both tables
        if (node.childCount() == 1 && UNARY_SYMBOLS.contains(symbol)) {
            return UNARY_OPERATOR;
        }
        if (node.childCount() == 2 && BINARY_SYMBOLS.contains(symbol)) {
            return BINARY_OPERATOR;
        }
        return UNKNOWN;
    }

    private static NodeShape classifyConstruct(SourceNode node) {
        int size = node.childCount();
        switch (node.getTag()) {
            case "list":
                return LIST;
            case "tuple":
                return TUPLE;
            case "map":
                return MAP;
            case "struct":
                return node.getValue() != null ? STRUCT : UNKNOWN;
            case "range":
                return size == 2 || size == 3 ? RANGE : UNKNOWN;
            case "sigil":
                return size == 2 && node.getValue() != null ? SIGIL : UNKNOWN;
            case "binary":
                return BINARY;
            case "pin":
                return size == 1 ? PIN : UNKNOWN;
            case "cons":
                return size == 2 ? CONS : UNKNOWN;
            case "when":
                return size == 2 ? GUARD : UNKNOWN;
            case "block":
                return BLOCK;
            case "case":
                return size >= 1 ? CASE : UNKNOWN;
            case "for":
                return size >= 1 ? COMPREHENSION : UNKNOWN;
            case "fn":
                return size >= 1 ? CLOSURE : UNKNOWN;
            case "capture":
                return size == 1 ? CAPTURE : UNKNOWN;
            case "placeholder":
                return node.getValue() instanceof Long ? PLACEHOLDER : UNKNOWN;
            case "def":
            case "defp":
                return size >= 1 && node.getValue() != null ? FUNCTION_DEFINITION : UNKNOWN;
            case "module":
                return node.getValue() != null ? MODULE_DEFINITION : UNKNOWN;
            case "alias":
                return node.getValue() != null ? ALIAS : UNKNOWN;
            case "attribute":
                return node.getValue() != null ? MODULE_ATTRIBUTE : UNKNOWN;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Shapes that are literal values (scalar or composite).
     */
    public boolean isLiteral() {
        switch (this) {
            case INTEGER:
            case FLOAT:
            case STRING:
            case CHARLIST:
            case BOOLEAN:
            case NIL:
            case ATOM:
            case LIST:
            case TUPLE:
            case MAP:
            case STRUCT:
            case RANGE:
            case SIGIL:
            case BINARY:
                return true;
            default:
                return false;
        }
    }
}
