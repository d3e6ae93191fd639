package me.christianrobert.semgraph.graph;

/**
 * Property names used on graph nodes.
 */
public final class Properties {

    public static final String START_LINE = "startLine";
    public static final String START_COLUMN = "startColumn";

    // Literal values
    public static final String INTEGER_VALUE = "integerValue";
    public static final String FLOAT_VALUE = "floatValue";
    public static final String STRING_VALUE = "stringValue";
    public static final String CHARLIST_VALUE = "charlistValue";
    public static final String BOOLEAN_VALUE = "booleanValue";
    public static final String ATOM_VALUE = "atomValue";
    public static final String BINARY_VALUE = "binaryValue";
    public static final String SIZE = "size";
    public static final String KEYWORD_KEY = "keywordKey";
    public static final String FIRST = "first";
    public static final String LAST = "last";
    public static final String STEP = "step";
    public static final String SIGIL_CHAR = "sigilChar";
    public static final String CONTENT = "content";
    public static final String MODIFIERS = "modifiers";
    public static final String SPECIFIER = "specifier";

    // Operators, calls, references
    public static final String OPERATOR_SYMBOL = "operatorSymbol";
    public static final String NAME = "name";
    public static final String QUALIFIER = "qualifier";
    public static final String ARITY = "arity";
    public static final String ORIGINAL_TAG = "originalTag";

    // Patterns
    public static final String IGNORED = "ignored";
    public static final String PINNED_NAME = "pinnedName";
    public static final String ALIAS = "alias";
    public static final String ANY_STRUCT = "anyStruct";
    public static final String BINDING_COUNT = "bindingCount";

    // Clauses and functions
    public static final String ORDER = "order";
    public static final String CLAUSE_COUNT = "clauseCount";
    public static final String VISIBILITY = "visibility";

    // Closures and captures
    public static final String HAS_CAPTURES = "hasCaptures";
    public static final String CAPTURE_COUNT = "captureCount";
    public static final String REFERENCE_COUNT = "referenceCount";
    public static final String MUTATION = "mutation";
    public static final String CAPTURE_DEPTH = "captureDepth";
    public static final String RESOLVED = "resolved";
    public static final String SCOPE_KIND = "scopeKind";
    public static final String CROSSES_FUNCTION_BOUNDARY = "crossesFunctionBoundary";
    public static final String CAPTURE_KIND = "captureKind";
    public static final String FUNCTION = "function";
    public static final String PLACEHOLDER_COUNT = "placeholderCount";
    public static final String PLACEHOLDER_INDEX = "placeholderIndex";
    public static final String HAS_GAPS = "hasGaps";
    public static final String GAPS = "gaps";

    private Properties() {
    }
}
