package me.christianrobert.semgraph.graph;

/**
 * Relation names used on graph nodes.
 */
public final class Relations {

    public static final String LEFT_OPERAND = "leftOperand";
    public static final String RIGHT_OPERAND = "rightOperand";
    public static final String OPERAND = "operand";

    public static final String CALLEE = "callee";
    public static final String ARGUMENT = "argument";

    public static final String ELEMENT = "element";
    public static final String ENTRY = "entry";
    public static final String KEY = "key";
    public static final String VALUE = "value";
    public static final String REFERENCED_TYPE = "referencedType";
    public static final String RANGE_START = "rangeStart";
    public static final String RANGE_END = "rangeEnd";
    public static final String RANGE_STEP = "rangeStep";
    public static final String SEGMENT = "segment";
    public static final String CONTENT = "content";

    public static final String TAIL = "tail";
    public static final String INNER_PATTERN = "innerPattern";
    public static final String PATTERN = "pattern";
    public static final String GUARD = "guard";

    public static final String STATEMENT = "statement";
    public static final String SUBJECT = "subject";
    public static final String CLAUSE = "clause";
    public static final String PARAMETER = "parameter";
    public static final String BODY = "body";
    public static final String GENERATOR = "generator";
    public static final String FILTER = "filter";
    public static final String ENUMERABLE = "enumerable";

    public static final String CAPTURED_VARIABLE = "capturedVariable";
    public static final String CAPTURED_FROM = "capturedFrom";
    public static final String PLACEHOLDER = "placeholder";
    public static final String CONTAINS = "contains";

    private Relations() {
    }
}
