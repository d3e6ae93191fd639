package me.christianrobert.semgraph.source;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of the tagged syntax tree handed over by the upstream parser.
 *
 * <p>Every node has a {@link Kind}, a tag and an ordered child list. The tag meaning depends on the kind:</p>
 * <ul>
 *   <li>{@code LITERAL} - literal kind ({@code integer}, {@code float}, {@code string}, {@code charlist},
 *       {@code boolean}, {@code nil}, {@code atom}); the scalar lives in {@link #getValue()}</li>
 *   <li>{@code VARIABLE} - the variable name ({@code _} is the wildcard)</li>
 *   <li>{@code OPERATOR} - the operator symbol ({@code +}, {@code and}, {@code |>}, ...)</li>
 *   <li>{@code CALL} - the function name; the value holds the qualifier as written (null for local calls)</li>
 *   <li>{@code CONSTRUCT} - construct kind ({@code list}, {@code map}, {@code fn}, {@code clause}, ...)</li>
 * </ul>
 *
 * <p>Instances are immutable. The JSON form used by the REST endpoint is
 * {@code {"kind", "tag", "value", "children", "line", "column"}}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class SourceNode {

    public enum Kind {
        LITERAL,
        VARIABLE,
        OPERATOR,
        CALL,
        CONSTRUCT
    }

    private final Kind kind;
    private final String tag;
    private final Object value;
    private final List<SourceNode> children;
    private final SourcePosition position;

    public SourceNode(Kind kind, String tag, Object value, List<SourceNode> children, SourcePosition position) {
        if (kind == null) {
            throw new IllegalArgumentException("Source node kind cannot be null");
        }
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Source node tag cannot be null or empty");
        }
        this.kind = kind;
        this.tag = tag;
        this.value = normalizeValue(value);
        this.children = children == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(children));
        this.position = position;
    }

    @JsonCreator
    static SourceNode fromJson(@JsonProperty("kind") Kind kind,
                               @JsonProperty("tag") String tag,
                               @JsonProperty("value") Object value,
                               @JsonProperty("children") List<SourceNode> children,
                               @JsonProperty("line") Integer line,
                               @JsonProperty("column") Integer column) {
        SourcePosition position = line != null ? new SourcePosition(line, column) : null;
        return new SourceNode(kind, tag, value, children, position);
    }

    // Jackson hands out Integer/BigInteger/Float depending on magnitude
    private static Object normalizeValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? (Object) big.longValue() : big.toString();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    // ========== Literal factories ==========

    public static SourceNode integer(long value) {
        return new SourceNode(Kind.LITERAL, "integer", value, null, null);
    }

    /**
     * Integer of arbitrary size. Values that fit 64 bits are stored as {@code Long}, larger
     * ones as their decimal string.
     */
    public static SourceNode integer(BigInteger value) {
        return new SourceNode(Kind.LITERAL, "integer", value, null, null);
    }

    public static SourceNode floating(double value) {
        return new SourceNode(Kind.LITERAL, "float", value, null, null);
    }

    public static SourceNode string(String value) {
        return new SourceNode(Kind.LITERAL, "string", value, null, null);
    }

    public static SourceNode charlist(String value) {
        return new SourceNode(Kind.LITERAL, "charlist", value, null, null);
    }

    public static SourceNode bool(boolean value) {
        return new SourceNode(Kind.LITERAL, "boolean", value, null, null);
    }

    public static SourceNode nil() {
        return new SourceNode(Kind.LITERAL, "nil", null, null, null);
    }

    public static SourceNode atom(String name) {
        return new SourceNode(Kind.LITERAL, "atom", name, null, null);
    }

    // ========== Variables, operators, calls ==========

    public static SourceNode var(String name) {
        return new SourceNode(Kind.VARIABLE, name, null, null, null);
    }

    public static SourceNode wildcard() {
        return var("_");
    }

    public static SourceNode op(String symbol, SourceNode... operands) {
        return new SourceNode(Kind.OPERATOR, symbol, null, Arrays.asList(operands), null);
    }

    public static SourceNode call(String name, SourceNode... args) {
        return new SourceNode(Kind.CALL, name, null, Arrays.asList(args), null);
    }

    public static SourceNode remoteCall(String qualifier, String name, SourceNode... args) {
        return new SourceNode(Kind.CALL, name, qualifier, Arrays.asList(args), null);
    }

    // ========== Collection constructs ==========

    public static SourceNode construct(String tag, Object value, List<SourceNode> children) {
        return new SourceNode(Kind.CONSTRUCT, tag, value, children, null);
    }

    public static SourceNode list(SourceNode... elements) {
        return construct("list", null, Arrays.asList(elements));
    }

    public static SourceNode tuple(SourceNode... elements) {
        return construct("tuple", null, Arrays.asList(elements));
    }

    public static SourceNode map(SourceNode... entries) {
        return construct("map", null, Arrays.asList(entries));
    }

    /** Arbitrary key entry: {@code key => value}. */
    public static SourceNode entry(SourceNode key, SourceNode value) {
        return construct("entry", null, List.of(key, value));
    }

    /** Symbol key entry: {@code key: value}. */
    public static SourceNode kwEntry(String key, SourceNode value) {
        return construct("kw_entry", key, List.of(value));
    }

    public static SourceNode struct(String typeName, SourceNode... entries) {
        return construct("struct", typeName, Arrays.asList(entries));
    }

    public static SourceNode range(SourceNode first, SourceNode last) {
        return construct("range", null, List.of(first, last));
    }

    public static SourceNode range(SourceNode first, SourceNode last, SourceNode step) {
        return construct("range", null, List.of(first, last, step));
    }

    /**
     * Sigil literal. Modifiers arrive from the parser as a list of character codes.
     */
    public static SourceNode sigil(char letter, String content, int... modifierCodes) {
        List<SourceNode> codes = new ArrayList<>();
        for (int code : modifierCodes) {
            codes.add(integer(code));
        }
        return construct("sigil", String.valueOf(letter), List.of(string(content), construct("list", null, codes)));
    }

    public static SourceNode binary(SourceNode... segments) {
        return construct("binary", null, Arrays.asList(segments));
    }

    /** Typed binary segment: {@code value::specifier}. */
    public static SourceNode segment(SourceNode value, SourceNode specifier) {
        return construct("segment", null, List.of(value, specifier));
    }

    /** Cons cell {@code head | tail}, used as the last element of a list. */
    public static SourceNode cons(SourceNode head, SourceNode tail) {
        return construct("cons", null, List.of(head, tail));
    }

    // ========== Pattern constructs ==========

    public static SourceNode pin(String name) {
        return construct("pin", null, List.of(var(name)));
    }

    public static SourceNode when(SourceNode pattern, SourceNode guard) {
        return construct("when", null, List.of(pattern, guard));
    }

    // ========== Functions, clauses and blocks ==========

    public static SourceNode fn(SourceNode... clauses) {
        return construct("fn", null, Arrays.asList(clauses));
    }

    /**
     * Clause: children are {@code params}, optional guard, body (body is always last).
     */
    public static SourceNode clause(List<SourceNode> params, SourceNode guard, SourceNode body) {
        List<SourceNode> children = new ArrayList<>();
        children.add(construct("params", null, params));
        if (guard != null) {
            children.add(guard);
        }
        children.add(body);
        return construct("clause", null, children);
    }

    public static SourceNode clause(List<SourceNode> params, SourceNode body) {
        return clause(params, null, body);
    }

    public static SourceNode block(SourceNode... statements) {
        return construct("block", null, Arrays.asList(statements));
    }

    public static SourceNode caseOf(SourceNode subject, SourceNode... clauses) {
        List<SourceNode> children = new ArrayList<>();
        children.add(subject);
        children.addAll(Arrays.asList(clauses));
        return construct("case", null, children);
    }

    /**
     * Comprehension: qualifiers (generators and filters) followed by the body.
     */
    public static SourceNode comprehension(List<SourceNode> qualifiers, SourceNode body) {
        List<SourceNode> children = new ArrayList<>(qualifiers);
        children.add(body);
        return construct("for", null, children);
    }

    public static SourceNode generator(SourceNode pattern, SourceNode enumerable) {
        return construct("generator", null, List.of(pattern, enumerable));
    }

    public static SourceNode capture(SourceNode expression) {
        return construct("capture", null, List.of(expression));
    }

    public static SourceNode placeholder(int index) {
        return construct("placeholder", (long) index, null);
    }

    public static SourceNode def(String name, SourceNode... clauses) {
        return construct("def", name, Arrays.asList(clauses));
    }

    public static SourceNode defp(String name, SourceNode... clauses) {
        return new SourceNode(Kind.CONSTRUCT, "defp", name, Arrays.asList(clauses), null);
    }

    public static SourceNode module(String name, SourceNode... body) {
        return construct("module", name, Arrays.asList(body));
    }

    public static SourceNode alias(String name) {
        return construct("alias", name, null);
    }

    public static SourceNode attribute(String name) {
        return construct("attribute", name, null);
    }

    /**
     * Returns a copy of this node carrying the given position.
     */
    public SourceNode at(int line, int column) {
        return new SourceNode(kind, tag, value, children, SourcePosition.of(line, column));
    }

    public SourceNode at(int line) {
        return new SourceNode(kind, tag, value, children, SourcePosition.of(line));
    }

    // ========== Accessors ==========

    public Kind getKind() {
        return kind;
    }

    public String getTag() {
        return tag;
    }

    public Object getValue() {
        return value;
    }

    public List<SourceNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public SourceNode child(int index) {
        return children.get(index);
    }

    @JsonIgnore
    public int childCount() {
        return children.size();
    }

    @JsonIgnore
    public SourcePosition getPosition() {
        return position;
    }

    @JsonProperty("line")
    Integer getLine() {
        return position != null ? position.getLine() : null;
    }

    @JsonProperty("column")
    Integer getColumn() {
        return position != null ? position.getColumn() : null;
    }

    @JsonIgnore
    public String getValueAsString() {
        return value != null ? value.toString() : null;
    }

    public boolean is(Kind expectedKind, String expectedTag) {
        return kind == expectedKind && tag.equals(expectedTag);
    }

    public boolean isConstruct(String constructTag) {
        return is(Kind.CONSTRUCT, constructTag);
    }

    @JsonIgnore
    public boolean isVariable() {
        return kind == Kind.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceNode that = (SourceNode) o;
        return kind == that.kind
                && tag.equals(that.tag)
                && Objects.equals(value, that.value)
                && children.equals(that.children)
                && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, tag, value, children, position);
    }

    @Override
    public String toString() {
        return "SourceNode{" + kind + " " + tag
                + (value != null ? " value=" + value : "")
                + (children.isEmpty() ? "" : " children=" + children.size())
                + "}";
    }
}
