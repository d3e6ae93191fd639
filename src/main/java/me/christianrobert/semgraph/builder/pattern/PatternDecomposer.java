package me.christianrobert.semgraph.builder.pattern;

import me.christianrobert.semgraph.builder.SegmentSpecifier;
import me.christianrobert.semgraph.builder.SemanticGraphBuilder;
import me.christianrobert.semgraph.builder.closure.ScopeFrame;
import me.christianrobert.semgraph.builder.closure.ScopeKind;
import me.christianrobert.semgraph.context.BuildContext;
import me.christianrobert.semgraph.context.BuildErrorKind;
import me.christianrobert.semgraph.context.GraphBuildException;
import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds graph nodes for patterns (function parameters, clause heads, match targets,
 * comprehension generators) and collects the symbols they bind.
 *
 * <p><strong>Variants:</strong></p>
 * <ul>
 *   <li>literal: the literal node plus the LiteralPattern tag, no binding</li>
 *   <li>{@code x}, {@code _x}: VariablePattern, binds (underscore names are marked ignored)</li>
 *   <li>{@code _}: WildcardPattern, no binding</li>
 *   <li>{@code ^x}: PinPattern, no binding</li>
 *   <li>tuple/list/map/struct/binary: compound patterns with the same child labels as the literals</li>
 *   <li>{@code [h | t]}: ListPattern with heads as elements and the tail at {@code self/tail}</li>
 *   <li>{@code p1 = p2}: AsPattern, binds both sides</li>
 *   <li>{@code p when g}: GuardedPattern, the guard sees only the bindings of {@code p}</li>
 * </ul>
 *
 * <p>A name may be bound only once within one top-level pattern; the second binding is
 * rejected as {@code malformed-pattern}. Forms that are valid expressions but not valid
 * patterns (calls, most operators, blocks) are rejected the same way. Shapes that are not
 * recognized at all become soft unknown-expression nodes.</p>
 */
public class PatternDecomposer {

    private final SemanticGraphBuilder builder;

    public PatternDecomposer(SemanticGraphBuilder builder) {
        this.builder = builder;
    }

    /**
     * Decomposes one top-level pattern.
     *
     * @param pattern Pattern source node
     * @param id Id for the root pattern node
     * @param depth Depth of this call
     * @return root id and bindings in source order
     */
    public PatternResult decompose(SourceNode pattern, String id, int depth) {
        List<Binding> bindings = new ArrayList<>();
        decompose(pattern, id, depth, bindings);

        Set<String> seen = new HashSet<>();
        for (Binding binding : bindings) {
            if (!seen.add(binding.getName())) {
                throw new GraphBuildException(BuildErrorKind.MALFORMED_PATTERN,
                        "Variable '" + binding.getName() + "' is bound more than once in one pattern",
                        pattern.getTag(), binding.getNodeId());
            }
        }
        return new PatternResult(id, bindings);
    }

    private String decompose(SourceNode pattern, String id, int depth, List<Binding> bindings) {
        BuildContext context = builder.getContext();
        context.checkDepth(depth, pattern, id);

        NodeShape shape = NodeShape.classify(pattern);
        switch (shape) {
            case INTEGER:
            case FLOAT:
            case STRING:
            case CHARLIST:
            case BOOLEAN:
            case NIL:
            case ATOM:
            case RANGE:
            case SIGIL:
            case MODULE_ATTRIBUTE:
                return literal(pattern, id, depth);
            case VARIABLE:
                return variable(pattern, id, bindings);
            case WILDCARD:
                context.newNode(id, NodeType.WILDCARD_PATTERN, pattern);
                return id;
            case PIN:
                return pin(pattern, id);
            case TUPLE:
            case LIST:
            case CONS:
                return sequence(pattern, shape, id, depth, bindings);
            case MAP:
            case STRUCT:
                return entries(pattern, shape, id, depth, bindings);
            case BINARY:
                return binary(pattern, id, depth, bindings);
            case GUARD:
                return guarded(pattern, id, depth, bindings);
            case UNARY_OPERATOR:
                if ("-".equals(pattern.getTag()) || "+".equals(pattern.getTag())) {
                    NodeShape operand = NodeShape.classify(pattern.child(0));
                    if (operand == NodeShape.INTEGER || operand == NodeShape.FLOAT) {
                        return literal(pattern, id, depth);
                    }
                }
                throw malformed(pattern, id, "Operator " + pattern.getTag() + " is not allowed in a pattern");
            case BINARY_OPERATOR:
                if ("=".equals(pattern.getTag())) {
                    return asPattern(pattern, id, depth, bindings);
                }
                if ("<>".equals(pattern.getTag())) {
                    return prefixPattern(pattern, id, depth, bindings);
                }
                throw malformed(pattern, id, "Operator " + pattern.getTag() + " is not allowed in a pattern");
            case UNKNOWN:
                return builder.build(pattern, id, depth);
            default:
                throw malformed(pattern, id, shape + " is not allowed in a pattern");
        }
    }

    private String literal(SourceNode pattern, String id, int depth) {
        builder.build(pattern, id, depth);
        builder.getContext().getNode(id).addAuxiliaryType(NodeType.LITERAL_PATTERN);
        return id;
    }

    private String variable(SourceNode pattern, String id, List<Binding> bindings) {
        String name = pattern.getTag();
        GraphNode node = builder.getContext().newNode(id, NodeType.VARIABLE_PATTERN, pattern)
                .setProperty(Properties.NAME, name);
        if (name.startsWith("_")) {
            node.setProperty(Properties.IGNORED, true);
        }
        bindings.add(new Binding(name, id, pattern.getPosition()));
        return id;
    }

    private String pin(SourceNode pattern, String id) {
        SourceNode pinned = pattern.child(0);
        if (NodeShape.classify(pinned) != NodeShape.VARIABLE) {
            throw malformed(pattern, id, "Only variables can be pinned, found " + pinned.getTag());
        }
        builder.getContext().newNode(id, NodeType.PIN_PATTERN, pattern)
                .setProperty(Properties.PINNED_NAME, pinned.getTag());
        return id;
    }

    private String sequence(SourceNode pattern, NodeShape shape, String id, int depth, List<Binding> bindings) {
        List<SourceNode> elements = pattern.getChildren();
        builder.getContext().checkFanOut(elements.size(), pattern, id);

        NodeType type = shape == NodeShape.TUPLE ? NodeType.TUPLE_PATTERN : NodeType.LIST_PATTERN;
        GraphNode node = builder.getContext().newNode(id, type, pattern);

        if (shape == NodeShape.CONS) {
            // Bare cons cell: [head | tail]
            node.setProperty(Properties.SIZE, 1);
            node.addRelation(Relations.ELEMENT,
                    decompose(pattern.child(0), NodeAddress.of(id, "elements", 0), depth + 1, bindings));
            node.addRelation(Relations.TAIL, decompose(pattern.child(1), NodeAddress.of(id, "tail"), depth + 1, bindings));
            return id;
        }

        node.setProperty(Properties.SIZE, elements.size());
        for (int i = 0; i < elements.size(); i++) {
            SourceNode element = elements.get(i);
            String elementId = NodeAddress.of(id, "elements", i);
            boolean trailingCons = shape == NodeShape.LIST && i == elements.size() - 1
                    && NodeShape.classify(element) == NodeShape.CONS;
            if (trailingCons) {
                node.addRelation(Relations.ELEMENT, decompose(element.child(0), elementId, depth + 1, bindings));
                node.addRelation(Relations.TAIL,
                        decompose(element.child(1), NodeAddress.of(id, "tail"), depth + 1, bindings));
            } else {
                node.addRelation(Relations.ELEMENT, decompose(element, elementId, depth + 1, bindings));
            }
        }
        return id;
    }

    private String entries(SourceNode pattern, NodeShape shape, String id, int depth, List<Binding> bindings) {
        List<SourceNode> entries = pattern.getChildren();
        BuildContext context = builder.getContext();
        context.checkFanOut(entries.size(), pattern, id);

        GraphNode node;
        if (shape == NodeShape.STRUCT) {
            String typeName = pattern.getValueAsString();
            node = context.newNode(id, NodeType.STRUCT_PATTERN, pattern);
            if ("_".equals(typeName)) {
                // %_{} matches any struct
                node.setProperty(Properties.ANY_STRUCT, true);
            } else {
                node.setProperty(Properties.NAME, typeName);
                String typeId = NodeAddress.of(id, "type");
                context.newNode(typeId, NodeType.TYPE_REFERENCE).setProperty(Properties.NAME, typeName);
                node.addRelation(Relations.REFERENCED_TYPE, typeId);
            }
        } else {
            node = context.newNode(id, NodeType.MAP_PATTERN, pattern);
        }
        node.setProperty(Properties.SIZE, entries.size());

        for (int i = 0; i < entries.size(); i++) {
            String entryId = NodeAddress.of(id, "entries", i);
            node.addRelation(Relations.ENTRY, entry(entries.get(i), entryId, depth + 1, bindings));
        }
        return id;
    }

    // Keys are matched by value and never bind; values are patterns
    private String entry(SourceNode entry, String entryId, int depth, List<Binding> bindings) {
        BuildContext context = builder.getContext();
        context.checkDepth(depth, entry, entryId);
        String keyId = NodeAddress.of(entryId, "key");
        String valueId = NodeAddress.of(entryId, "value");

        if (entry.isConstruct("kw_entry") && entry.childCount() == 1 && entry.getValue() != null) {
            GraphNode node = context.newNode(entryId, NodeType.MAP_ENTRY, entry)
                    .setProperty(Properties.KEYWORD_KEY, true);
            context.newNode(keyId, NodeType.ATOM_LITERAL)
                    .addAuxiliaryType(NodeType.LITERAL_PATTERN)
                    .setProperty(Properties.ATOM_VALUE, ":" + entry.getValueAsString())
                    .setProperty(Properties.KEYWORD_KEY, true);
            node.addRelation(Relations.KEY, keyId);
            node.addRelation(Relations.VALUE, decompose(entry.child(0), valueId, depth + 1, bindings));
            return entryId;
        }
        if (entry.isConstruct("entry") && entry.childCount() == 2) {
            GraphNode node = context.newNode(entryId, NodeType.MAP_ENTRY, entry)
                    .setProperty(Properties.KEYWORD_KEY, false);
            SourceNode key = entry.child(0);
            if (NodeShape.classify(key) == NodeShape.VARIABLE) {
                throw malformed(key, keyId, "Map keys cannot bind variables, pin '" + key.getTag() + "' instead");
            }
            List<Binding> keyBindings = new ArrayList<>();
            node.addRelation(Relations.KEY, decompose(key, keyId, depth + 1, keyBindings));
            if (!keyBindings.isEmpty()) {
                throw malformed(key, keyId, "Map keys cannot bind variables, found '"
                        + keyBindings.get(0).getName() + "' in key");
            }
            node.addRelation(Relations.VALUE, decompose(entry.child(1), valueId, depth + 1, bindings));
            return entryId;
        }
        throw malformed(entry, entryId, "Map pattern entry expected, found " + entry.getTag());
    }

    private String binary(SourceNode pattern, String id, int depth, List<Binding> bindings) {
        List<SourceNode> segments = pattern.getChildren();
        BuildContext context = builder.getContext();
        context.checkFanOut(segments.size(), pattern, id);

        GraphNode node = context.newNode(id, NodeType.BINARY_PATTERN, pattern)
                .setProperty(Properties.SIZE, segments.size());
        for (int i = 0; i < segments.size(); i++) {
            SourceNode segment = segments.get(i);
            String segmentId = NodeAddress.of(id, "segments", i);
            GraphNode segmentNode = context.newNode(segmentId, NodeType.BINARY_SEGMENT, segment);
            String valueId = NodeAddress.of(segmentId, "value");
            if (segment.isConstruct("segment") && segment.childCount() == 2) {
                segmentNode.addRelation(Relations.VALUE, decompose(segment.child(0), valueId, depth + 2, bindings));
                segmentNode.setProperty(Properties.SPECIFIER, SegmentSpecifier.render(segment.child(1)));
            } else {
                segmentNode.addRelation(Relations.VALUE, decompose(segment, valueId, depth + 2, bindings));
            }
            node.addRelation(Relations.SEGMENT, segmentId);
        }
        return id;
    }

    private String asPattern(SourceNode pattern, String id, int depth, List<Binding> bindings) {
        GraphNode node = builder.getContext().newNode(id, NodeType.AS_PATTERN, pattern);
        SourceNode left = pattern.child(0);
        SourceNode right = pattern.child(1);
        if (NodeShape.classify(left) == NodeShape.VARIABLE) {
            node.setProperty(Properties.ALIAS, left.getTag());
        } else if (NodeShape.classify(right) == NodeShape.VARIABLE) {
            node.setProperty(Properties.ALIAS, right.getTag());
        }
        node.addRelation(Relations.INNER_PATTERN, decompose(left, NodeAddress.of(id, "left"), depth + 1, bindings));
        node.addRelation(Relations.INNER_PATTERN, decompose(right, NodeAddress.of(id, "right"), depth + 1, bindings));
        return id;
    }

    // "prefix" <> rest
    private String prefixPattern(SourceNode pattern, String id, int depth, List<Binding> bindings) {
        SourceNode prefix = pattern.child(0);
        if (NodeShape.classify(prefix) != NodeShape.STRING) {
            throw malformed(pattern, id, "Left side of <> in a pattern must be a string literal");
        }
        GraphNode node = builder.getContext().newNode(id, NodeType.BINARY_PATTERN, pattern)
                .setProperty(Properties.OPERATOR_SYMBOL, "<>");
        node.addRelation(Relations.LEFT_OPERAND, literal(prefix, NodeAddress.of(id, "left"), depth + 1));
        node.addRelation(Relations.RIGHT_OPERAND,
                decompose(pattern.child(1), NodeAddress.of(id, "right"), depth + 1, bindings));
        return id;
    }

    private String guarded(SourceNode pattern, String id, int depth, List<Binding> bindings) {
        GraphNode node = builder.getContext().newNode(id, NodeType.GUARDED_PATTERN, pattern);

        List<Binding> own = new ArrayList<>();
        node.addRelation(Relations.PATTERN, decompose(pattern.child(0), NodeAddress.of(id, "pattern"), depth + 1, own));
        bindings.addAll(own);

        ScopeFrame frame = builder.pushScope(ScopeKind.BLOCK, "when", id);
        try {
            for (Binding binding : own) {
                frame.bind(binding.getName());
            }
            node.addRelation(Relations.GUARD, builder.build(pattern.child(1), NodeAddress.of(id, "guard"), depth + 1));
        } finally {
            builder.popScope();
        }
        return id;
    }

    private static GraphBuildException malformed(SourceNode pattern, String id, String message) {
        return new GraphBuildException(BuildErrorKind.MALFORMED_PATTERN, message, pattern.getTag(), id);
    }
}
