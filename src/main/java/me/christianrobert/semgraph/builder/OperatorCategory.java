package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.NodeType;

import java.util.Set;

/**
 * Operator categories and the node type each one produces.
 */
public enum OperatorCategory {

    ARITHMETIC(NodeType.ARITHMETIC_OPERATOR, Set.of("+", "-", "*", "/", "div", "rem")),
    COMPARISON(NodeType.COMPARISON_OPERATOR, Set.of("==", "!=", "===", "!==", "<", ">", "<=", ">=")),
    LOGICAL(NodeType.LOGICAL_OPERATOR, Set.of("and", "or", "&&", "||", "not", "!")),
    PIPE(NodeType.PIPE_OPERATOR, Set.of("|>")),
    MATCH(NodeType.MATCH_OPERATOR, Set.of("=")),
    LIST(NodeType.LIST_OPERATOR, Set.of("++", "--")),
    CONCAT(NodeType.STRING_CONCAT_OPERATOR, Set.of("<>"));

    private final NodeType nodeType;
    private final Set<String> symbols;

    OperatorCategory(NodeType nodeType, Set<String> symbols) {
        this.nodeType = nodeType;
        this.symbols = symbols;
    }

    public NodeType getNodeType() {
        return nodeType;
    }

    /**
     * Category of an operator symbol, null for symbols outside every category.
     */
    public static OperatorCategory of(String symbol) {
        for (OperatorCategory category : values()) {
            if (category.symbols.contains(symbol)) {
                return category;
            }
        }
        return null;
    }
}
