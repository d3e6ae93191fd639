package me.christianrobert.semgraph.graph;

import me.christianrobert.semgraph.source.SourcePosition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphNodeTest {

    @Test
    void primaryTypeIsNeverAlsoAuxiliary() {
        GraphNode node = new GraphNode("expr/0", NodeType.ARITHMETIC_OPERATOR);
        node.addAuxiliaryType(NodeType.ARITHMETIC_OPERATOR);
        node.addAuxiliaryType(NodeType.UNARY_OPERATOR);

        assertEquals(NodeType.ARITHMETIC_OPERATOR, node.getPrimaryType());
        assertEquals(1, node.getAuxiliaryTypes().size());
        assertTrue(node.hasType(NodeType.UNARY_OPERATOR));
        assertTrue(node.hasType(NodeType.ARITHMETIC_OPERATOR));
    }

    @Test
    void propertiesAreNormalizedToLongAndDouble() {
        GraphNode node = new GraphNode("expr/0", NodeType.INTEGER_LITERAL)
                .setProperty("a", 5)
                .setProperty("b", 1.5f)
                .setProperty("c", 'x')
                .setProperty("d", null);

        assertEquals(5L, node.getProperty("a"));
        assertEquals(1.5d, node.getProperty("b"));
        assertEquals("x", node.getProperty("c"));
        assertFalse(node.getProperties().containsKey("d"));
    }

    @Test
    void nonScalarPropertyIsRejected() {
        GraphNode node = new GraphNode("expr/0", NodeType.LIST_LITERAL);
        assertThrows(IllegalArgumentException.class, () -> node.setProperty("items", List.of(1, 2)));
    }

    @Test
    void relationsKeepInsertionOrder() {
        GraphNode node = new GraphNode("expr/0", NodeType.LIST_LITERAL)
                .addRelation(Relations.ELEMENT, "expr/0/elements/1")
                .addRelation(Relations.ELEMENT, "expr/0/elements/0");

        assertEquals(List.of("expr/0/elements/1", "expr/0/elements/0"), node.getRelation(Relations.ELEMENT));
        assertTrue(node.getRelation(Relations.TAIL).isEmpty());
        assertNull(node.getSingleRelation(Relations.TAIL));
        assertThrows(IllegalStateException.class, () -> node.getSingleRelation(Relations.ELEMENT));
    }

    @Test
    void positionWithoutColumnSetsOnlyLine() {
        GraphNode node = new GraphNode("expr/0", NodeType.VARIABLE).setPosition(SourcePosition.of(12));

        assertEquals(12L, node.getProperty(Properties.START_LINE));
        assertNull(node.getProperty(Properties.START_COLUMN));
    }
}
