package me.christianrobert.semgraph.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceNodeJsonTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
    }

    @Test
    void readsTreeWithPositionsAndNormalizedNumbers() throws Exception {
        String json = "{\"kind\":\"OPERATOR\",\"tag\":\"+\",\"children\":["
                + "{\"kind\":\"VARIABLE\",\"tag\":\"x\",\"line\":3,\"column\":7},"
                + "{\"kind\":\"LITERAL\",\"tag\":\"integer\",\"value\":1}]}";

        SourceNode node = mapper.readValue(json, SourceNode.class);

        assertEquals(SourceNode.Kind.OPERATOR, node.getKind());
        assertEquals(2, node.childCount());
        assertEquals(SourcePosition.of(3, 7), node.child(0).getPosition());
        assertEquals(1L, node.child(1).getValue());
        assertEquals(NodeShape.BINARY_OPERATOR, NodeShape.classify(node));
    }

    @Test
    void readsIntegerBeyondSixtyFourBitsAsDecimalString() throws Exception {
        String json = "{\"kind\":\"LITERAL\",\"tag\":\"integer\",\"value\":123456789012345678901234567890}";

        SourceNode node = mapper.readValue(json, SourceNode.class);

        assertEquals("123456789012345678901234567890", node.getValue());
        assertEquals(NodeShape.INTEGER, NodeShape.classify(node));
    }

    @Test
    void nonNumericIntegerValueIsUnknown() {
        SourceNode node = new SourceNode(SourceNode.Kind.LITERAL, "integer", "12a", null, null);

        assertEquals(NodeShape.UNKNOWN, NodeShape.classify(node));
    }

    @Test
    void writesAndReadsBackEqualTree() throws Exception {
        SourceNode original = SourceNode.op("and",
                SourceNode.op(">", SourceNode.var("x").at(1, 1), SourceNode.integer(5)),
                SourceNode.remoteCall("Enum", "empty?", SourceNode.var("xs")));

        SourceNode copy = mapper.readValue(mapper.writeValueAsString(original), SourceNode.class);

        assertEquals(original, copy);
    }
}
