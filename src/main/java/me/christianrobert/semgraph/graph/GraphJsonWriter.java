package me.christianrobert.semgraph.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes graph node lists to JSON for bulk loading into a graph store or schema validator.
 *
 * <p>Output format (one object per node, sorted by id so repeated builds diff cleanly):</p>
 * <pre>
 * {
 *   "rootId": "expr/0",
 *   "nodeCount": 3,
 *   "nodes": [
 *     {"id": "expr/0", "primaryType": "LogicalOperator", "auxiliaryTypes": [],
 *      "properties": {"operatorSymbol": "and"},
 *      "relations": {"leftOperand": ["expr/0/left"], "rightOperand": ["expr/0/right"]}},
 *     ...
 *   ]
 * }
 * </pre>
 */
@ApplicationScoped
public class GraphJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(GraphJsonWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * Builds the JSON tree for a node collection.
     *
     * @param rootId Root node id of the build (may be null for pattern-only output)
     * @param nodes Nodes to serialize
     * @return JSON object with rootId, nodeCount and the sorted node array
     */
    public ObjectNode toJsonTree(String rootId, Collection<GraphNode> nodes) {
        ObjectNode document = objectMapper.createObjectNode();
        if (rootId != null) {
            document.put("rootId", rootId);
        }
        document.put("nodeCount", nodes.size());

        ArrayNode array = document.putArray("nodes");
        for (GraphNode node : sorted(nodes)) {
            array.add(objectMapper.valueToTree(node));
        }
        return document;
    }

    /**
     * Serializes a node collection to a JSON string.
     *
     * @throws GraphSerializationException if Jackson fails to write the document
     */
    public String toJson(String rootId, Collection<GraphNode> nodes) {
        try {
            return objectMapper.writeValueAsString(toJsonTree(rootId, nodes));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} graph nodes for root {}", nodes.size(), rootId, e);
            throw new GraphSerializationException("Failed to serialize graph for root " + rootId, e);
        }
    }

    /**
     * Serializes a failed build as {@code {"success": false, "errorCode": ..., "errorMessage": ...}}.
     */
    public String toFailureJson(String errorCode, String errorMessage) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("success", false);
        document.put("errorCode", errorCode);
        document.put("errorMessage", errorMessage);
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new GraphSerializationException("Failed to serialize failure document", e);
        }
    }

    /**
     * Streams a node collection as JSON to the given writer.
     */
    public void write(String rootId, Collection<GraphNode> nodes, Writer writer) throws IOException {
        log.debug("Writing {} graph nodes for root {}", nodes.size(), rootId);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(writer, toJsonTree(rootId, nodes));
    }

    private static List<GraphNode> sorted(Collection<GraphNode> nodes) {
        return nodes.stream()
                .sorted(Comparator.comparing(GraphNode::getId))
                .collect(Collectors.toList());
    }

    /**
     * Raised when a graph cannot be written as JSON.
     */
    public static class GraphSerializationException extends RuntimeException {
        public GraphSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
