package me.christianrobert.semgraph.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import me.christianrobert.semgraph.source.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One node of the semantic graph.
 *
 * <p>A node has a stable id, exactly one primary type, optional auxiliary types,
 * scalar properties and named relations to other node ids. Relations keep insertion
 * order so ordered children (elements, arguments, clauses) stay ordered.</p>
 *
 * <p>Nodes are filled in by the builders while a construct is being built and handed
 * to the caller afterwards; they are not shared between builds.</p>
 */
@JsonPropertyOrder({"id", "primaryType", "auxiliaryTypes", "properties", "relations"})
public class GraphNode {

    private final String id;
    private final NodeType primaryType;
    private final Set<NodeType> auxiliaryTypes = new LinkedHashSet<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Map<String, List<String>> relations = new LinkedHashMap<>();

    public GraphNode(String id, NodeType primaryType) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Graph node id cannot be null or empty");
        }
        if (primaryType == null) {
            throw new IllegalArgumentException("Graph node primary type cannot be null");
        }
        this.id = id;
        this.primaryType = primaryType;
    }

    public String getId() {
        return id;
    }

    public NodeType getPrimaryType() {
        return primaryType;
    }

    public Set<NodeType> getAuxiliaryTypes() {
        return Collections.unmodifiableSet(auxiliaryTypes);
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Map<String, List<String>> getRelations() {
        return Collections.unmodifiableMap(relations);
    }

    /**
     * Adds an auxiliary type. The primary type is never duplicated as auxiliary.
     */
    public GraphNode addAuxiliaryType(NodeType type) {
        if (type != null && type != primaryType) {
            auxiliaryTypes.add(type);
        }
        return this;
    }

    public boolean hasType(NodeType type) {
        return primaryType == type || auxiliaryTypes.contains(type);
    }

    /**
     * Sets a scalar property. Null values are ignored; integral numbers are stored as Long,
     * floating point numbers as Double.
     */
    public GraphNode setProperty(String name, Object value) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Property name cannot be null or empty");
        }
        if (value == null) {
            return this;
        }
        properties.put(name, toScalar(name, value));
        return this;
    }

    private static Object toScalar(String name, Object value) {
        if (value instanceof String || value instanceof Boolean || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof Character || value instanceof Enum) {
            return value.toString();
        }
        throw new IllegalArgumentException(
                "Property '" + name + "' must be a scalar, got " + value.getClass().getSimpleName());
    }

    public Object getProperty(String name) {
        return properties.get(name);
    }

    public String getStringProperty(String name) {
        Object value = properties.get(name);
        return value != null ? value.toString() : null;
    }

    /**
     * Copies line/column into the standard position properties when present.
     */
    public GraphNode setPosition(SourcePosition position) {
        if (position != null) {
            setProperty(Properties.START_LINE, position.getLine());
            setProperty(Properties.START_COLUMN, position.getColumn());
        }
        return this;
    }

    /**
     * Appends a related node id to the named relation.
     */
    public GraphNode addRelation(String name, String targetId) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Relation name cannot be null or empty");
        }
        if (targetId == null || targetId.isEmpty()) {
            throw new IllegalArgumentException("Relation target cannot be null or empty (relation " + name + ")");
        }
        relations.computeIfAbsent(name, k -> new ArrayList<>()).add(targetId);
        return this;
    }

    /**
     * Related ids for the relation, empty when the relation is absent.
     */
    public List<String> getRelation(String name) {
        List<String> targets = relations.get(name);
        return targets != null ? Collections.unmodifiableList(targets) : Collections.emptyList();
    }

    /**
     * Single related id, or null when absent.
     */
    public String getSingleRelation(String name) {
        List<String> targets = relations.get(name);
        if (targets == null || targets.isEmpty()) {
            return null;
        }
        if (targets.size() > 1) {
            throw new IllegalStateException("Relation " + name + " on " + id + " has " + targets.size() + " targets");
        }
        return targets.get(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return id.equals(that.id)
                && primaryType == that.primaryType
                && auxiliaryTypes.equals(that.auxiliaryTypes)
                && properties.equals(that.properties)
                && relations.equals(that.relations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, primaryType, auxiliaryTypes, properties, relations);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
                "id='" + id + '\'' +
                ", type=" + primaryType +
                (auxiliaryTypes.isEmpty() ? "" : ", aux=" + auxiliaryTypes) +
                ", properties=" + properties +
                ", relations=" + relations +
                '}';
    }
}
