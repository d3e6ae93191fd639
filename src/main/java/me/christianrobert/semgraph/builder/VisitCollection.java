package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.List;

/**
 * Lists, tuples, maps and structs.
 *
 * <p>Elements live at {@code self/elements/i}, entries at {@code self/entries/i} with their
 * key and value at {@code entry/key} and {@code entry/value}. A list whose last element is a
 * cons cell ({@code [a, b | rest]}) gets the cell's head as its last element and the tail at
 * {@code self/tail}.</p>
 */
public class VisitCollection {

  public static String sequence(SourceNode node, NodeShape shape, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> elements = node.getChildren();
    b.getContext().checkFanOut(elements.size(), node, id);

    NodeType type = shape == NodeShape.TUPLE ? NodeType.TUPLE_LITERAL : NodeType.LIST_LITERAL;
    GraphNode self = b.getContext().newNode(id, type, node);
    self.setProperty(Properties.SIZE, elements.size());

    for (int i = 0; i < elements.size(); i++) {
      SourceNode element = elements.get(i);
      String elementId = NodeAddress.of(id, "elements", i);
      boolean trailingCons = shape == NodeShape.LIST && i == elements.size() - 1
          && NodeShape.classify(element) == NodeShape.CONS;
      if (trailingCons) {
        self.addRelation(Relations.ELEMENT, b.build(element.child(0), elementId, depth + 1));
        self.addRelation(Relations.TAIL, b.build(element.child(1), NodeAddress.of(id, "tail"), depth + 1));
      } else {
        self.addRelation(Relations.ELEMENT, b.build(element, elementId, depth + 1));
      }
    }
    return id;
  }

  public static String entries(SourceNode node, NodeShape shape, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> entries = node.getChildren();
    b.getContext().checkFanOut(entries.size(), node, id);

    GraphNode self;
    if (shape == NodeShape.STRUCT) {
      self = b.getContext().newNode(id, NodeType.STRUCT_LITERAL, node);
      self.setProperty(Properties.NAME, node.getValueAsString());
      String typeId = NodeAddress.of(id, "type");
      b.getContext().newNode(typeId, NodeType.TYPE_REFERENCE)
          .setProperty(Properties.NAME, node.getValueAsString());
      self.addRelation(Relations.REFERENCED_TYPE, typeId);
    } else {
      self = b.getContext().newNode(id, NodeType.MAP_LITERAL, node);
    }
    self.setProperty(Properties.SIZE, entries.size());

    for (int i = 0; i < entries.size(); i++) {
      String entryId = NodeAddress.of(id, "entries", i);
      self.addRelation(Relations.ENTRY, entry(entries.get(i), entryId, depth + 1, b));
    }
    return id;
  }

  private static String entry(SourceNode entry, String entryId, int depth, SemanticGraphBuilder b) {
    if (entry.isConstruct("kw_entry") && entry.childCount() == 1 && entry.getValue() != null) {
      GraphNode self = b.getContext().newNode(entryId, NodeType.MAP_ENTRY, entry);
      self.setProperty(Properties.KEYWORD_KEY, true);
      String keyId = NodeAddress.of(entryId, "key");
      VisitLiteral.atom(entry.getValueAsString(), keyId, b).setProperty(Properties.KEYWORD_KEY, true);
      self.addRelation(Relations.KEY, keyId);
      self.addRelation(Relations.VALUE, b.build(entry.child(0), NodeAddress.of(entryId, "value"), depth + 1));
      return entryId;
    }
    if (entry.isConstruct("entry") && entry.childCount() == 2) {
      GraphNode self = b.getContext().newNode(entryId, NodeType.MAP_ENTRY, entry);
      self.setProperty(Properties.KEYWORD_KEY, false);
      self.addRelation(Relations.KEY, b.build(entry.child(0), NodeAddress.of(entryId, "key"), depth + 1));
      self.addRelation(Relations.VALUE, b.build(entry.child(1), NodeAddress.of(entryId, "value"), depth + 1));
      return entryId;
    }
    return VisitUnknown.v(entry, entryId, "Map entry expected", b);
  }
}
