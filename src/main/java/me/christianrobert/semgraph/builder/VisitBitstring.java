package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.graph.GraphNode;
import me.christianrobert.semgraph.graph.NodeAddress;
import me.christianrobert.semgraph.graph.NodeType;
import me.christianrobert.semgraph.graph.Properties;
import me.christianrobert.semgraph.graph.Relations;
import me.christianrobert.semgraph.source.NodeShape;
import me.christianrobert.semgraph.source.SourceNode;

import java.util.Base64;
import java.util.List;

/**
 * Binaries {@code <<...>>}.
 *
 * <p>When every segment is a plain integer literal in 0..255 the binary is a constant and
 * becomes a BinaryLiteral with the bytes base64 encoded. Anything else is a
 * BitstringConstruction with one BinarySegment per segment at {@code self/segments/i}.</p>
 */
public class VisitBitstring {
  public static String v(SourceNode node, String id, int depth, SemanticGraphBuilder b) {
    List<SourceNode> segments = node.getChildren();
    b.getContext().checkFanOut(segments.size(), node, id);

    byte[] bytes = constantBytes(segments);
    if (bytes != null) {
      b.getContext().newNode(id, NodeType.BINARY_LITERAL, node)
          .setProperty(Properties.BINARY_VALUE, Base64.getEncoder().encodeToString(bytes))
          .setProperty(Properties.SIZE, bytes.length);
      return id;
    }

    GraphNode self = b.getContext().newNode(id, NodeType.BITSTRING_CONSTRUCTION, node);
    self.setProperty(Properties.SIZE, segments.size());
    for (int i = 0; i < segments.size(); i++) {
      String segmentId = NodeAddress.of(id, "segments", i);
      self.addRelation(Relations.SEGMENT, segment(segments.get(i), segmentId, depth + 1, b));
    }
    return id;
  }

  private static String segment(SourceNode segment, String segmentId, int depth, SemanticGraphBuilder b) {
    GraphNode self = b.getContext().newNode(segmentId, NodeType.BINARY_SEGMENT, segment);
    String valueId = NodeAddress.of(segmentId, "value");
    if (segment.isConstruct("segment") && segment.childCount() == 2) {
      self.addRelation(Relations.VALUE, b.build(segment.child(0), valueId, depth + 1));
      self.setProperty(Properties.SPECIFIER, SegmentSpecifier.render(segment.child(1)));
    } else {
      self.addRelation(Relations.VALUE, b.build(segment, valueId, depth + 1));
    }
    return segmentId;
  }

  private static byte[] constantBytes(List<SourceNode> segments) {
    byte[] bytes = new byte[segments.size()];
    for (int i = 0; i < segments.size(); i++) {
      SourceNode segment = segments.get(i);
      if (NodeShape.classify(segment) != NodeShape.INTEGER || !(segment.getValue() instanceof Long)) {
        return null;
      }
      long value = (Long) segment.getValue();
      if (value < 0 || value > 255) {
        return null;
      }
      bytes[i] = (byte) value;
    }
    return bytes;
  }
}
