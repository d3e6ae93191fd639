package me.christianrobert.semgraph.builder;

import me.christianrobert.semgraph.source.SourceNode;

import java.util.StringJoiner;

/**
 * Renders a binary segment specifier ({@code binary}, {@code size(8)}, {@code integer-little-size(16)})
 * back into its written form.
 */
public final class SegmentSpecifier {

  private SegmentSpecifier() {
  }

  public static String render(SourceNode specifier) {
    switch (specifier.getKind()) {
      case VARIABLE:
        return specifier.getTag();
      case LITERAL:
        return specifier.getValueAsString();
      case CALL: {
        StringJoiner args = new StringJoiner(", ", specifier.getTag() + "(", ")");
        for (SourceNode arg : specifier.getChildren()) {
          args.add(render(arg));
        }
        return args.toString();
      }
      case OPERATOR:
        if (specifier.childCount() == 2) {
          return render(specifier.child(0)) + specifier.getTag() + render(specifier.child(1));
        }
        if (specifier.childCount() == 1) {
          return specifier.getTag() + render(specifier.child(0));
        }
        return specifier.getTag();
      case CONSTRUCT:
      default:
        if (specifier.isConstruct("pin") && specifier.childCount() == 1) {
          return "^" + render(specifier.child(0));
        }
        return specifier.getTag();
    }
  }
}
