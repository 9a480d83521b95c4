package org.dxworks.blockframe.analyzer.markdown;

import java.util.List;
import java.util.Objects;

/**
 * Parser-independent view of a markdown block node: its kind, its 1-indexed inclusive
 * source line range and its block children in document order.
 * A node without a textual footprint carries {@code startLine == 0}.
 */
public record SourceNode(NodeKind kind, int startLine, int endLine, List<SourceNode> children) {

    public SourceNode {
        Objects.requireNonNull(kind, "kind");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static SourceNode leaf(NodeKind kind, int startLine, int endLine) {
        return new SourceNode(kind, startLine, endLine, List.of());
    }

    public static SourceNode container(NodeKind kind, int startLine, int endLine, SourceNode... children) {
        return new SourceNode(kind, startLine, endLine, List.of(children));
    }

    public boolean hasDegenerateRange() {
        return startLine == 0 || endLine < startLine;
    }
}
