package org.dxworks.blockframe.analyzer.markdown.segment;

import java.util.Comparator;

/**
 * Intermediate, line-ranged classification unit. Lines are 1-indexed and inclusive.
 */
public record AtomNode(AtomType type, int startLine, int endLine) {

    public static final Comparator<AtomNode> BY_RANGE =
            Comparator.comparingInt(AtomNode::startLine).thenComparingInt(AtomNode::endLine);

    public static AtomNode line(LineRange range) {
        return new AtomNode(AtomType.LINE, range.startLine(), range.endLine());
    }
}
