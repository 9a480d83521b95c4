package org.dxworks.blockframe.analyzer.markdown.segment;

import org.dxworks.blockframe.analyzer.markdown.NodeKind;
import org.dxworks.blockframe.analyzer.markdown.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a document tree into atoms sorted by line range.
 * <ul>
 *   <li>containers (document, list, list item, block quote) are transparent;</li>
 *   <li>complex nodes (tables, code, math, html, breaks, footnotes, front matter) become one atom;</li>
 *   <li>multi-line paragraphs and headings are split into {@code line} atoms by {@link MathLineSplitter}.</li>
 * </ul>
 */
public final class AtomCollector {

    private AtomCollector() {}

    public static List<AtomNode> collect(SourceNode root, SourceLines lines) {
        List<AtomNode> atoms = new ArrayList<>();
        visit(root, lines, atoms);
        // depth-first order is not line order across every sibling branch
        atoms.sort(AtomNode.BY_RANGE);
        return atoms;
    }

    private static void visit(SourceNode node, SourceLines lines, List<AtomNode> atoms) {
        NodeKind kind = node.kind();
        if (kind.isContainer()) {
            for (SourceNode child : node.children()) {
                visit(child, lines, atoms);
            }
            return;
        }

        if (node.hasDegenerateRange()) {
            return;
        }

        int start = node.startLine();
        int end = node.endLine();
        if (!kind.isComplex() && kind.isTextBlock() && end > start) {
            for (LineRange range : MathLineSplitter.split(start, end, lines)) {
                atoms.add(AtomNode.line(range));
            }
            return;
        }
        atoms.add(new AtomNode(kind.getAtomType(), start, end));
    }
}
