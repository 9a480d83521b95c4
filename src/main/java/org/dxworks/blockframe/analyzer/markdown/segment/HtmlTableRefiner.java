package org.dxworks.blockframe.analyzer.markdown.segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Separates embedded {@code <table>...</table>} regions of raw HTML atoms from the content around them.
 * Content before a table and table-free content after it is re-split into {@code line} atoms.
 */
public final class HtmlTableRefiner {

    private HtmlTableRefiner() {}

    public static List<AtomNode> refine(List<AtomNode> atoms, SourceLines lines) {
        List<AtomNode> refined = new ArrayList<>(atoms.size());
        for (AtomNode atom : atoms) {
            if (atom.type() != AtomType.HTML) {
                refined.add(atom);
                continue;
            }
            List<String> atomLines = lines.slice(atom.startLine(), atom.endLine());
            if (!HtmlTables.containsTableMarkup(String.join("\n", atomLines))) {
                refined.add(atom);
                continue;
            }
            splitAroundTables(atom, atomLines, lines, refined);
        }
        return refined;
    }

    private static void splitAroundTables(AtomNode atom, List<String> atomLines, SourceLines lines,
                                          List<AtomNode> out) {
        int base = atom.startLine();
        int lastOffset = atomLines.size() - 1;
        // offset of the first line not yet emitted, relative to the atom
        int regionStart = 0;

        for (int k = 0; k < atomLines.size(); k++) {
            String line = atomLines.get(k);

            if (k > regionStart && HtmlTables.isOpening(line.strip())) {
                addLineAtoms(base + regionStart, base + k - 1, lines, out);
                regionStart = k;
            }

            // a closing tag on the atom's last line is left to the remainder below
            if (HtmlTables.containsClosing(line) && k < lastOffset) {
                out.add(new AtomNode(AtomType.HTML, base + regionStart, base + k));
                regionStart = k + 1;
            }
        }

        int remainderStart = base + regionStart;
        if (remainderStart > atom.endLine()) {
            return;
        }
        String remainder = String.join("\n", atomLines.subList(regionStart, atomLines.size()));
        if (HtmlTables.containsTableMarkup(remainder)) {
            out.add(new AtomNode(AtomType.HTML, remainderStart, atom.endLine()));
        } else {
            addLineAtoms(remainderStart, atom.endLine(), lines, out);
        }
    }

    private static void addLineAtoms(int startLine, int endLine, SourceLines lines, List<AtomNode> out) {
        for (LineRange range : MathLineSplitter.split(startLine, endLine, lines)) {
            out.add(AtomNode.line(range));
        }
    }
}
