package org.dxworks.blockframe.analyzer.markdown.segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Coalesces consecutive {@code html} atoms that the parser reported separately but which form one table,
 * e.g. a {@code <table>} whose rows are interrupted by a blank line.
 */
public final class HtmlTableMerger {

    /** Largest distance from the previous atom's end at which the next atom still continues the table. */
    static final int MAX_LINE_DISTANCE = 2;

    private HtmlTableMerger() {}

    public static List<AtomNode> merge(List<AtomNode> atoms, SourceLines lines) {
        List<AtomNode> merged = new ArrayList<>(atoms.size());
        int i = 0;
        while (i < atoms.size()) {
            AtomNode atom = atoms.get(i);
            if (atom.type() == AtomType.HTML) {
                String content = lines.join(atom.startLine(), atom.endLine());
                if (HtmlTables.isOpening(content.strip())) {
                    int lastLine = atom.endLine();
                    boolean closed = HtmlTables.containsClosing(content);
                    int j = i + 1;
                    while (!closed && j < atoms.size() && continuesTable(atoms.get(j), lastLine)) {
                        AtomNode next = atoms.get(j);
                        lastLine = next.endLine();
                        closed = HtmlTables.containsClosing(lines.join(next.startLine(), next.endLine()));
                        j++;
                    }
                    if (closed && j > i + 1) {
                        merged.add(new AtomNode(AtomType.HTML, atom.startLine(), lastLine));
                        i = j;
                        continue;
                    }
                }
            }
            merged.add(atom);
            i++;
        }
        return merged;
    }

    private static boolean continuesTable(AtomNode candidate, int lastLine) {
        return candidate.type() == AtomType.HTML && candidate.startLine() <= lastLine + MAX_LINE_DISTANCE;
    }
}
