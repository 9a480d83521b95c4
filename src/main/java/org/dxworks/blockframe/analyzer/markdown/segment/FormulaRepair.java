package org.dxworks.blockframe.analyzer.markdown.segment;

import org.dxworks.blockframe.model.markdown.MarkdownBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges a block forward while it holds an odd number of lone {@code $$} lines, so that no block
 * ends inside a display formula. If the delimiters never balance, the rest of the document
 * ends up in one block.
 */
public final class FormulaRepair {

    private FormulaRepair() {}

    public static List<MarkdownBlock> repair(List<MarkdownBlock> blocks, SourceLines lines) {
        List<MarkdownBlock> repaired = new ArrayList<>(blocks.size());
        int k = 0;
        while (k < blocks.size()) {
            MarkdownBlock current = blocks.get(k);
            int delimiters = countLoneDelimiters(current.content);

            while (delimiters % 2 != 0 && k + 1 < blocks.size()) {
                k++;
                current = absorb(current, blocks.get(k), lines);
                delimiters = countLoneDelimiters(current.content);
            }
            repaired.add(current);
            k++;
        }
        return repaired;
    }

    static int countLoneDelimiters(String content) {
        int count = 0;
        for (String line : content.split("\n")) {
            if (line.strip().equals(MathLineSplitter.DELIMITER)) {
                count++;
            }
        }
        return count;
    }

    // Content is re-sliced from the source so blank lines dropped between the two blocks come back.
    private static MarkdownBlock absorb(MarkdownBlock current, MarkdownBlock next, SourceLines lines) {
        String content = lines.join(current.startLine, next.endLine);
        if (content.isEmpty()) {
            content = current.content + "\n" + next.content;
        }
        return new MarkdownBlock(current.id, content, current.startLine, next.endLine, AtomType.MATH.getName());
    }
}
