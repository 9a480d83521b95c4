package org.dxworks.blockframe.analyzer.markdown.segment;

import org.dxworks.blockframe.model.markdown.MarkdownBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns sorted atoms into blocks: uncovered spans become {@code line} blocks, overlapping starts are
 * clipped, and all-whitespace content is dropped.
 */
public final class BlockMaterializer {

    private BlockMaterializer() {}

    public static List<MarkdownBlock> materialize(List<AtomNode> atoms, SourceLines lines) {
        List<MarkdownBlock> blocks = new ArrayList<>();
        int lastLineProcessed = 0;

        for (int index = 0; index < atoms.size(); index++) {
            AtomNode atom = atoms.get(index);

            if (atom.startLine() - 1 > lastLineProcessed) {
                addGapBlocks(lastLineProcessed + 1, atom.startLine() - 1, "gap-", lines, blocks);
                lastLineProcessed = atom.startLine() - 1;
            }

            int start = Math.max(atom.startLine(), lastLineProcessed + 1);
            if (atom.endLine() >= start) {
                String content = lines.join(start, atom.endLine());
                if (!content.isBlank()) {
                    blocks.add(new MarkdownBlock("block-" + index + "-" + start, content,
                            start, atom.endLine(), atom.type().getName()));
                }
                lastLineProcessed = atom.endLine();
            }
        }

        if (lastLineProcessed < lines.size()) {
            addGapBlocks(lastLineProcessed + 1, lines.size(), "gap-end-", lines, blocks);
        }
        return blocks;
    }

    private static void addGapBlocks(int startLine, int endLine, String idPrefix, SourceLines lines,
                                     List<MarkdownBlock> blocks) {
        List<LineRange> ranges = MathLineSplitter.split(startLine, endLine, lines);
        for (int n = 0; n < ranges.size(); n++) {
            LineRange range = ranges.get(n);
            String content = lines.join(range.startLine(), range.endLine());
            if (!content.isBlank()) {
                blocks.add(new MarkdownBlock(idPrefix + range.startLine() + "-" + n, content,
                        range.startLine(), range.endLine(), AtomType.LINE.getName()));
            }
        }
    }
}
