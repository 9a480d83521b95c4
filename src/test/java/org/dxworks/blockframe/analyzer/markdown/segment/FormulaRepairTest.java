package org.dxworks.blockframe.analyzer.markdown.segment;

import org.dxworks.blockframe.model.markdown.MarkdownBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FormulaRepairTest {

    private static final SourceLines SOURCE = SourceLines.of("$$\nx = 1\n\ny = 2\n$$\n\nafter");

    private static MarkdownBlock block(String id, int start, int end, String type) {
        return new MarkdownBlock(id, SOURCE.join(start, end), start, end, type);
    }

    @Test
    void mergesForwardUntilDelimitersBalance() {
        List<MarkdownBlock> blocks = List.of(
                block("a", 1, 1, "line"),
                block("b", 2, 2, "line"),
                block("c", 4, 4, "line"),
                block("d", 5, 5, "paragraph"),
                block("e", 7, 7, "paragraph"));

        List<MarkdownBlock> repaired = FormulaRepair.repair(blocks, SOURCE);

        assertEquals(2, repaired.size());
        MarkdownBlock formula = repaired.get(0);
        assertEquals("a", formula.id);
        assertEquals("math", formula.blockType);
        assertEquals(1, formula.startLine);
        assertEquals(5, formula.endLine);
        assertEquals("$$\nx = 1\n\ny = 2\n$$", formula.content);
        assertEquals("e", repaired.get(1).id);
        assertEquals("paragraph", repaired.get(1).blockType);
    }

    @Test
    void balancedBlocksAreUntouched() {
        List<MarkdownBlock> blocks = List.of(block("a", 1, 5, "line"), block("b", 7, 7, "paragraph"));

        List<MarkdownBlock> repaired = FormulaRepair.repair(blocks, SOURCE);

        assertEquals(blocks, repaired);
    }

    @Test
    void delimitersThatNeverBalanceAbsorbTheRestOfTheDocument() {
        SourceLines source = SourceLines.of("$$\na\n\nb\n\nc");
        List<MarkdownBlock> blocks = List.of(
                new MarkdownBlock("a", "$$", 1, 1, "line"),
                new MarkdownBlock("b", "a", 2, 2, "line"),
                new MarkdownBlock("c", "b", 4, 4, "paragraph"),
                new MarkdownBlock("d", "c", 6, 6, "paragraph"));

        List<MarkdownBlock> repaired = FormulaRepair.repair(blocks, source);

        assertEquals(1, repaired.size());
        assertEquals(1, repaired.get(0).startLine);
        assertEquals(6, repaired.get(0).endLine);
        assertEquals("$$\na\n\nb\n\nc", repaired.get(0).content);
        assertEquals("math", repaired.get(0).blockType);
    }

    @Test
    void lastBlockWithNothingToAbsorbIsKept() {
        List<MarkdownBlock> blocks = List.of(block("e", 7, 7, "paragraph"), block("d", 5, 5, "line"));

        List<MarkdownBlock> repaired = FormulaRepair.repair(blocks, SOURCE);

        assertEquals(2, repaired.size());
        assertEquals("line", repaired.get(1).blockType);
    }

    @Test
    void countsOnlyLinesThatAreExactlyTheDelimiter() {
        assertEquals(2, FormulaRepair.countLoneDelimiters("  $$\nx\n$$  "));
        assertEquals(0, FormulaRepair.countLoneDelimiters("$$x$$\n$$ y\nz $$"));
    }
}
