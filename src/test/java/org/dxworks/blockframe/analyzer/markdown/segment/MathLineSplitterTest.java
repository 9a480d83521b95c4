package org.dxworks.blockframe.analyzer.markdown.segment;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathLineSplitterTest {

    private static SourceLines lines(String... lines) {
        return SourceLines.of(String.join("\n", lines));
    }

    @Test
    void plainLinesBecomeSingleLineRanges() {
        SourceLines source = lines("a", "b", "c");

        assertEquals(List.of(LineRange.single(1), LineRange.single(2), LineRange.single(3)),
                MathLineSplitter.split(1, 3, source));
    }

    @Test
    void multiLineFormulaStaysInOnePiece() {
        SourceLines source = lines("before", "$$", "x = 1", "$$", "after");

        assertEquals(List.of(LineRange.single(1), new LineRange(2, 4), LineRange.single(5)),
                MathLineSplitter.split(1, 5, source));
    }

    @Test
    void closingLineOnlyNeedsToEndWithDelimiter() {
        SourceLines source = lines("  $$ \\begin{aligned}", "a &= b \\\\", "c &= d $$");

        assertEquals(List.of(new LineRange(1, 3)), MathLineSplitter.split(1, 3, source));
    }

    @Test
    void singleLineFormulaIsItsOwnRange() {
        SourceLines source = lines("$$x=1$$", "$$", "y", "$$");

        assertEquals(List.of(LineRange.single(1), new LineRange(2, 4)),
                MathLineSplitter.split(1, 4, source));
    }

    @Test
    void unclosedFormulaFallsBackToSingleLines() {
        SourceLines source = lines("$$", "x = 1", "y = 2");

        assertEquals(List.of(LineRange.single(1), LineRange.single(2), LineRange.single(3)),
                MathLineSplitter.split(1, 3, source));
    }

    @Test
    void closingDelimiterOutsideTheRangeIsNotSeen() {
        SourceLines source = lines("$$", "x", "$$");

        assertEquals(List.of(LineRange.single(1), LineRange.single(2)),
                MathLineSplitter.split(1, 2, source));
    }

    @Test
    void splitsOnlyTheRequestedRange() {
        SourceLines source = lines("a", "b", "c", "d");

        assertEquals(List.of(LineRange.single(2), LineRange.single(3)), MathLineSplitter.split(2, 3, source));
        assertTrue(MathLineSplitter.split(3, 2, source).isEmpty());
    }

    @Test
    void linesPastTheDocumentAreTreatedAsEmpty() {
        SourceLines source = lines("a");

        assertEquals(List.of(LineRange.single(1), LineRange.single(2)), MathLineSplitter.split(1, 2, source));
    }

    @Test
    void recognizesSingleLineFormulas() {
        assertTrue(MathLineSplitter.isSingleLineFormula("$$x$$"));
        assertTrue(MathLineSplitter.isSingleLineFormula("$$$"));
        assertFalse(MathLineSplitter.isSingleLineFormula("$$"));
        assertFalse(MathLineSplitter.isSingleLineFormula("$$ x"));
    }
}
