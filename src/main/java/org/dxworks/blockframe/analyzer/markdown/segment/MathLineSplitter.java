package org.dxworks.blockframe.analyzer.markdown.segment;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a line range into single lines, keeping every display formula ({@code $$ ... $$}) in one piece.
 * This is the only place formula boundaries are recognized line by line; every stage that
 * re-splits a span goes through here.
 */
public final class MathLineSplitter {

    static final String DELIMITER = "$$";

    private MathLineSplitter() {}

    public static List<LineRange> split(int startLine, int endLine, SourceLines lines) {
        List<LineRange> ranges = new ArrayList<>();
        int current = startLine;

        while (current <= endLine) {
            String trimmed = lines.line(current).strip();

            if (trimmed.startsWith(DELIMITER)) {
                if (isSingleLineFormula(trimmed)) {
                    ranges.add(LineRange.single(current));
                    current++;
                    continue;
                }

                int closingLine = findClosingLine(current + 1, endLine, lines);
                if (closingLine > 0) {
                    ranges.add(new LineRange(current, closingLine));
                    current = closingLine + 1;
                    continue;
                }
                // Unclosed within the range: left to FormulaRepair
            }

            ranges.add(LineRange.single(current));
            current++;
        }
        return ranges;
    }

    static boolean isSingleLineFormula(String trimmed) {
        return trimmed.length() > DELIMITER.length()
                && trimmed.startsWith(DELIMITER)
                && trimmed.endsWith(DELIMITER);
    }

    private static int findClosingLine(int fromLine, int endLine, SourceLines lines) {
        for (int line = fromLine; line <= endLine; line++) {
            if (lines.line(line).strip().endsWith(DELIMITER)) {
                return line;
            }
        }
        return -1;
    }
}
