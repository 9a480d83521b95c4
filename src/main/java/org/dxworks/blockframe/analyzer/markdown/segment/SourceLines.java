package org.dxworks.blockframe.analyzer.markdown.segment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The line array of a normalized markdown document, addressed with 1-indexed line numbers.
 * Access outside the document yields empty content instead of failing.
 */
public final class SourceLines {

    private final List<String> lines;

    private SourceLines(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    /**
     * Splits text on {@code \n}. A trailing newline does not open an extra line,
     * so {@code "a\n"} has one line and {@code ""} has none.
     */
    public static SourceLines of(String normalizedText) {
        List<String> split = new ArrayList<>(Arrays.asList(normalizedText.split("\n", -1)));
        if (split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }
        return new SourceLines(split);
    }

    public static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n");
    }

    public int size() {
        return lines.size();
    }

    /** @return the line, or an empty string when {@code lineNumber} is outside the document */
    public String line(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return "";
        }
        return lines.get(lineNumber - 1);
    }

    /** @return lines {@code [startLine, endLine]}, or an empty list when the range does not fit the document */
    public List<String> slice(int startLine, int endLine) {
        if (startLine < 1 || endLine < startLine || endLine > lines.size()) {
            return List.of();
        }
        return lines.subList(startLine - 1, endLine);
    }

    public String join(int startLine, int endLine) {
        return String.join("\n", slice(startLine, endLine));
    }
}
