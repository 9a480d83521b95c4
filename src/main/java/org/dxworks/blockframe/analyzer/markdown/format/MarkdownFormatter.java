package org.dxworks.blockframe.analyzer.markdown.format;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonicalizes markdown text ahead of block editing:
 * <ol>
 *   <li>{@code \r\n} becomes {@code \n};</li>
 *   <li>a single-line {@code $$formula$$} is expanded into a multi-line display formula;</li>
 *   <li>an opening lone {@code $$} line gets a blank line before it, a closing one a blank line after it;</li>
 *   <li>three or more consecutive newlines collapse to two;</li>
 *   <li>the whole document is stripped.</li>
 * </ol>
 * The transform is pure and idempotent.
 */
public final class MarkdownFormatter {

    private static final String DELIMITER = "$$";
    private static final Pattern SINGLE_LINE_FORMULA = Pattern.compile("\\$\\$([^$\\n]+?)\\$\\$");
    private static final String EXPANDED_FORMULA = "\n\n\\$\\$\n$1\n\\$\\$\n\n";
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");

    private MarkdownFormatter() {}

    public static String format(String markdown) {
        if (markdown == null) return "";

        String content = markdown.replace("\r\n", "\n");
        content = SINGLE_LINE_FORMULA.matcher(content).replaceAll(EXPANDED_FORMULA);
        content = padDelimiterLines(content);
        content = BLANK_LINE_RUN.matcher(content).replaceAll("\n\n");
        return content.strip();
    }

    private static String padDelimiterLines(String content) {
        List<String> lines = splitLines(content);
        boolean inFormula = false;
        int i = 0;
        while (i < lines.size()) {
            if (lines.get(i).strip().equals(DELIMITER)) {
                if (!inFormula) {
                    if (i > 0 && !lines.get(i - 1).isBlank()) {
                        lines.add(i, "");
                        i++;
                    }
                    inFormula = true;
                } else {
                    if (i + 1 < lines.size() && !lines.get(i + 1).isBlank()) {
                        lines.add(i + 1, "");
                    }
                    inFormula = false;
                }
            }
            i++;
        }
        return String.join("\n", lines);
    }

    private static List<String> splitLines(String content) {
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
