package org.dxworks.blockframe.analyzer.markdown.segment;

/** 1-indexed, inclusive line range. */
public record LineRange(int startLine, int endLine) {

    public static LineRange single(int line) {
        return new LineRange(line, line);
    }
}
