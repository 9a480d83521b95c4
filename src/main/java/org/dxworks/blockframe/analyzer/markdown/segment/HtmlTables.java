package org.dxworks.blockframe.analyzer.markdown.segment;

/**
 * Textual {@code <table>} boundary detection. No HTML parsing happens here.
 */
final class HtmlTables {

    static final String OPENING_PREFIX = "<table";
    static final String CLOSING_TAG = "</table>";

    private HtmlTables() {}

    /** {@code <table}, {@code <table>} or {@code <table attr...>} at the start of already-trimmed text. */
    static boolean isOpening(String trimmed) {
        if (!trimmed.startsWith(OPENING_PREFIX)) {
            return false;
        }
        if (trimmed.length() == OPENING_PREFIX.length()) {
            return true;
        }
        char next = trimmed.charAt(OPENING_PREFIX.length());
        return next == '>' || next == ' ';
    }

    static boolean containsClosing(String text) {
        return text.contains(CLOSING_TAG);
    }

    static boolean containsTableMarkup(String text) {
        return text.contains(OPENING_PREFIX) || text.contains(CLOSING_TAG);
    }
}
