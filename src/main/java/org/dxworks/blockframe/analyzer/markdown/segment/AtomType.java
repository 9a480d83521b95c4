package org.dxworks.blockframe.analyzer.markdown.segment;

public enum AtomType {
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    CODE("code"),
    TABLE("table"),
    MATH("math"),
    HTML("html"),
    YAML("yaml"),
    THEMATIC_BREAK("thematicBreak"),
    FOOTNOTE_DEFINITION("footnoteDefinition"),
    LIST("list"),
    LIST_ITEM("listItem"),
    BLOCKQUOTE("blockquote"),
    LINE("line"),
    OTHER("other");

    private final String name;

    AtomType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
