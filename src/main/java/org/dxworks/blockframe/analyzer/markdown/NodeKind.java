package org.dxworks.blockframe.analyzer.markdown;

import org.dxworks.blockframe.analyzer.markdown.segment.AtomType;

/**
 * Block-level node kinds of a parsed markdown document.
 * Every classification used by the segmenter is a pure function of the kind.
 */
public enum NodeKind {
    DOCUMENT(AtomType.OTHER),
    LIST(AtomType.LIST),
    LIST_ITEM(AtomType.LIST_ITEM),
    BLOCK_QUOTE(AtomType.BLOCKQUOTE),
    HEADING(AtomType.HEADING),
    PARAGRAPH(AtomType.PARAGRAPH),
    CODE_BLOCK(AtomType.CODE),
    TABLE(AtomType.TABLE),
    MATH_BLOCK(AtomType.MATH),
    HTML_BLOCK(AtomType.HTML),
    THEMATIC_BREAK(AtomType.THEMATIC_BREAK),
    FOOTNOTE_DEFINITION(AtomType.FOOTNOTE_DEFINITION),
    FRONT_MATTER(AtomType.YAML),
    OTHER(AtomType.OTHER);

    private final AtomType atomType;

    NodeKind(AtomType atomType) {
        this.atomType = atomType;
    }

    public AtomType getAtomType() {
        return atomType;
    }

    /** Containers are never emitted themselves, only their descendants are. */
    public boolean isContainer() {
        return switch (this) {
            case DOCUMENT, LIST, LIST_ITEM, BLOCK_QUOTE -> true;
            default -> false;
        };
    }

    /** Complex nodes become one atom spanning their whole range. */
    public boolean isComplex() {
        return switch (this) {
            case TABLE, CODE_BLOCK, MATH_BLOCK, HTML_BLOCK, THEMATIC_BREAK, FOOTNOTE_DEFINITION, FRONT_MATTER -> true;
            default -> false;
        };
    }

    public boolean isTextBlock() {
        return this == PARAGRAPH || this == HEADING;
    }
}
