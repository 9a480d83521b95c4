package org.dxworks.blockframe.model.markdown;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One independently editable unit of a markdown document.
 * {@code content} is lines {@code startLine..endLine} (1-indexed, inclusive) of the normalized source, verbatim.
 */
@JsonPropertyOrder({"id", "content", "start_line", "end_line", "block_type"})
public class MarkdownBlock {
    public String id; // unique within one segmentation run only
    public String content;
    @JsonProperty("start_line")
    public int startLine;
    @JsonProperty("end_line")
    public int endLine;
    @JsonProperty("block_type")
    public String blockType; // heading, paragraph, code, table, math, html, yaml, thematicBreak, footnoteDefinition, line, other

    public MarkdownBlock(String id, String content, int startLine, int endLine, String blockType) {
        this.id = id;
        this.content = content;
        this.startLine = startLine;
        this.endLine = endLine;
        this.blockType = blockType;
    }

    @Override
    public String toString() {
        return blockType + "[" + startLine + "-" + endLine + "]";
    }
}
