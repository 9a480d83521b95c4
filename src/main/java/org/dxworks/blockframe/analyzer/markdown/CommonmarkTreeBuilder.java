package org.dxworks.blockframe.analyzer.markdown;

import org.commonmark.ext.footnotes.FootnoteDefinition;
import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.Document;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.ThematicBreak;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a commonmark-java document (parsed with block source spans) into a {@link SourceNode} tree.
 * Only container nodes keep their children; the inline content of leaves is irrelevant to segmentation.
 */
public final class CommonmarkTreeBuilder {

    private CommonmarkTreeBuilder() {}

    public static SourceNode build(Node node) {
        NodeKind kind = kindOf(node);
        int startLine = 0;
        int endLine = 0;

        List<SourceSpan> spans = node.getSourceSpans();
        if (spans != null && !spans.isEmpty()) {
            int minLine = Integer.MAX_VALUE;
            int maxLine = Integer.MIN_VALUE;
            for (SourceSpan span : spans) {
                minLine = Math.min(minLine, span.getLineIndex());
                maxLine = Math.max(maxLine, span.getLineIndex());
            }
            // source spans are 0-based
            startLine = minLine + 1;
            endLine = maxLine + 1;
        }

        List<SourceNode> children = new ArrayList<>();
        if (kind.isContainer()) {
            for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                children.add(build(child));
            }
        }
        return new SourceNode(kind, startLine, endLine, children);
    }

    static NodeKind kindOf(Node node) {
        if (node instanceof Document) {
            return NodeKind.DOCUMENT;
        }
        if (node instanceof ListBlock) {
            return NodeKind.LIST;
        }
        if (node instanceof ListItem) {
            return NodeKind.LIST_ITEM;
        }
        if (node instanceof BlockQuote) {
            return NodeKind.BLOCK_QUOTE;
        }
        if (node instanceof Heading) {
            return NodeKind.HEADING;
        }
        if (node instanceof Paragraph) {
            return NodeKind.PARAGRAPH;
        }
        if (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock) {
            return NodeKind.CODE_BLOCK;
        }
        if (node instanceof TableBlock) {
            return NodeKind.TABLE;
        }
        if (node instanceof HtmlBlock) {
            return NodeKind.HTML_BLOCK;
        }
        if (node instanceof ThematicBreak) {
            return NodeKind.THEMATIC_BREAK;
        }
        if (node instanceof FootnoteDefinition) {
            return NodeKind.FOOTNOTE_DEFINITION;
        }
        if (node instanceof YamlFrontMatterBlock) {
            return NodeKind.FRONT_MATTER;
        }
        return NodeKind.OTHER;
    }
}
