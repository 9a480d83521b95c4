package org.dxworks.blockframe.analyzer.markdown;

import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.Document;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommonmarkTreeBuilderTest {

    private static final Parser PARSER = Parser.builder()
            .extensions(List.of(
                    TablesExtension.create(),
                    FootnotesExtension.create(),
                    YamlFrontMatterExtension.create()
            ))
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();

    @Test
    void keepsContainerStructureWithLineRanges() {
        SourceNode root = CommonmarkTreeBuilder.build(PARSER.parse("# H\n\n- a\n- b\n\n> q\n"));

        assertEquals(NodeKind.DOCUMENT, root.kind());
        List<SourceNode> children = root.children();
        assertEquals(3, children.size());

        SourceNode heading = children.get(0);
        assertEquals(NodeKind.HEADING, heading.kind());
        assertEquals(1, heading.startLine());
        assertEquals(1, heading.endLine());
        assertTrue(heading.children().isEmpty());

        SourceNode list = children.get(1);
        assertEquals(NodeKind.LIST, list.kind());
        assertEquals(3, list.startLine());
        assertEquals(4, list.endLine());
        assertEquals(2, list.children().size());
        SourceNode secondItem = list.children().get(1);
        assertEquals(NodeKind.LIST_ITEM, secondItem.kind());
        assertEquals(NodeKind.PARAGRAPH, secondItem.children().get(0).kind());
        assertEquals(4, secondItem.children().get(0).startLine());

        SourceNode quote = children.get(2);
        assertEquals(NodeKind.BLOCK_QUOTE, quote.kind());
        assertEquals(6, quote.startLine());
        assertEquals(NodeKind.PARAGRAPH, quote.children().get(0).kind());
    }

    @Test
    void mapsLeafBlocks() {
        String markdown = "---\nkey: value\n---\n\n```\ncode\n```\n\n| a |\n|---|\n| 1 |\n\n<div>x</div>\n\n***\n\nText[^n].\n\n[^n]: Note.\n";
        List<SourceNode> children = CommonmarkTreeBuilder.build(PARSER.parse(markdown)).children();

        assertEquals(List.of(NodeKind.FRONT_MATTER, NodeKind.CODE_BLOCK, NodeKind.TABLE, NodeKind.HTML_BLOCK,
                        NodeKind.THEMATIC_BREAK, NodeKind.PARAGRAPH, NodeKind.FOOTNOTE_DEFINITION),
                children.stream().map(SourceNode::kind).toList());
        assertEquals(1, children.get(0).startLine());
        assertEquals(3, children.get(0).endLine());
        assertEquals(5, children.get(1).startLine());
        assertEquals(7, children.get(1).endLine());
        assertEquals(9, children.get(2).startLine());
        assertEquals(11, children.get(2).endLine());
    }

    @Test
    void classifiesNodesByType() {
        assertEquals(NodeKind.DOCUMENT, CommonmarkTreeBuilder.kindOf(new Document()));
        assertEquals(NodeKind.CODE_BLOCK, CommonmarkTreeBuilder.kindOf(new FencedCodeBlock()));
        assertEquals(NodeKind.CODE_BLOCK, CommonmarkTreeBuilder.kindOf(new IndentedCodeBlock()));
        assertEquals(NodeKind.HTML_BLOCK, CommonmarkTreeBuilder.kindOf(new HtmlBlock()));
        assertEquals(NodeKind.OTHER, CommonmarkTreeBuilder.kindOf(new Text("inline")));
    }

    @Test
    void nodesWithoutSourceSpansGetADegenerateRange() {
        SourceNode node = CommonmarkTreeBuilder.build(new HtmlBlock());

        assertEquals(0, node.startLine());
        assertTrue(node.hasDegenerateRange());
    }

    @Test
    void classificationIsAFunctionOfTheKind() {
        for (NodeKind kind : NodeKind.values()) {
            assertTrue(!(kind.isContainer() && kind.isComplex()), kind + " is both container and complex");
        }
        assertTrue(NodeKind.FOOTNOTE_DEFINITION.isComplex());
        assertTrue(NodeKind.LIST_ITEM.isContainer());
        assertTrue(NodeKind.HEADING.isTextBlock());
        assertEquals("thematicBreak", NodeKind.THEMATIC_BREAK.getAtomType().getName());
    }
}
