package org.dxworks.blockframe.analyzer.markdown.segment;

import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.ext.footnotes.FootnotesExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.blockframe.analyzer.markdown.CommonmarkTreeBuilder;
import org.dxworks.blockframe.analyzer.markdown.SourceNode;
import org.dxworks.blockframe.model.markdown.MarkdownBlock;

import java.util.List;
import java.util.Objects;

/**
 * Splits a markdown document into ordered, non-overlapping blocks whose content is the verbatim text
 * of their line range.
 *
 * <p>Pipeline: tree walk ({@link AtomCollector}) → {@link HtmlTableRefiner} → {@link HtmlTableMerger}
 * → {@link BlockMaterializer} → {@link FormulaRepair}. Each stage returns a new list.
 * Instances are thread-safe; every call owns its intermediate state.
 */
public class MarkdownSegmenter {

    private final Parser parser;

    public MarkdownSegmenter() {
        this.parser = Parser.builder()
                .extensions(List.of(
                        TablesExtension.create(),
                        StrikethroughExtension.create(),
                        AutolinkExtension.create(),
                        TaskListItemsExtension.create(),
                        FootnotesExtension.create(),
                        YamlFrontMatterExtension.create()
                ))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public List<MarkdownBlock> segment(String markdown) {
        Objects.requireNonNull(markdown, "markdown");
        String content = SourceLines.normalizeLineEndings(markdown);
        Node document = parser.parse(content);
        return segment(content, CommonmarkTreeBuilder.build(document));
    }

    /**
     * Segments a document whose tree was produced elsewhere. The tree's line numbers must refer to
     * the document after {@code \r\n} normalization.
     */
    public List<MarkdownBlock> segment(String markdown, SourceNode root) {
        Objects.requireNonNull(markdown, "markdown");
        Objects.requireNonNull(root, "root");
        SourceLines lines = SourceLines.of(SourceLines.normalizeLineEndings(markdown));

        List<AtomNode> atoms = AtomCollector.collect(root, lines);
        List<AtomNode> refined = HtmlTableRefiner.refine(atoms, lines);
        List<AtomNode> merged = HtmlTableMerger.merge(refined, lines);
        List<MarkdownBlock> blocks = BlockMaterializer.materialize(merged, lines);
        return FormulaRepair.repair(blocks, lines);
    }
}
