package org.dxworks.blockframe.analyzer.markdown;

import org.dxworks.blockframe.analyzer.LanguageAnalyzer;
import org.dxworks.blockframe.analyzer.markdown.format.MarkdownFormatter;
import org.dxworks.blockframe.analyzer.markdown.segment.MarkdownSegmenter;
import org.dxworks.blockframe.analyzer.markdown.segment.SourceLines;
import org.dxworks.blockframe.model.Analysis;
import org.dxworks.blockframe.model.markdown.BlockFileAnalysis;

public class MarkdownAnalyzer implements LanguageAnalyzer {

    private final MarkdownSegmenter segmenter;
    private final boolean normalizeBeforeSegmenting;

    public MarkdownAnalyzer() {
        this(false);
    }

    public MarkdownAnalyzer(boolean normalizeBeforeSegmenting) {
        this.segmenter = new MarkdownSegmenter();
        this.normalizeBeforeSegmenting = normalizeBeforeSegmenting;
    }

    @Override
    public Analysis analyze(String filePath, String sourceCode) {
        // Line numbers of the blocks refer to the text that was actually segmented
        String markdown = normalizeBeforeSegmenting
                ? MarkdownFormatter.format(sourceCode)
                : SourceLines.normalizeLineEndings(sourceCode);

        BlockFileAnalysis analysis = new BlockFileAnalysis();
        analysis.filePath = filePath;
        analysis.totalLines = SourceLines.of(markdown).size();
        analysis.blocks = segmenter.segment(markdown);
        return analysis;
    }
}
