package org.dxworks.blockframe.model.markdown;

import org.dxworks.blockframe.model.Analysis;

import java.util.ArrayList;
import java.util.List;

public class BlockFileAnalysis implements Analysis {
    public String filePath;
    public String language = "markdown";
    public int totalLines;
    public List<MarkdownBlock> blocks = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
