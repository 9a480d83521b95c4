package org.dxworks.blockframe.analyzer;

import org.dxworks.blockframe.model.Analysis;

public interface LanguageAnalyzer {
    Analysis analyze(String filePath, String sourceCode);
}
