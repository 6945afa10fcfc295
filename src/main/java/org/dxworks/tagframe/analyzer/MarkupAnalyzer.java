package org.dxworks.tagframe.analyzer;

import org.dxworks.tagframe.model.Analysis;

public interface MarkupAnalyzer {
    Analysis analyze(String filePath, String sourceCode);
}
