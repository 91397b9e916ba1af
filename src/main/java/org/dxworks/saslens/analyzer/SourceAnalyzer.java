package org.dxworks.saslens.analyzer;

import org.dxworks.saslens.model.Analysis;

public interface SourceAnalyzer {
    Analysis analyze(String filePath, String sourceCode);
}
