package org.dxworks.saslens.analyzer;

import org.dxworks.saslens.analyzer.chunk.SasCodeChunker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for one {@link SasAnalyzer#analyze(String, AnalysisOptions)} run.
 */
public class AnalysisOptions {

    private int maxTokenSize = SasCodeChunker.DEFAULT_MAX_TOKEN_SIZE;
    private boolean databaseOnly;
    private String sourceName;
    private final Map<String, String> predefinedVariables = new LinkedHashMap<>();

    public static AnalysisOptions defaults() {
        return new AnalysisOptions();
    }

    public int getMaxTokenSize() {
        return maxTokenSize;
    }

    /**
     * Token budget for the main-body chunks. Must be positive.
     */
    public AnalysisOptions withMaxTokenSize(int maxTokenSize) {
        this.maxTokenSize = maxTokenSize;
        return this;
    }

    public boolean isDatabaseOnly() {
        return databaseOnly;
    }

    public AnalysisOptions withDatabaseOnly(boolean databaseOnly) {
        this.databaseOnly = databaseOnly;
        return this;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Name used in macro placeholders, typically the file name.
     */
    public AnalysisOptions withSourceName(String sourceName) {
        this.sourceName = sourceName;
        return this;
    }

    public Map<String, String> getPredefinedVariables() {
        return Collections.unmodifiableMap(predefinedVariables);
    }

    /**
     * Macro variables already resolved elsewhere, e.g. by an autoexec. They are defined before
     * the unit's own {@code %let} statements.
     */
    public AnalysisOptions withVariable(String name, String value) {
        predefinedVariables.put(name, value);
        return this;
    }

    public AnalysisOptions withVariables(Map<String, String> variables) {
        if (variables != null) predefinedVariables.putAll(variables);
        return this;
    }
}
