package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured result of analyzing one SAS source unit.
 * In database-only mode every section except {@code databases} and {@code anomalies} stays null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"filePath", "language", "databases", "macros", "dependencies", "complexity", "chunks", "anomalies"})
public class AnalysisReport implements Analysis {
    public String filePath;
    public String language;
    public List<DatabaseHandle> databases = new ArrayList<>();
    public List<MacroDefinition> macros;
    public DependencyGraph dependencies;
    public ComplexityReport complexity;
    public ChunkedSource chunks;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<Anomaly> anomalies = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }

    public DatabaseHandle findDatabase(String databaseName) {
        for (DatabaseHandle db : databases) {
            if (db.databaseName != null && db.databaseName.equalsIgnoreCase(databaseName)) return db;
        }
        return null;
    }

    @JsonIgnore
    public boolean isDatabaseOnly() {
        return dependencies == null && complexity == null && chunks == null;
    }
}
