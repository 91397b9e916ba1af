package org.dxworks.saslens.analyzer.table;

import org.dxworks.saslens.analyzer.library.LibraryRegistry;
import org.dxworks.saslens.analyzer.segment.QueryBlock;
import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.analyzer.variable.VariableResolver;
import org.dxworks.saslens.model.Anomaly;
import org.dxworks.saslens.model.AnomalyType;
import org.dxworks.saslens.model.DatabaseHandle;
import org.dxworks.saslens.model.DatabaseType;
import org.dxworks.saslens.model.TableOperation;
import org.dxworks.saslens.model.TableReference;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Attributes the tables touched inside PROC SQL blocks to the library handles they are read or
 * written through.
 *
 * Each statement is substituted, then classified with JSqlParser; statements the parser rejects
 * go through {@link RegexStatementClassifier}. Only qualified {@code alias.table} names count.
 * Aliases that were never declared produce an {@link DatabaseType#UNKNOWN} handle and one
 * anomaly per alias.
 */
public class TableOperationExtractor {

    private final LibraryRegistry registry;
    private final VariableResolver resolver;
    private final Map<String, DatabaseHandle> unknown = new LinkedHashMap<>();
    private final List<Anomaly> anomalies = new ArrayList<>();

    public TableOperationExtractor(LibraryRegistry registry, VariableResolver resolver) {
        this.registry = registry;
        this.resolver = resolver;
    }

    /**
     * Handles with at least one table operation: declared handles in declaration order,
     * then unknown aliases in order of first use.
     */
    public List<DatabaseHandle> extract(SegmentedSource segmented) {
        ScannedSource scanned = segmented.getScanned();
        for (QueryBlock block : segmented.getQueryBlocks()) {
            for (SasStatement statement : block.getStatements()) {
                if (!statement.isCode()) continue;
                for (TableUse use : classify(statement)) {
                    record(use, statement, scanned);
                }
            }
        }

        List<DatabaseHandle> out = new ArrayList<>();
        for (DatabaseHandle handle : registry.getHandles()) {
            if (!handle.hasOperations()) continue;
            if (handle.databaseType == DatabaseType.TERADATA) addTableFamily(handle);
            out.add(handle);
        }
        for (DatabaseHandle handle : unknown.values()) {
            if (handle.hasOperations()) out.add(handle);
        }
        return out;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    List<TableUse> classify(SasStatement statement) {
        String sql = substitute(statement.codeBody());
        if (sql.isBlank()) return List.of();

        // macro statements inside PROC SQL are never valid SQL
        if (statement.getKeyword() == null || !statement.getKeyword().startsWith("%")) {
            List<TableUse> parsed = SqlStatementClassifier.classify(sql);
            if (parsed != null) return parsed;
        }
        return RegexStatementClassifier.classify(SasSqlText.maskLiterals(sql));
    }

    private String substitute(String text) {
        return resolver == null ? text : resolver.substitute(text);
    }

    private void record(TableUse use, SasStatement statement, ScannedSource scanned) {
        if (registry.isBuiltin(use.alias)) return;

        DatabaseHandle handle = registry.lookup(use.alias);
        if (handle == null) {
            handle = registry.lookupByDatabaseName(use.alias);
        }
        if (handle == null) {
            handle = unknownHandle(use.alias, statement, scanned);
        }

        TableReference table = handle.findTable(use.alias, use.tableName);
        if (table == null) {
            table = new TableReference(use.alias, use.tableName);
            handle.operationTables.add(table);
        }
        table.operations.add(use.operation);
    }

    private DatabaseHandle unknownHandle(String alias, SasStatement statement, ScannedSource scanned) {
        String key = alias.toUpperCase(Locale.ROOT);
        DatabaseHandle handle = unknown.get(key);
        if (handle != null) return handle;
        handle = new DatabaseHandle(alias, alias, DatabaseType.UNKNOWN, "");
        unknown.put(key, handle);
        anomalies.add(scanned.anomaly(AnomalyType.UNKNOWN_LIBRARY_ALIAS, statement.getCodeStart(), alias,
                "Library " + alias + " is used in PROC SQL but never declared with LIBNAME"));
        return handle;
    }

    // The declared Teradata name is reported as a table of its own, carrying every operation done through it
    private static void addTableFamily(DatabaseHandle handle) {
        Set<TableOperation> union = EnumSet.noneOf(TableOperation.class);
        for (TableReference table : handle.operationTables) {
            union.addAll(table.operations);
        }
        TableReference family = new TableReference(handle.alias, handle.alias);
        family.tableFamily = Boolean.TRUE;
        family.operations = union;
        handle.operationTables.add(0, family);
    }
}
