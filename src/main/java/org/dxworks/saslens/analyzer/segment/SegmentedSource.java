package org.dxworks.saslens.analyzer.segment;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.model.Anomaly;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block structure of a scanned unit: ordered top-level segments, every macro definition
 * (nested ones included) and every PROC SQL block, plus the macro that owns each statement.
 */
public final class SegmentedSource {

    private final ScannedSource scanned;
    private final List<Segment> segments;
    private final List<MacroDefinition> macros;
    private final List<QueryBlock> queryBlocks;
    private final MacroDefinition[] owners;
    private final QueryBlock[] queries;
    private final Map<MacroDefinition, int[]> delimiters;
    private final List<Anomaly> anomalies;

    SegmentedSource(ScannedSource scanned, List<Segment> segments, List<MacroDefinition> macros,
                    List<QueryBlock> queryBlocks, MacroDefinition[] owners, QueryBlock[] queries,
                    Map<MacroDefinition, int[]> delimiters, List<Anomaly> anomalies) {
        this.scanned = scanned;
        this.segments = Collections.unmodifiableList(segments);
        this.macros = Collections.unmodifiableList(macros);
        this.queryBlocks = Collections.unmodifiableList(queryBlocks);
        this.owners = owners;
        this.queries = queries;
        this.delimiters = new IdentityHashMap<>(delimiters);
        this.anomalies = Collections.unmodifiableList(anomalies);
    }

    public ScannedSource getScanned() {
        return scanned;
    }

    public String getSource() {
        return scanned.getSource();
    }

    public List<Segment> getSegments() {
        return segments;
    }

    /**
     * All macro definitions in order of their {@code %macro} statement.
     */
    public List<MacroDefinition> getMacros() {
        return macros;
    }

    public List<MacroDefinition> getTopLevelMacros() {
        List<MacroDefinition> out = new ArrayList<>();
        for (MacroDefinition macro : macros) {
            if (macro.depth == 0) out.add(macro);
        }
        return out;
    }

    public List<QueryBlock> getQueryBlocks() {
        return queryBlocks;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    /**
     * Innermost macro definition enclosing the statement, or null at the top level.
     * The {@code %macro} and {@code %mend} statements belong to the macro they delimit.
     */
    public MacroDefinition ownerOf(SasStatement statement) {
        return owners[statement.getIndex()];
    }

    /**
     * The PROC SQL block the statement belongs to (header and {@code quit} included), or null.
     */
    public QueryBlock queryBlockOf(SasStatement statement) {
        return queries[statement.getIndex()];
    }

    public boolean isDelimiter(MacroDefinition macro, SasStatement statement) {
        int[] d = delimiters.get(macro);
        if (d == null) return false;
        return statement.getIndex() == d[0] || statement.getIndex() == d[1];
    }

    /**
     * Statements of the macro body that belong to the macro itself: nested definitions and the
     * delimiting {@code %macro}/{@code %mend} statements are left out.
     */
    public List<SasStatement> ownStatements(MacroDefinition macro) {
        List<SasStatement> out = new ArrayList<>();
        for (SasStatement statement : scanned.getStatements()) {
            if (owners[statement.getIndex()] == macro && !isDelimiter(macro, statement)) out.add(statement);
        }
        return out;
    }

    /**
     * Statements not enclosed in any macro definition, in source order.
     */
    public List<SasStatement> topLevelStatements() {
        List<SasStatement> out = new ArrayList<>();
        for (SasStatement statement : scanned.getStatements()) {
            if (owners[statement.getIndex()] == null) out.add(statement);
        }
        return out;
    }

    /**
     * Direct children of a macro, or the top-level macros when {@code parent} is null.
     */
    public List<MacroDefinition> childrenOf(MacroDefinition parent) {
        List<MacroDefinition> out = new ArrayList<>();
        for (MacroDefinition macro : macros) {
            if (macro.parentDefinition == parent) out.add(macro);
        }
        return out;
    }
}
