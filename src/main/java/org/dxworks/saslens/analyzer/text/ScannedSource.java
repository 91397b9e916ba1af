package org.dxworks.saslens.analyzer.text;

import org.dxworks.saslens.model.Anomaly;
import org.dxworks.saslens.model.AnomalyType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Source text cut into statements, with comment-blanked and literal-masked views of equal length.
 */
public final class ScannedSource {

    private final String source;
    private final String code;
    private final String masked;
    private final List<SasStatement> statements;
    private final List<Anomaly> anomalies = new ArrayList<>();
    private final int[] lineStarts;

    ScannedSource(String source, String code, String masked, List<SasStatement> statements) {
        this.source = source;
        this.code = code;
        this.masked = masked;
        this.statements = Collections.unmodifiableList(statements);
        this.lineStarts = computeLineStarts(source);
    }

    public String getSource() {
        return source;
    }

    public String getCode() {
        return code;
    }

    public String getMasked() {
        return masked;
    }

    public List<SasStatement> getStatements() {
        return statements;
    }

    public List<Anomaly> getAnomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    public int length() {
        return source.length();
    }

    /**
     * 1-based line number of a character offset.
     */
    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, source.length()));
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public Anomaly anomaly(AnomalyType type, int offset, String subject, String message) {
        return new Anomaly(type, offset, lineOf(offset), subject, message);
    }

    void addAnomaly(AnomalyType type, int offset, String subject, String message) {
        anomalies.add(anomaly(type, offset, subject, message));
    }

    private static int[] computeLineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') starts.add(i + 1);
        }
        int[] out = new int[starts.size()];
        for (int i = 0; i < out.length; i++) out[i] = starts.get(i);
        return out;
    }
}
