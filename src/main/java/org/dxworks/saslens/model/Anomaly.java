package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A non-fatal structural irregularity found while analyzing a source unit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "line", "offset", "subject", "message"})
public class Anomaly {
    public AnomalyType type;
    public int line;
    public int offset;
    public String subject;  // macro name, library alias, ... when there is one
    public String message;

    public Anomaly() {
    }

    public Anomaly(AnomalyType type, int offset, int line, String subject, String message) {
        this.type = type;
        this.offset = offset;
        this.line = line;
        this.subject = subject;
        this.message = message;
    }
}
