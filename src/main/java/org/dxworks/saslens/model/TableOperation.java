package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operations observed against a table inside PROC SQL.
 * Declaration order is the order in which operations are serialized.
 */
public enum TableOperation {
    SELECT("SELECT"),
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    CREATE_TABLE("CREATE TABLE"),
    CREATE_VIEW("CREATE VIEW"),
    SELECT_INTO("SELECT INTO");

    private final String label;

    TableOperation(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
