package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * A library alias bound to a database, together with the tables used through it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"databaseName", "databaseType", "engine", "connectionDetail", "operationTables"})
public class DatabaseHandle {
    @JsonIgnore
    public String alias;  // the library name used in source, after substitution
    public String databaseName;
    public DatabaseType databaseType;
    public String engine;  // raw engine token, only kept for GENERIC handles
    public String connectionDetail = "";
    @JsonIgnore
    public int declarationOffset = -1;
    public List<TableReference> operationTables = new ArrayList<>();

    public DatabaseHandle() {
    }

    public DatabaseHandle(String alias, String databaseName, DatabaseType databaseType, String connectionDetail) {
        this.alias = alias;
        this.databaseName = databaseName;
        this.databaseType = databaseType;
        this.connectionDetail = connectionDetail == null ? "" : connectionDetail;
    }

    public TableReference findTable(String alias, String tableName) {
        for (TableReference table : operationTables) {
            if (table.matches(alias, tableName)) return table;
        }
        return null;
    }

    @JsonIgnore
    public boolean hasOperations() {
        for (TableReference table : operationTables) {
            if (!table.operations.isEmpty()) return true;
        }
        return false;
    }
}
