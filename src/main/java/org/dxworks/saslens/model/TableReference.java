package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.EnumSet;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"tableName", "operations", "tableFamily"})
public class TableReference {
    @JsonIgnore
    public String alias;  // library alias after variable substitution
    public String tableName;
    public Set<TableOperation> operations = EnumSet.noneOf(TableOperation.class);
    public Boolean tableFamily;  // set only for the Teradata declared-name entry

    public TableReference() {
    }

    public TableReference(String alias, String tableName) {
        this.alias = alias;
        this.tableName = tableName;
    }

    public boolean matches(String alias, String tableName) {
        boolean aliasMatch = this.alias != null && this.alias.equalsIgnoreCase(alias);
        boolean nameMatch = this.tableName != null && this.tableName.equalsIgnoreCase(tableName);
        return aliasMatch && nameMatch;
    }
}
