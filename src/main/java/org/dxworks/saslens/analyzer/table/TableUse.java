package org.dxworks.saslens.analyzer.table;

import org.dxworks.saslens.model.TableOperation;

/**
 * One qualified {@code alias.table} occurrence inside a SQL statement, with what the statement does to it.
 */
final class TableUse {
    final String alias;
    final String tableName;
    final TableOperation operation;

    TableUse(String alias, String tableName, TableOperation operation) {
        this.alias = alias;
        this.tableName = tableName;
        this.operation = operation;
    }

    @Override
    public String toString() {
        return operation.getLabel() + " " + alias + "." + tableName;
    }
}
