package org.dxworks.saslens.analyzer.table;

import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.table.CreateTable;
import net.sf.jsqlparser.statement.create.view.CreateView;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.dxworks.saslens.model.TableOperation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies one PROC SQL statement with JSqlParser.
 * Returns null whenever the parser rejects the statement or cannot walk it, so the caller can
 * fall back to {@link RegexStatementClassifier}.
 */
final class SqlStatementClassifier {

    private SqlStatementClassifier() {
        // utility class
    }

    static List<TableUse> classify(String sql) {
        if (sql == null || sql.isBlank()) return List.of();

        Statement st;
        try {
            st = CCJSqlParserUtil.parse(sql, p -> p.withAllowComplexParsing(true));
        } catch (Exception e) {
            return null;
        }
        if (st == null) return null;

        try {
            List<TableUse> uses = new ArrayList<>();
            if (st instanceof Insert) {
                Insert insert = (Insert) st;
                addTable(uses, insert.getTable(), TableOperation.INSERT);
                addSources(uses, insert.getSelect(), insert.getTable());
            } else if (st instanceof Update) {
                Update update = (Update) st;
                addTable(uses, update.getTable(), TableOperation.UPDATE);
                addSources(uses, st, update.getTable());
            } else if (st instanceof Delete) {
                Delete delete = (Delete) st;
                addTable(uses, delete.getTable(), TableOperation.DELETE);
                addSources(uses, st, delete.getTable());
            } else if (st instanceof CreateView) {
                CreateView view = (CreateView) st;
                addTable(uses, view.getView(), TableOperation.CREATE_VIEW);
                addSources(uses, view.getSelect(), null);
            } else if (st instanceof CreateTable) {
                CreateTable table = (CreateTable) st;
                addTable(uses, table.getTable(), TableOperation.CREATE_TABLE);
                addSources(uses, table.getSelect(), null);
            } else if (st instanceof Select) {
                Table into = null;
                if (st instanceof PlainSelect) {
                    List<Table> intoTables = ((PlainSelect) st).getIntoTables();
                    if (intoTables != null) {
                        for (Table t : intoTables) {
                            addTable(uses, t, TableOperation.SELECT_INTO);
                            into = t;
                        }
                    }
                }
                addSources(uses, st, into);
            } else {
                return null;
            }
            return uses;
        } catch (UnsupportedOperationException e) {
            // TablesNamesFinder does not visit every statement type
            return null;
        }
    }

    private static void addTable(List<TableUse> uses, Table table, TableOperation operation) {
        if (table == null) return;
        String schema = table.getSchemaName();
        String name = table.getName();
        if (schema == null || schema.isEmpty() || name == null) return;
        if (table.getDatabase() != null && table.getDatabase().getDatabaseName() != null) return;
        uses.add(new TableUse(SasSqlText.stripQuotes(schema), SasSqlText.stripQuotes(name), operation));
    }

    // Every other qualified table the statement reads becomes a SELECT source
    private static void addSources(List<TableUse> uses, Statement statement, Table target) {
        if (statement == null) return;
        String targetKey = target == null ? null : key(target.getFullyQualifiedName());
        List<String> tables = new TablesNamesFinder().getTableList(statement);
        if (tables == null) return;
        Set<String> seen = new HashSet<>();
        for (String table : tables) {
            if (table == null || table.isEmpty()) continue;
            String k = key(table);
            if (k.equals(targetKey) || !seen.add(k)) continue;
            String[] parts = SasSqlText.splitQualified(table);
            if (parts == null) continue;
            uses.add(new TableUse(parts[0], parts[1], TableOperation.SELECT));
        }
    }

    private static String key(String name) {
        return name == null ? null : name.replace("\"", "").replace("`", "").toLowerCase(Locale.ROOT);
    }
}
