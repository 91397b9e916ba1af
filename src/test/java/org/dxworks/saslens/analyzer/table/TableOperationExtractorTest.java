package org.dxworks.saslens.analyzer.table;

import org.dxworks.saslens.analyzer.AnalysisOptions;
import org.dxworks.saslens.analyzer.SasAnalyzer;
import org.dxworks.saslens.model.AnalysisReport;
import org.dxworks.saslens.model.AnomalyType;
import org.dxworks.saslens.model.DatabaseHandle;
import org.dxworks.saslens.model.DatabaseType;
import org.dxworks.saslens.model.TableOperation;
import org.dxworks.saslens.model.TableReference;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class TableOperationExtractorTest {

    private static AnalysisReport analyze(String source) {
        return SasAnalyzer.analyze(source, new AnalysisOptions().withDatabaseOnly(true));
    }

    private static DatabaseHandle database(AnalysisReport report, String name) {
        return report.databases.stream()
                .filter(d -> d.databaseName.equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no database " + name));
    }

    private static TableReference table(DatabaseHandle handle, String name) {
        return handle.operationTables.stream()
                .filter(t -> t.tableName.equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no table " + name));
    }

    @Test
    void readsThroughOracleLibrary() {
        AnalysisReport report = analyze(
                "libname dwh oracle user=scott path=\"ORCL\";\nproc sql;\n  select * from dwh.customers;\nquit;");

        assertEquals(1, report.databases.size());
        DatabaseHandle dwh = report.databases.get(0);
        assertEquals("dwh", dwh.databaseName);
        assertEquals(DatabaseType.ORACLE, dwh.databaseType);
        assertEquals("user=scott path=\"ORCL\"", dwh.connectionDetail);
        assertEquals(EnumSet.of(TableOperation.SELECT), table(dwh, "customers").operations);
        assertTrue(report.anomalies.isEmpty());
    }

    @Test
    void operationsOnTheSameTableAccumulate() {
        AnalysisReport report = analyze(String.join("\n",
                "libname dwh oracle user=u;",
                "proc sql;",
                "  create table work.j as select o.id from dwh.orders o inner join dwh.customers c on o.cid = c.id;",
                "  update dwh.orders set status = 'X' where id = 1;",
                "quit;"));

        DatabaseHandle dwh = database(report, "dwh");
        assertEquals(2, dwh.operationTables.size());
        assertEquals(EnumSet.of(TableOperation.SELECT, TableOperation.UPDATE), table(dwh, "orders").operations);
        assertEquals(EnumSet.of(TableOperation.SELECT), table(dwh, "customers").operations);
    }

    @Test
    void classifiesWritesAndViews() {
        AnalysisReport report = analyze(String.join("\n",
                "libname dwh oracle;",
                "libname stg oracle;",
                "proc sql;",
                "  delete from stg.stage where load_id = 3;",
                "  create view stg.v_cust as select * from dwh.customers;",
                "  select * into stg.snapshot from dwh.customers;",
                "quit;"));

        DatabaseHandle stg = database(report, "stg");
        assertEquals(EnumSet.of(TableOperation.DELETE), table(stg, "stage").operations);
        assertEquals(EnumSet.of(TableOperation.CREATE_VIEW), table(stg, "v_cust").operations);
        assertEquals(EnumSet.of(TableOperation.SELECT_INTO), table(stg, "snapshot").operations);

        DatabaseHandle dwh = database(report, "dwh");
        assertEquals(1, dwh.operationTables.size());
        assertEquals(EnumSet.of(TableOperation.SELECT), table(dwh, "customers").operations);
    }

    @Test
    void declarationOrderIsKept() {
        AnalysisReport report = analyze(String.join("\n",
                "libname b oracle;",
                "libname a oracle;",
                "libname unused oracle;",
                "proc sql;",
                "  select * from a.t1;",
                "  select * from b.t2;",
                "quit;"));

        assertEquals(2, report.databases.size());
        assertEquals("b", report.databases.get(0).databaseName);
        assertEquals("a", report.databases.get(1).databaseName);
    }

    @Test
    void undeclaredAliasIsReportedOnce() {
        AnalysisReport report = analyze(
                "proc sql;\n  select * from mystery.t1;\n  select * from MYSTERY.t2;\nquit;");

        assertEquals(1, report.databases.size());
        DatabaseHandle handle = report.databases.get(0);
        assertEquals(DatabaseType.UNKNOWN, handle.databaseType);
        assertEquals("mystery", handle.databaseName);
        assertEquals(2, handle.operationTables.size());

        assertEquals(1, report.anomalies.size());
        assertEquals(AnomalyType.UNKNOWN_LIBRARY_ALIAS, report.anomalies.get(0).type);
        assertEquals("mystery", report.anomalies.get(0).subject);
        assertEquals(2, report.anomalies.get(0).line);
    }

    @Test
    void builtinLibrariesAreNotDatabases() {
        AnalysisReport report = analyze(
                "proc sql;\n  create table work.a as select * from sashelp.class;\n  select * from sasuser.x;\nquit;");

        assertTrue(report.databases.isEmpty());
        assertTrue(report.anomalies.isEmpty());
    }

    @Test
    void tablesOutsideProcSqlAreIgnored() {
        AnalysisReport report = analyze("libname dwh oracle;\ndata dwh.out; set dwh.in; run;");

        assertTrue(report.databases.isEmpty());
    }

    @Test
    void datasetOptionsFallBackToKeywordScan() {
        AnalysisReport report = analyze(
                "libname d oracle;\nproc sql;\n  select id from d.t(where=(amount > 0) keep=id amount) where id > 1;\nquit;");

        assertEquals(EnumSet.of(TableOperation.SELECT), table(database(report, "d"), "t").operations);
    }

    @Test
    void passThroughQueriesAreNotAttributedToLibraries() {
        AnalysisReport report = analyze(String.join("\n",
                "libname d oracle;",
                "proc sql;",
                "  connect to oracle (user=u);",
                "  create table work.r as select * from connection to oracle (select * from d.remote);",
                "  execute (delete from d.remote2) by oracle;",
                "  disconnect from oracle;",
                "quit;"));

        assertTrue(report.databases.isEmpty());
        assertTrue(report.anomalies.isEmpty());
    }

    @Test
    void teradataLibraryReportsItsTableFamily() {
        AnalysisReport report = analyze(String.join("\n",
                "%let mart_lib = DATA_MART;",
                "%let risk_schema = RISK_DB;",
                "libname &mart_lib TERADATA server=\"tdprod\" schema=\"&risk_schema\";",
                "libname RSK_CALC TERADATA server=\"tdprod\" schema=\"RISK_CALC_DB\";",
                "proc sql;",
                "  create table work.factors as select * from RSK_CALC.risk_factors f where f.active = 1;",
                "  insert into &mart_lib..risk_results select * from work.factors;",
                "quit;"));

        assertEquals(2, report.databases.size());

        DatabaseHandle mart = report.databases.get(0);
        assertEquals("RISK_DB", mart.databaseName);
        assertEquals(DatabaseType.TERADATA, mart.databaseType);
        assertEquals("server=\"tdprod\" schema=\"RISK_DB\"", mart.connectionDetail);
        TableReference family = mart.operationTables.get(0);
        assertEquals("DATA_MART", family.tableName);
        assertEquals(Boolean.TRUE, family.tableFamily);
        assertEquals(EnumSet.of(TableOperation.INSERT), family.operations);
        assertEquals(EnumSet.of(TableOperation.INSERT), table(mart, "risk_results").operations);
        assertNull(table(mart, "risk_results").tableFamily);

        DatabaseHandle calc = report.databases.get(1);
        assertEquals("RISK_CALC_DB", calc.databaseName);
        assertEquals("RSK_CALC", calc.operationTables.get(0).tableName);
        assertEquals(EnumSet.of(TableOperation.SELECT), table(calc, "risk_factors").operations);
    }

    @Test
    void macroVariableResolvesToDeclaredLibrary() {
        AnalysisReport report = analyze(String.join("\n",
                "%let mart_lib = DATA_MART;",
                "libname DATA_MART oracle path=mart;",
                "proc sql;",
                "  insert into &mart_lib..risk_results select * from work.factors;",
                "quit;"));

        DatabaseHandle mart = database(report, "DATA_MART");
        assertEquals(EnumSet.of(TableOperation.INSERT), table(mart, "risk_results").operations);
        assertTrue(report.anomalies.isEmpty());
    }

    @Test
    void teradataSchemaQualifiedTablesBelongToTheirHandle() {
        AnalysisReport report = analyze(String.join("\n",
                "libname RSK_CALC TERADATA server=\"t1\" schema=\"RISK_DB\";",
                "proc sql;",
                "  select * from risk_db.risk_factors;",
                "quit;"));

        assertEquals(1, report.databases.size());
        DatabaseHandle handle = report.databases.get(0);
        assertEquals("RISK_DB", handle.databaseName);
        assertEquals(DatabaseType.TERADATA, handle.databaseType);
        assertEquals("RSK_CALC", handle.operationTables.get(0).tableName);
        assertEquals(EnumSet.of(TableOperation.SELECT), handle.operationTables.get(0).operations);
        assertEquals(EnumSet.of(TableOperation.SELECT), table(handle, "risk_factors").operations);
        assertTrue(report.anomalies.isEmpty());
    }
}
