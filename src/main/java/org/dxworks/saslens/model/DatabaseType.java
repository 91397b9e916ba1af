package org.dxworks.saslens.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of database dialects a LIBNAME engine can bind to.
 * Engines outside the set map to {@link #GENERIC}; {@link #UNKNOWN} marks table
 * references whose library alias was never declared.
 */
public enum DatabaseType {
    BASE("base", "v9", "v8", "v7", "v6", "spde"),
    ORACLE("oracle"),
    SQL_SERVER("sqlsvr"),
    ODBC("odbc"),
    OLEDB("oledb"),
    DB2("db2"),
    TERADATA("TERADATA"),
    BIGQUERY("bigquery"),
    SNOWFLAKE("snow"),
    REDSHIFT("redshift"),
    POSTGRES("postgres"),
    MYSQL("mysql"),
    NETEZZA("netezza"),
    GREENPLUM("greenplm"),
    HADOOP("hadoop"),
    IMPALA("impala"),
    SPARK("spark"),
    SAP_HANA("saphana"),
    GENERIC("generic"),
    UNKNOWN("unknown");

    private final String tag;
    private final String[] engines;

    DatabaseType(String tag, String... engines) {
        this.tag = tag;
        this.engines = engines;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    public boolean matchesEngine(String engine) {
        if (engine == null) return false;
        if (tag.equalsIgnoreCase(engine)) return true;
        for (String alias : engines) {
            if (alias.equalsIgnoreCase(engine)) return true;
        }
        return false;
    }

    /**
     * Maps a LIBNAME engine token to its dialect, case-insensitively.
     */
    public static DatabaseType fromEngine(String engine) {
        if (engine == null || engine.isBlank()) return GENERIC;
        String token = engine.trim().toLowerCase(Locale.ROOT);
        for (DatabaseType type : values()) {
            if (type == GENERIC || type == UNKNOWN) continue;
            if (type.matchesEngine(token)) return type;
        }
        return GENERIC;
    }
}
