package org.dxworks.saslens.analyzer.library;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.analyzer.variable.VariableResolver;
import org.dxworks.saslens.model.DatabaseHandle;
import org.dxworks.saslens.model.DatabaseType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Library aliases declared with LIBNAME in one source unit.
 * Aliases are case-insensitive; redeclaring an alias replaces the earlier handle.
 */
public class LibraryRegistry {

    private static final Pattern LIBNAME_STATEMENT = Pattern.compile(
            "^libname\\s+([A-Za-z_][A-Za-z0-9_]*)\\.?(?:\\s+(.*))?$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern ENGINE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)(.*)$", Pattern.DOTALL);

    private static final Set<String> NON_DECLARATIONS = Set.of("clear", "list");

    private static final Set<String> BUILTIN_LIBRARIES = Set.of("WORK", "SASHELP", "SASUSER", "MAPS", "MAPSGFK", "MAPSSAS");

    private final Map<String, DatabaseHandle> handles = new LinkedHashMap<>();

    /**
     * Collects every LIBNAME declaration of the unit, in source order, after variable substitution.
     */
    public static LibraryRegistry fromSource(ScannedSource source, VariableResolver resolver) {
        LibraryRegistry registry = new LibraryRegistry();
        for (SasStatement statement : source.getStatements()) {
            if (!statement.hasKeyword("libname")) continue;
            String body = resolver == null ? statement.codeBody() : resolver.substitute(statement.codeBody());
            DatabaseHandle handle = parseLibname(body);
            if (handle == null) continue;
            handle.declarationOffset = statement.getCodeStart();
            registry.register(handle);
        }
        return registry;
    }

    /**
     * Parses one LIBNAME statement body (no trailing semicolon, variables already substituted).
     * Returns null for statements that do not bind an alias, such as {@code libname x clear}.
     */
    public static DatabaseHandle parseLibname(String body) {
        if (body == null) return null;
        Matcher m = LIBNAME_STATEMENT.matcher(body.trim());
        if (!m.matches()) return null;

        String alias = m.group(1);
        String rest = m.group(2) == null ? "" : m.group(2).trim();
        if (rest.isEmpty() || "_all_".equalsIgnoreCase(alias)) return null;

        char first = rest.charAt(0);
        if (first == '\'' || first == '"' || first == '(') {
            return new DatabaseHandle(alias, alias, DatabaseType.BASE, rest);
        }

        Matcher em = ENGINE.matcher(rest);
        if (!em.matches()) return null;
        String engine = em.group(1);
        if (NON_DECLARATIONS.contains(engine.toLowerCase(Locale.ROOT))) return null;
        String detail = em.group(2).trim();

        DatabaseType type = DatabaseType.fromEngine(engine);
        DatabaseHandle handle = new DatabaseHandle(alias, alias, type, detail);
        if (type == DatabaseType.GENERIC) {
            handle.engine = engine;
        } else if (type == DatabaseType.TERADATA) {
            handle.databaseName = teradataDatabaseName(alias, detail);
        }
        return handle;
    }

    // schema= wins over database=; the alias is the last resort
    static String teradataDatabaseName(String alias, String detail) {
        String schema = LibnameOptions.value(detail, LibnameOptions.SCHEMA);
        if (schema != null && !schema.isEmpty()) return schema;
        String database = LibnameOptions.value(detail, LibnameOptions.DATABASE);
        if (database != null && !database.isEmpty()) return database;
        return alias;
    }

    public void register(DatabaseHandle handle) {
        if (handle == null || handle.alias == null) return;
        String key = key(handle.alias);
        handles.remove(key);
        handles.put(key, handle);
    }

    public DatabaseHandle lookup(String alias) {
        if (alias == null) return null;
        return handles.get(key(alias));
    }

    /**
     * Teradata handle whose database name matches, for tables qualified by the schema instead
     * of the declared name. The latest declaration wins.
     */
    public DatabaseHandle lookupByDatabaseName(String databaseName) {
        if (databaseName == null) return null;
        DatabaseHandle found = null;
        for (DatabaseHandle handle : handles.values()) {
            if (handle.databaseType == DatabaseType.TERADATA && databaseName.equalsIgnoreCase(handle.databaseName)) {
                found = handle;
            }
        }
        return found;
    }

    public boolean isDeclared(String alias) {
        return lookup(alias) != null;
    }

    /**
     * Libraries SAS assigns itself. They are neither databases nor unknown aliases,
     * unless the unit redeclares them.
     */
    public boolean isBuiltin(String alias) {
        return alias != null && !isDeclared(alias) && BUILTIN_LIBRARIES.contains(key(alias));
    }

    public List<DatabaseHandle> getHandles() {
        return new ArrayList<>(handles.values());
    }

    public int size() {
        return handles.size();
    }

    private static String key(String alias) {
        return alias.trim().toUpperCase(Locale.ROOT);
    }
}
