package org.dxworks.saslens.analyzer.library;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code option=value} pairs out of the connection text of a LIBNAME statement.
 */
final class LibnameOptions {

    static final String SCHEMA = "schema";
    static final String DATABASE = "database";

    private static final Map<String, Pattern> PATTERNS = Map.of(
            SCHEMA, optionPattern(SCHEMA),
            DATABASE, optionPattern(DATABASE));

    private LibnameOptions() {
        // utility class
    }

    /**
     * Value of the named option with surrounding quotes removed, or null when absent.
     */
    static String value(String detail, String option) {
        if (detail == null || option == null) return null;
        Pattern p = PATTERNS.get(option.toLowerCase(Locale.ROOT));
        if (p == null) p = optionPattern(option);
        Matcher m = p.matcher(detail);
        if (!m.find()) return null;
        if (m.group(1) != null) return m.group(1).trim();
        if (m.group(2) != null) return m.group(2).trim();
        return m.group(3).trim();
    }

    private static Pattern optionPattern(String option) {
        return Pattern.compile(
                "(?<![A-Za-z0-9_])" + Pattern.quote(option) + "\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)'|([^\\s;)]+))",
                Pattern.CASE_INSENSITIVE);
    }
}
