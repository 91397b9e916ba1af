package org.dxworks.saslens.analyzer.table;

public final class SasSqlText {

    private SasSqlText() {
        // utility class
    }

    public static String stripQuotes(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') ||
                (first == '\'' && last == '\'') ||
                (first == '`' && last == '`')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    /**
     * Splits a two-level name into library alias and member name.
     * Returns null for unqualified names and for names with more than two levels.
     */
    public static String[] splitQualified(String combined) {
        if (combined == null) {
            return null;
        }
        String[] parts = combined.trim().split("\\.");
        if (parts.length != 2) {
            return null;
        }
        String alias = stripQuotes(parts[0]);
        String name = stripQuotes(parts[1]);
        if (alias.isEmpty() || name.isEmpty()) {
            return null;
        }
        return new String[]{alias, name};
    }

    /**
     * Blanks the contents of quoted literals, keeping the quotes and the length of the text.
     * A doubled quote inside a literal is an escaped quote.
     */
    public static String maskLiterals(String text) {
        if (text == null || (text.indexOf('\'') < 0 && text.indexOf('"') < 0)) return text;
        char[] out = text.toCharArray();
        int i = 0;
        while (i < out.length) {
            char c = out[i];
            if (c != '\'' && c != '"') {
                i++;
                continue;
            }
            int j = i + 1;
            while (j < out.length) {
                if (text.charAt(j) == c) {
                    if (j + 1 < out.length && text.charAt(j + 1) == c) {
                        out[j] = ' ';
                        out[j + 1] = ' ';
                        j += 2;
                        continue;
                    }
                    break;
                }
                if (out[j] != '\n') out[j] = ' ';
                j++;
            }
            i = j + 1;
        }
        return new String(out);
    }
}
