package org.dxworks.saslens.analyzer.table;

import org.dxworks.saslens.model.TableOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based classification of PROC SQL statements.
 * JSqlParser rejects SAS specifics such as dataset options, pass-through queries and
 * {@code into :macrovar}, so this scanner takes over for those statements.
 * Works on text whose literal contents are blanked.
 */
final class RegexStatementClassifier {

    private static final String NAME = "[A-Za-z_][A-Za-z0-9_]*";
    private static final String QUALIFIED = "(" + NAME + ")\\s*\\.\\s*(" + NAME + ")";

    private static final Pattern CREATE = Pattern.compile(
            "^create\\s+(table|view)\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERT = Pattern.compile(
            "^insert\\s+(?:into\\s+)?" + QUALIFIED, Pattern.CASE_INSENSITIVE);
    private static final Pattern UPDATE = Pattern.compile(
            "^update\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE);
    private static final Pattern DELETE = Pattern.compile(
            "^delete\\s+from\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_INTO = Pattern.compile(
            "\\binto\\s+" + QUALIFIED, Pattern.CASE_INSENSITIVE);
    private static final Pattern SOURCE_KEYWORD = Pattern.compile(
            "\\b(?:from|join)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ITEM_NAME = Pattern.compile(
            NAME + "(?:\\s*\\.\\s*" + NAME + ")?");
    private static final Pattern ITEM_QUALIFIED = Pattern.compile("^" + QUALIFIED + "$");
    // SQL sent as-is to the database: its tables are not library members
    private static final Pattern PASS_THROUGH = Pattern.compile(
            "(?:\\bconnection\\s+to\\s+" + NAME + "\\s*|^execute\\s*)\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern CORRELATION = Pattern.compile(
            "\\s*(?:as\\s+)?(" + NAME + ")", Pattern.CASE_INSENSITIVE);

    private RegexStatementClassifier() {
        // utility class
    }

    /**
     * @param masked statement text without its terminating semicolon, literal contents blanked
     */
    static List<TableUse> classify(String masked) {
        List<TableUse> uses = new ArrayList<>();
        if (masked == null) return uses;
        String sql = blankPassThrough(masked.trim());
        if (sql.isBlank()) return uses;

        int skipFrom = -1;

        Matcher m = CREATE.matcher(sql);
        if (m.find()) {
            TableOperation op = "view".equalsIgnoreCase(m.group(1)) ? TableOperation.CREATE_VIEW : TableOperation.CREATE_TABLE;
            uses.add(new TableUse(m.group(2), m.group(3), op));
        }

        m = INSERT.matcher(sql);
        if (m.find()) {
            uses.add(new TableUse(m.group(1), m.group(2), TableOperation.INSERT));
        }

        m = UPDATE.matcher(sql);
        if (m.find()) {
            uses.add(new TableUse(m.group(1), m.group(2), TableOperation.UPDATE));
        }

        m = DELETE.matcher(sql);
        if (m.find()) {
            uses.add(new TableUse(m.group(1), m.group(2), TableOperation.DELETE));
            // the FROM of DELETE FROM names the target, not a source
            skipFrom = sql.toLowerCase(Locale.ROOT).indexOf("from");
        }

        if (startsWithWord(sql, "select")) {
            m = SELECT_INTO.matcher(sql);
            while (m.find()) {
                uses.add(new TableUse(m.group(1), m.group(2), TableOperation.SELECT_INTO));
            }
        }

        collectSources(sql, skipFrom, uses);
        return uses;
    }

    // FROM/JOIN items, including comma-separated lists: "from a.x t1, b.y as t2"
    private static void collectSources(String sql, int skipFrom, List<TableUse> uses) {
        Matcher kw = SOURCE_KEYWORD.matcher(sql);
        while (kw.find()) {
            if (kw.start() == skipFrom) continue;
            int pos = kw.end();
            while (pos < sql.length()) {
                pos = skipSpaces(sql, pos);
                if (pos >= sql.length()) break;

                if (sql.charAt(pos) == '(') {
                    // subquery: its own FROM is picked up by the outer loop
                    pos = skipParens(sql, pos);
                } else {
                    Matcher item = ITEM_NAME.matcher(sql);
                    item.region(pos, sql.length());
                    if (!item.lookingAt()) break;
                    Matcher q = ITEM_QUALIFIED.matcher(item.group());
                    if (q.matches()) {
                        uses.add(new TableUse(q.group(1), q.group(2), TableOperation.SELECT));
                    }
                    pos = item.end();
                    pos = skipSpaces(sql, pos);
                    // dataset options: lib.t(where=(x > 1))
                    if (pos < sql.length() && sql.charAt(pos) == '(') pos = skipParens(sql, pos);
                }

                pos = skipCorrelation(sql, pos);
                pos = skipSpaces(sql, pos);
                if (pos < sql.length() && sql.charAt(pos) == ',') {
                    pos++;
                    continue;
                }
                break;
            }
        }
    }

    static String blankPassThrough(String sql) {
        Matcher m = PASS_THROUGH.matcher(sql);
        if (!m.find()) return sql;
        char[] out = sql.toCharArray();
        do {
            int open = m.end() - 1;
            int close = skipParens(sql, open);
            for (int i = open + 1; i < close - 1; i++) out[i] = ' ';
        } while (m.find());
        return new String(out);
    }

    private static int skipCorrelation(String sql, int pos) {
        Matcher c = CORRELATION.matcher(sql);
        c.region(pos, sql.length());
        if (!c.lookingAt()) return pos;
        if (isClauseKeyword(c.group(1))) return pos;
        return c.end();
    }

    private static boolean isClauseKeyword(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "where":
            case "group":
            case "order":
            case "having":
            case "on":
            case "using":
            case "inner":
            case "left":
            case "right":
            case "full":
            case "cross":
            case "natural":
            case "join":
            case "union":
            case "except":
            case "intersect":
            case "outer":
            case "set":
            case "values":
            case "select":
                return true;
            default:
                return false;
        }
    }

    private static int skipSpaces(String s, int pos) {
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return pos;
    }

    private static int skipParens(String s, int pos) {
        int depth = 0;
        for (int i = pos; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i + 1;
            }
        }
        return s.length();
    }

    private static boolean startsWithWord(String sql, String word) {
        if (sql.length() < word.length() || !sql.regionMatches(true, 0, word, 0, word.length())) return false;
        return sql.length() == word.length() || !Character.isLetterOrDigit(sql.charAt(word.length()));
    }
}
