package org.dxworks.saslens.analyzer.text;

import org.dxworks.saslens.model.AnomalyType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexical pass over SAS source: cuts the text into {@code ;}-terminated statements while skipping
 * block comments, statement comments ({@code * ...;} and {@code %* ...;}), string literals and
 * inline DATALINES/CARDS data.
 *
 * Never fails: unterminated comments, literals and statements run to end of input and are
 * reported as anomalies on the returned {@link ScannedSource}.
 */
public final class SasSourceScanner {

    private static final Set<String> DATA_LINES_KEYWORDS = Set.of("datalines", "cards", "lines", "parmcards");
    private static final Set<String> DATA_LINES4_KEYWORDS = Set.of("datalines4", "cards4", "lines4", "parmcards4");

    private SasSourceScanner() {
        // utility class
    }

    public static ScannedSource scan(String source) {
        State state = new State(source);
        int n = source.length();
        int i = 0;

        while (i < n) {
            char c = source.charAt(i);

            if (c == '/' && i + 1 < n && source.charAt(i + 1) == '*') {
                i = skipBlockComment(state, i);
                continue;
            }

            if (state.codeStart < 0) {
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                if (c == '*' || (c == '%' && i + 1 < n && source.charAt(i + 1) == '*')) {
                    i = readCommentStatement(state, i);
                    continue;
                }
                state.codeStart = i;
            }

            if (c == '\'' || c == '"') {
                i = skipLiteral(state, i, c);
                continue;
            }

            if (c == ';') {
                SasStatement st = state.emit(i + 1, SasStatement.Kind.CODE, true);
                i = i + 1;
                if (st.getKeyword() != null && DATA_LINES_KEYWORDS.contains(st.getKeyword())) {
                    i = readDataLines(state, i, ";");
                } else if (st.getKeyword() != null && DATA_LINES4_KEYWORDS.contains(st.getKeyword())) {
                    i = readDataLines(state, i, ";;;;");
                }
                continue;
            }
            i++;
        }

        if (state.start < n) {
            if (state.codeStart >= 0) {
                String tail = String.valueOf(state.masked, state.codeStart, n - state.codeStart).trim();
                state.emit(n, SasStatement.Kind.CODE, false);
                // a trailing macro call such as "%main" needs no semicolon
                if (!tail.startsWith("%")) {
                    state.pending(AnomalyType.UNTERMINATED_STATEMENT, state.lastCodeStart, null,
                            "Statement is not terminated by ';' before end of input");
                }
            } else {
                state.emit(n, SasStatement.Kind.TRIVIA, true);
            }
        }

        return state.build();
    }

    private static int skipBlockComment(State state, int from) {
        String source = state.source;
        int close = source.indexOf("*/", from + 2);
        int end = close < 0 ? source.length() : close + 2;
        state.blankCode(from, end);
        state.blankMasked(from, end);
        if (close < 0) {
            state.pending(AnomalyType.UNTERMINATED_COMMENT, from, null, "Block comment is not closed before end of input");
        }
        return end;
    }

    private static int readCommentStatement(State state, int from) {
        String source = state.source;
        int semi = source.indexOf(';', from);
        int end = semi < 0 ? source.length() : semi + 1;
        state.blankCode(from, end);
        state.blankMasked(from, end);
        state.codeStart = from;
        state.emit(end, SasStatement.Kind.COMMENT, semi >= 0);
        if (semi < 0) {
            state.pending(AnomalyType.UNTERMINATED_COMMENT, from, null, "Comment statement is not closed by ';' before end of input");
        }
        return end;
    }

    private static int skipLiteral(State state, int from, char quote) {
        String source = state.source;
        int n = source.length();
        int i = from + 1;
        while (i < n) {
            if (source.charAt(i) == quote) {
                // doubled quote is an escaped quote inside the literal
                if (i + 1 < n && source.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                state.blankMasked(from + 1, i);
                return i + 1;
            }
            i++;
        }
        state.blankMasked(from + 1, n);
        state.pending(AnomalyType.UNTERMINATED_LITERAL, from, null, "String literal is not closed before end of input");
        return n;
    }

    private static int readDataLines(State state, int from, String terminator) {
        String source = state.source;
        int close = source.indexOf(terminator, from);
        int end = close < 0 ? source.length() : close + terminator.length();
        if (end <= from) return from;
        state.blankMasked(from, end);
        state.codeStart = firstNonWhitespace(source, from, end);
        state.emit(end, SasStatement.Kind.DATA_LINES, close >= 0);
        if (close < 0) {
            state.pending(AnomalyType.UNTERMINATED_STATEMENT, from, null, "Inline data is not terminated before end of input");
        }
        return end;
    }

    private static int firstNonWhitespace(String s, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(s.charAt(i))) return i;
        }
        return from;
    }

    /** Mutable scanning state for one run */
    private static final class State {
        final String source;
        final char[] code;
        final char[] masked;
        final List<SasStatement> statements = new ArrayList<>();
        final List<PendingAnomaly> pendingAnomalies = new ArrayList<>();
        int start = 0;
        int codeStart = -1;
        int lastCodeStart = 0;

        State(String source) {
            this.source = source;
            this.code = source.toCharArray();
            this.masked = source.toCharArray();
        }

        SasStatement emit(int end, SasStatement.Kind kind, boolean terminated) {
            int cs = codeStart < 0 ? end : codeStart;
            SasStatement st = new SasStatement(
                    statements.size(), start, cs, end,
                    source.substring(start, end),
                    String.valueOf(code, start, end - start),
                    String.valueOf(masked, start, end - start),
                    kind, terminated);
            statements.add(st);
            lastCodeStart = cs;
            start = end;
            codeStart = -1;
            return st;
        }

        void blankCode(int from, int to) {
            blank(code, from, to);
        }

        void blankMasked(int from, int to) {
            blank(masked, from, to);
        }

        void pending(AnomalyType type, int offset, String subject, String message) {
            pendingAnomalies.add(new PendingAnomaly(type, offset, subject, message));
        }

        ScannedSource build() {
            ScannedSource out = new ScannedSource(source, new String(code), new String(masked), statements);
            for (PendingAnomaly a : pendingAnomalies) {
                out.addAnomaly(a.type, a.offset, a.subject, a.message);
            }
            return out;
        }

        // Newlines survive blanking so line numbers stay aligned
        private static void blank(char[] chars, int from, int to) {
            for (int i = from; i < to && i < chars.length; i++) {
                if (chars[i] != '\n' && chars[i] != '\r') chars[i] = ' ';
            }
        }
    }

    // Line numbers need the finished source, so anomalies wait until build()
    private static final class PendingAnomaly {
        final AnomalyType type;
        final int offset;
        final String subject;
        final String message;

        PendingAnomaly(AnomalyType type, int offset, String subject, String message) {
            this.type = type;
            this.offset = offset;
            this.subject = subject;
            this.message = message;
        }
    }
}
