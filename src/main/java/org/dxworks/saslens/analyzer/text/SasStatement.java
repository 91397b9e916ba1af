package org.dxworks.saslens.analyzer.text;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One SAS statement as cut by {@link SasSourceScanner}.
 *
 * The span {@code [start, end)} includes the whitespace and block comments that precede the
 * statement, so consecutive statements tile the source. {@code code} is the span with comments
 * blanked; {@code masked} additionally blanks the inside of string literals. Both have the same
 * length as the raw text, so offsets carry over.
 */
public final class SasStatement {

    public enum Kind {
        CODE,
        COMMENT,  // * ...; or %* ...;
        DATA_LINES,  // inline data after DATALINES/CARDS
        TRIVIA  // whitespace and block comments with no statement after them
    }

    private static final Pattern LEADING_WORDS = Pattern.compile("^\\s*(%?[A-Za-z_][A-Za-z0-9_]*)(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?");

    private final int index;
    private final int start;
    private final int codeStart;
    private final int end;
    private final String text;
    private final String code;
    private final String masked;
    private final Kind kind;
    private final boolean terminated;
    private final String keyword;
    private final String secondKeyword;

    SasStatement(int index, int start, int codeStart, int end, String text, String code, String masked,
                 Kind kind, boolean terminated) {
        this.index = index;
        this.start = start;
        this.codeStart = codeStart;
        this.end = end;
        this.text = text;
        this.code = code;
        this.masked = masked;
        this.kind = kind;
        this.terminated = terminated;

        String first = null;
        String second = null;
        if (kind == Kind.CODE) {
            Matcher m = LEADING_WORDS.matcher(masked);
            if (m.find()) {
                first = m.group(1).toLowerCase(Locale.ROOT);
                second = m.group(2) == null ? null : m.group(2).toLowerCase(Locale.ROOT);
            }
        }
        this.keyword = first;
        this.secondKeyword = second;
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    /**
     * Offset of the first character that is neither whitespace nor comment.
     */
    public int getCodeStart() {
        return codeStart;
    }

    public int getEnd() {
        return end;
    }

    public String getText() {
        return text;
    }

    public String getCode() {
        return code;
    }

    public String getMasked() {
        return masked;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * First word of the statement in lower case, with a leading {@code %} kept (e.g. {@code %macro}).
     */
    public String getKeyword() {
        return keyword;
    }

    public String getSecondKeyword() {
        return secondKeyword;
    }

    public boolean isCode() {
        return kind == Kind.CODE;
    }

    public boolean hasKeyword(String word) {
        return keyword != null && keyword.equals(word);
    }

    /**
     * Comment-free statement text without the leading trivia and the terminating semicolon.
     */
    public String codeBody() {
        String body = code.substring(Math.max(0, codeStart - start)).trim();
        if (body.endsWith(";")) body = body.substring(0, body.length() - 1);
        return body.trim();
    }

    /**
     * Like {@link #codeBody()} but with string literal contents blanked.
     */
    public String maskedBody() {
        String body = masked.substring(Math.max(0, codeStart - start)).trim();
        if (body.endsWith(";")) body = body.substring(0, body.length() - 1);
        return body.trim();
    }

    @Override
    public String toString() {
        return kind + "[" + start + "," + end + ")" + (keyword == null ? "" : " " + keyword);
    }
}
