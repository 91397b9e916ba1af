package org.dxworks.saslens.analyzer.segment;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.model.Anomaly;
import org.dxworks.saslens.model.AnomalyType;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups scanned statements into macro definitions, PROC SQL blocks and residual top-level code.
 *
 * Macro definitions nest; each {@code %mend} closes the innermost open definition. A PROC SQL
 * block runs to its {@code quit}; when the macro it opened in ends first, the block is cut off
 * at that {@code %mend}. Whatever is still open at end of input runs to end of input. All of
 * these irregularities are reported as anomalies.
 */
public final class StatementSegmenter {

    private static final Pattern MACRO_HEADER = Pattern.compile(
            "^%macro\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern MACRO_END = Pattern.compile(
            "^%mend(?:\\s+([A-Za-z_][A-Za-z0-9_]*))?", Pattern.CASE_INSENSITIVE);

    private StatementSegmenter() {
        // utility class
    }

    public static SegmentedSource segment(ScannedSource scanned) {
        List<SasStatement> statements = scanned.getStatements();
        int count = statements.size();
        MacroDefinition[] owners = new MacroDefinition[count];
        QueryBlock[] queries = new QueryBlock[count];
        Map<MacroDefinition, int[]> delimiters = new IdentityHashMap<>();
        List<MacroDefinition> macros = new ArrayList<>();
        List<QueryBlock> queryBlocks = new ArrayList<>();
        List<Anomaly> anomalies = new ArrayList<>();

        Deque<MacroDefinition> open = new ArrayDeque<>();
        QueryBlock query = null;

        for (SasStatement st : statements) {
            int i = st.getIndex();
            MacroDefinition current = open.peek();

            if (st.hasKeyword("%macro")) {
                MacroDefinition macro = openMacro(scanned, st, open.size(), current);
                if (macro != null) {
                    macros.add(macro);
                    delimiters.put(macro, new int[]{i, -1});
                    open.push(macro);
                    owners[i] = macro;
                    continue;
                }
            }

            if (st.hasKeyword("%mend")) {
                if (current == null) {
                    anomalies.add(scanned.anomaly(AnomalyType.UNMATCHED_MACRO_END, st.getCodeStart(), null,
                            "%mend without an open macro definition"));
                } else {
                    String named = endName(st);
                    if (named != null && !named.equalsIgnoreCase(current.name)) {
                        anomalies.add(scanned.anomaly(AnomalyType.MISMATCHED_MACRO_END, st.getCodeStart(), named,
                                "%mend " + named + " closes macro " + current.name));
                    }
                    if (query != null && query.getOwner() == current) {
                        query.cutOff(st.getStart());
                        anomalies.add(scanned.anomaly(AnomalyType.UNTERMINATED_QUERY_BLOCK, query.getStart(), current.name,
                                "PROC SQL block has no QUIT before the end of macro " + current.name));
                        query = null;
                    }
                    current.bodyEnd = st.getStart();
                    current.endOffset = st.getEnd();
                    current.endLine = scanned.lineOf(Math.max(st.getCodeStart(), st.getEnd() - 1));
                    delimiters.get(current)[1] = i;
                    owners[i] = current;
                    open.pop();
                    continue;
                }
            }

            owners[i] = current;

            if (query == null) {
                if (st.hasKeyword("proc") && "sql".equals(st.getSecondKeyword())) {
                    query = new QueryBlock(st, current);
                    queryBlocks.add(query);
                    queries[i] = query;
                }
                continue;
            }

            queries[i] = query;
            if (st.hasKeyword("quit")) {
                query.close(st);
                query = null;
            } else {
                query.add(st);
            }
        }

        int length = scanned.length();
        if (query != null) {
            query.cutOff(length);
            anomalies.add(scanned.anomaly(AnomalyType.UNTERMINATED_QUERY_BLOCK, query.getStart(),
                    query.getOwner() == null ? null : query.getOwner().name,
                    "PROC SQL block has no QUIT before end of input"));
        }
        while (!open.isEmpty()) {
            MacroDefinition macro = open.pop();
            macro.terminated = false;
            macro.bodyEnd = length;
            macro.endOffset = length;
            macro.endLine = scanned.lineOf(Math.max(macro.startOffset, length - 1));
            anomalies.add(scanned.anomaly(AnomalyType.UNTERMINATED_MACRO, macro.startOffset, macro.name,
                    "Macro " + macro.name + " has no %mend before end of input"));
        }

        assignBlockIds(macros);
        List<Segment> segments = buildSegments(statements, owners, queries, delimiters);
        return new SegmentedSource(scanned, segments, macros, queryBlocks, owners, queries, delimiters, anomalies);
    }

    private static MacroDefinition openMacro(ScannedSource scanned, SasStatement st, int depth, MacroDefinition parent) {
        Matcher m = MACRO_HEADER.matcher(st.codeBody());
        if (!m.matches()) return null;
        MacroDefinition macro = new MacroDefinition(m.group(1), parameterList(m.group(2)), st.getCodeStart(), st.getEnd(), depth);
        macro.startLine = scanned.lineOf(st.getCodeStart());
        macro.endOffset = st.getEnd();
        macro.bodyEnd = st.getEnd();
        if (parent != null) {
            macro.parent = parent.name;
            macro.parentDefinition = parent;
        }
        return macro;
    }

    // Text between the balanced parentheses that follow the macro name
    static String parameterList(String afterName) {
        if (afterName == null) return null;
        String s = afterName.trim();
        if (s.isEmpty() || s.charAt(0) != '(') return null;
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return s.substring(1, i).trim();
            }
        }
        return s.substring(1).trim();
    }

    private static String endName(SasStatement st) {
        Matcher m = MACRO_END.matcher(st.codeBody());
        return m.find() ? m.group(1) : null;
    }

    private static void assignBlockIds(List<MacroDefinition> macros) {
        Map<String, Integer> seen = new HashMap<>();
        for (MacroDefinition macro : macros) {
            String key = macro.name.toLowerCase(Locale.ROOT);
            int n = seen.merge(key, 1, Integer::sum);
            macro.blockId = n == 1 ? macro.name : macro.name + "#" + n;
        }
    }

    private static List<Segment> buildSegments(List<SasStatement> statements, MacroDefinition[] owners,
                                               QueryBlock[] queries, Map<MacroDefinition, int[]> delimiters) {
        List<Segment> segments = new ArrayList<>();
        List<SasStatement> residual = new ArrayList<>();
        int i = 0;
        while (i < statements.size()) {
            SasStatement st = statements.get(i);
            MacroDefinition owner = owners[i];
            QueryBlock query = queries[i];

            if (owner != null && owner.depth == 0 && delimiters.get(owner)[0] == i) {
                flush(segments, residual);
                int last = delimiters.get(owner)[1];
                if (last < 0) last = lastOwnedIndex(owners, owner, i);
                segments.add(new Segment(SegmentType.MACRO_DEFINITION, new ArrayList<>(statements.subList(i, last + 1)), owner, null));
                i = last + 1;
                continue;
            }

            if (owner == null && query != null && query.getFirstIndex() == i) {
                flush(segments, residual);
                int last = Math.max(i, query.getLastIndex());
                segments.add(new Segment(SegmentType.QUERY, new ArrayList<>(statements.subList(i, last + 1)), null, query));
                i = last + 1;
                continue;
            }

            residual.add(st);
            i++;
        }
        flush(segments, residual);
        return segments;
    }

    // An unterminated top-level macro owns everything up to end of input, nested children included
    private static int lastOwnedIndex(MacroDefinition[] owners, MacroDefinition macro, int from) {
        int last = from;
        for (int j = from; j < owners.length; j++) {
            if (encloses(macro, owners[j])) last = j;
        }
        return last;
    }

    private static boolean encloses(MacroDefinition outer, MacroDefinition inner) {
        for (MacroDefinition m = inner; m != null; m = m.parentDefinition) {
            if (m == outer) return true;
        }
        return false;
    }

    private static void flush(List<Segment> segments, List<SasStatement> residual) {
        if (residual.isEmpty()) return;
        segments.add(new Segment(SegmentType.TOP_LEVEL, new ArrayList<>(residual), null, null));
        residual.clear();
    }
}
