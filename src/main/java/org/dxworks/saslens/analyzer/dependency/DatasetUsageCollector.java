package org.dxworks.saslens.analyzer.dependency;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.model.DatasetUsage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Datasets named by DATA steps and procedure options.
 * {@code data} statements write, {@code set}/{@code merge} read; on procedure statements
 * {@code data=} reads and {@code out=} writes.
 */
final class DatasetUsageCollector {

    private static final Pattern DATASET_NAME = Pattern.compile("^[A-Za-z_&][A-Za-z0-9_&.]*$");
    private static final Pattern OUT_OPTION = Pattern.compile("(?i)\\bout\\s*=\\s*([A-Za-z_&][A-Za-z0-9_&.]*)");
    private static final Pattern DATA_OPTION = Pattern.compile("(?i)\\bdata\\s*=\\s*([A-Za-z_&][A-Za-z0-9_&.]*)");

    private DatasetUsageCollector() {
        // utility class
    }

    static void collect(SasStatement statement, String body, DatasetUsage usage) {
        String keyword = statement.getKeyword();
        if (keyword == null || body == null) return;

        switch (keyword) {
            case "data":
                for (String name : datasetList(body.substring(keyword.length()))) {
                    if (!name.equalsIgnoreCase("_null_")) usage.output.add(name);
                }
                break;
            case "set":
            case "merge":
                usage.input.addAll(datasetList(body.substring(keyword.length())));
                break;
            case "proc":
                Matcher in = DATA_OPTION.matcher(body);
                while (in.find()) usage.input.add(in.group(1));
                break;
            default:
                break;
        }

        if (!"data".equals(keyword)) {
            Matcher out = OUT_OPTION.matcher(body);
            while (out.find()) usage.output.add(out.group(1));
        }
    }

    /**
     * Dataset names of a {@code data}, {@code set} or {@code merge} list, skipping dataset options
     * in parentheses and {@code option=value} pairs. Stops at a {@code /}.
     */
    static List<String> datasetList(String text) {
        List<String> names = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '/') break;
            if (c == '(') {
                i = skipParens(text, i);
                continue;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(text.charAt(i)) && "(=/".indexOf(text.charAt(i)) < 0) i++;
            String token = text.substring(start, i);
            int next = i;
            while (next < n && Character.isWhitespace(text.charAt(next))) next++;
            if (next < n && text.charAt(next) == '=') {
                // option=value: skip the value too
                i = next + 1;
                while (i < n && Character.isWhitespace(text.charAt(i))) i++;
                while (i < n && !Character.isWhitespace(text.charAt(i)) && text.charAt(i) != '/') i++;
                continue;
            }
            if (token.isEmpty()) {
                i++;
                continue;
            }
            if (DATASET_NAME.matcher(token).matches()) names.add(token);
        }
        return names;
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
}
