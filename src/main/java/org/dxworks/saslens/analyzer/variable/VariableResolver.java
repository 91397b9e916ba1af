package org.dxworks.saslens.analyzer.variable;

import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.model.VariableBinding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flat table of macro variables built from {@code %let} statements, used to expand
 * {@code &name} references in later text.
 *
 * Names are case-insensitive and a later {@code %let} shadows an earlier one. A value is
 * expanded against the table as it stands when the {@code %let} is seen, so forward
 * references stay verbatim. References to undefined variables, and references whose
 * expansion would loop back on itself, are left as written.
 */
public class VariableResolver {

    private static final Pattern LET_STATEMENT = Pattern.compile(
            "^%let\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // "&name" with an optional "." that ends the reference
    private static final Pattern REFERENCE = Pattern.compile("&([A-Za-z_][A-Za-z0-9_]*)(\\.)?");

    private final Map<String, VariableBinding> bindings = new LinkedHashMap<>();
    private int nextOrder = 0;

    public VariableResolver() {
    }

    public VariableResolver(Map<String, String> predefined) {
        if (predefined == null) return;
        for (Map.Entry<String, String> entry : predefined.entrySet()) {
            define(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Builds a resolver from the {@code %let} statements of a scanned unit, in source order,
     * seeded with caller-supplied values.
     */
    public static VariableResolver fromSource(ScannedSource source, Map<String, String> predefined) {
        VariableResolver resolver = new VariableResolver(predefined);
        for (SasStatement statement : source.getStatements()) {
            if (!statement.hasKeyword("%let")) continue;
            Matcher m = LET_STATEMENT.matcher(statement.codeBody());
            if (m.matches()) {
                resolver.define(m.group(1), m.group(2).trim());
            }
        }
        return resolver;
    }

    public void define(String name, String rawValue) {
        if (name == null || name.isBlank()) return;
        String value = rawValue == null ? "" : substitute(rawValue);
        String key = key(name);
        bindings.remove(key);
        bindings.put(key, new VariableBinding(name.trim(), value, nextOrder++));
    }

    /**
     * Resolved value of a variable, or null when it was never defined.
     */
    public String lookup(String name) {
        if (name == null) return null;
        VariableBinding binding = bindings.get(key(name));
        return binding == null ? null : binding.value;
    }

    public boolean isDefined(String name) {
        return name != null && bindings.containsKey(key(name));
    }

    /**
     * Bindings in definition order of their latest {@code %let}.
     */
    public List<VariableBinding> getBindings() {
        List<VariableBinding> out = new ArrayList<>(bindings.values());
        out.sort((a, b) -> Integer.compare(a.order, b.order));
        return out;
    }

    /**
     * Expands every resolvable {@code &name} reference in the text, including inside quotes.
     * Applying it twice gives the same result as applying it once.
     */
    public String substitute(String text) {
        if (text == null || text.indexOf('&') < 0) return text;
        String current = text;
        Set<String> seen = new HashSet<>();
        seen.add(current);
        while (true) {
            String next = expand(current, new HashSet<>());
            // a repeated text means the expansion oscillates; stop at the last new one
            if (next == null || !seen.add(next)) return current;
            current = next;
        }
    }

    // Returns null when the expansion runs into a cycle
    private String expand(String text, Set<String> visiting) {
        Matcher m = REFERENCE.matcher(text);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(text, last, m.start());
            String replacement = resolveReference(m.group(1), visiting);
            sb.append(replacement != null ? replacement : m.group());
            last = m.end();
        }
        if (last == 0) return text;
        sb.append(text, last, text.length());
        return sb.toString();
    }

    private String resolveReference(String name, Set<String> visiting) {
        String key = key(name);
        VariableBinding binding = bindings.get(key);
        if (binding == null) return null;
        if (!visiting.add(key)) return null;
        try {
            String value = binding.value;
            if (value.indexOf('&') < 0) return value;
            Matcher m = REFERENCE.matcher(value);
            StringBuilder sb = new StringBuilder();
            int last = 0;
            while (m.find()) {
                sb.append(value, last, m.start());
                String nestedKey = key(m.group(1));
                if (bindings.containsKey(nestedKey)) {
                    String nested = resolveReference(m.group(1), visiting);
                    if (nested == null) return null;
                    sb.append(nested);
                } else {
                    sb.append(m.group());
                }
                last = m.end();
            }
            sb.append(value, last, value.length());
            return sb.toString();
        } finally {
            visiting.remove(key);
        }
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
