package org.dxworks.saslens.analyzer.dependency;

import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.analyzer.variable.VariableResolver;
import org.dxworks.saslens.model.CallKind;
import org.dxworks.saslens.model.DependencyGraph;
import org.dxworks.saslens.model.MacroCall;
import org.dxworks.saslens.model.MacroCallEdge;
import org.dxworks.saslens.model.MacroDefinition;
import org.dxworks.saslens.model.MacroStatus;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the macro call graph of one unit.
 *
 * Every {@code %name} that is not macro-language syntax is an invocation from the innermost
 * enclosing macro, or from {@link DependencyGraph#TOP_LEVEL_CALLER} outside any macro.
 * Invocations of macros defined in the unit are {@link CallKind#INTERNAL}, the rest
 * {@link CallKind#EXTERNAL}. Text inside string literals is not searched.
 */
public class DependencyGraphBuilder {

    private static final Pattern INVOCATION = Pattern.compile("(?<![A-Za-z0-9_%&])%([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern QUOTED = Pattern.compile("'([^']*)'|\"([^\"]*)\"");
    private static final Pattern INCLUDE = Pattern.compile("^%inc(?:lude)?\\s+(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final VariableResolver resolver;

    public DependencyGraphBuilder(VariableResolver resolver) {
        this.resolver = resolver;
    }

    public DependencyGraph build(SegmentedSource segmented) {
        ScannedSource scanned = segmented.getScanned();
        DependencyGraph graph = new DependencyGraph();

        Map<String, MacroDefinition> defined = new LinkedHashMap<>();
        for (MacroDefinition macro : segmented.getMacros()) {
            defined.putIfAbsent(key(macro.name), macro);
        }

        for (SasStatement statement : scanned.getStatements()) {
            if (!statement.isCode()) continue;
            MacroDefinition owner = segmented.ownerOf(statement);
            if (owner != null && segmented.isDelimiter(owner, statement)) continue;

            collectInvocations(statement, owner, defined, scanned, graph);

            if (statement.hasKeyword("%include") || statement.hasKeyword("%inc")) {
                collectInclude(statement, graph);
            } else if (segmented.queryBlockOf(statement) == null) {
                DatasetUsageCollector.collect(statement, substitute(statement.maskedBody()), graph.datasetUsage);
            }
        }

        summarize(graph);
        markInvoked(segmented, graph);
        return graph;
    }

    private void collectInvocations(SasStatement statement, MacroDefinition owner, Map<String, MacroDefinition> defined,
                                    ScannedSource scanned, DependencyGraph graph) {
        String masked = statement.getMasked();
        Matcher m = INVOCATION.matcher(masked);
        while (m.find()) {
            String name = m.group(1);
            if (MacroLanguage.isKeyword(name)) continue;

            MacroDefinition target = defined.get(key(name));
            String callee = target != null ? target.name : name;
            CallKind kind = target != null ? CallKind.INTERNAL : CallKind.EXTERNAL;
            String caller = owner != null ? owner.name : DependencyGraph.TOP_LEVEL_CALLER;
            int line = scanned.lineOf(statement.getStart() + m.start());

            graph.edges.add(new MacroCallEdge(caller, callee, kind, line));
            if (owner != null) owner.invokes.add(callee);
            if (kind == CallKind.EXTERNAL && !containsIgnoreCase(graph.externalMacros, callee)) {
                graph.externalMacros.add(callee);
            }
        }
    }

    private void collectInclude(SasStatement statement, DependencyGraph graph) {
        Matcher m = INCLUDE.matcher(substitute(statement.codeBody()));
        if (!m.matches()) return;
        String rest = m.group(1);
        int slash = rest.indexOf('/');
        Matcher q = QUOTED.matcher(rest);
        boolean any = false;
        while (q.find()) {
            if (slash >= 0 && q.start() > slash) break;
            String target = q.group(1) != null ? q.group(1) : q.group(2);
            if (!graph.includes.contains(target)) graph.includes.add(target);
            any = true;
        }
        if (any) return;
        // fileref form: %include myref(member);
        String ref = (slash >= 0 ? rest.substring(0, slash) : rest).trim();
        if (!ref.isEmpty() && !graph.includes.contains(ref)) graph.includes.add(ref);
    }

    private static void summarize(DependencyGraph graph) {
        for (MacroCallEdge edge : graph.edges) {
            MacroCall existing = null;
            for (MacroCall call : graph.calls) {
                if (call.matches(edge.caller, edge.callee)) {
                    existing = call;
                    break;
                }
            }
            if (existing != null) {
                existing.callCount++;
            } else {
                graph.calls.add(new MacroCall(edge.caller, edge.callee, edge.kind));
            }
        }
    }

    // A macro counts as used when something other than itself calls it
    private static void markInvoked(SegmentedSource segmented, DependencyGraph graph) {
        for (MacroDefinition macro : segmented.getMacros()) {
            macro.invoked = false;
            for (MacroCallEdge edge : graph.edges) {
                if (edge.callee.equalsIgnoreCase(macro.name) && !edge.caller.equalsIgnoreCase(macro.name)) {
                    macro.invoked = true;
                    break;
                }
            }
            macro.status = macro.invoked ? MacroStatus.INTERNAL_USED : MacroStatus.INTERNAL_UNUSED;
            if (!macro.invoked && !containsIgnoreCase(graph.unusedMacros, macro.name)) {
                graph.unusedMacros.add(macro.name);
            }
        }
    }

    private String substitute(String text) {
        return resolver == null ? text : resolver.substitute(text);
    }

    private static boolean containsIgnoreCase(Iterable<String> names, String name) {
        for (String n : names) {
            if (n.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
