package org.dxworks.saslens.analyzer.dependency;

import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.segment.StatementSegmenter;
import org.dxworks.saslens.analyzer.text.SasSourceScanner;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.analyzer.variable.VariableResolver;
import org.dxworks.saslens.model.CallKind;
import org.dxworks.saslens.model.DependencyGraph;
import org.dxworks.saslens.model.MacroCall;
import org.dxworks.saslens.model.MacroCallEdge;
import org.dxworks.saslens.model.MacroDefinition;
import org.dxworks.saslens.model.MacroStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private SegmentedSource segmented;

    private DependencyGraph build(String source) {
        ScannedSource scanned = SasSourceScanner.scan(source);
        segmented = StatementSegmenter.segment(scanned);
        return new DependencyGraphBuilder(VariableResolver.fromSource(scanned, Map.of())).build(segmented);
    }

    private MacroDefinition macro(String name) {
        return segmented.getMacros().stream()
                .filter(m -> m.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no macro " + name));
    }

    @Test
    void chainOfCallsWithExternalTail() {
        DependencyGraph graph = build(String.join("\n",
                "%macro A;",
                "  %B;",
                "%mend A;",
                "%macro B;",
                "  %C(1);",
                "%mend B;"));

        assertEquals(2, graph.edges.size());
        MacroCallEdge first = graph.edges.get(0);
        assertEquals("A", first.caller);
        assertEquals("B", first.callee);
        assertEquals(CallKind.INTERNAL, first.kind);
        assertEquals(2, first.line);

        MacroCallEdge second = graph.edges.get(1);
        assertEquals("B", second.caller);
        assertEquals("C", second.callee);
        assertEquals(CallKind.EXTERNAL, second.kind);

        assertEquals(List.of("C"), graph.externalMacros);
        assertEquals(List.of("A"), graph.unusedMacros);
        assertEquals(MacroStatus.INTERNAL_UNUSED, macro("A").status);
        assertEquals(MacroStatus.INTERNAL_USED, macro("B").status);
        assertEquals(Set.of("B"), macro("A").invokes);
        assertEquals(Set.of("C"), macro("B").invokes);
    }

    @Test
    void openCodeCallMarksMacroUsed() {
        DependencyGraph graph = build("%macro m; %put hi; %mend;\n%m;");

        assertEquals(1, graph.edges.size());
        assertEquals(DependencyGraph.TOP_LEVEL_CALLER, graph.edges.get(0).caller);
        assertEquals(2, graph.edges.get(0).line);
        assertTrue(macro("m").invoked);
        assertTrue(graph.unusedMacros.isEmpty());
    }

    @Test
    void selfRecursionAloneLeavesMacroUnused() {
        DependencyGraph graph = build("%macro r(n);\n  %if &n > 0 %then %r(%eval(&n - 1));\n%mend r;");

        assertEquals(1, graph.edges.size());
        assertEquals("r", graph.edges.get(0).caller);
        assertEquals("r", graph.edges.get(0).callee);
        assertFalse(macro("r").invoked);
        assertEquals(List.of("r"), graph.unusedMacros);
    }

    @Test
    void repeatedCallsAreSummarizedWithCount() {
        DependencyGraph graph = build(String.join("\n",
                "%macro a; %mend;",
                "%macro b;",
                "  %a;",
                "  %A;",
                "%mend b;",
                "%b;"));

        assertEquals(3, graph.edges.size());
        assertEquals(2, graph.calls.size());
        MacroCall inner = graph.calls.get(0);
        assertEquals("b", inner.caller);
        assertEquals("a", inner.callee);
        assertEquals(2, inner.callCount);
        assertEquals(1, graph.calls.get(1).callCount);
    }

    @Test
    void macroLanguageIsNotAnInvocation() {
        DependencyGraph graph = build(String.join("\n",
                "%let x = %sysfunc(today());",
                "%put &x %str(done);",
                "%global y;",
                "%if &x > 0 %then %do; %put pos; %end;"));

        assertTrue(graph.edges.isEmpty());
        assertTrue(graph.externalMacros.isEmpty());
    }

    @Test
    void callsInsideCommentsAndLiteralsAreIgnored() {
        DependencyGraph graph = build("/* %hidden; */\n* %also_hidden;\ndata _null_; x = '%quoted'; run;");

        assertTrue(graph.edges.isEmpty());
    }

    @Test
    void includesKeepPathsAndFilerefs() {
        DependencyGraph graph = build(String.join("\n",
                "%let root = /code;",
                "%include \"&root/common.sas\";",
                "%inc lib(member) / source2;",
                "%include '/code/common.sas';"));

        assertEquals(List.of("/code/common.sas", "lib(member)"), graph.includes);
        assertTrue(graph.edges.isEmpty());
    }

    @Test
    void datasetUsageOutsideProcSql() {
        DependencyGraph graph = build(String.join("\n",
                "data out.result work.sorted(keep=id);",
                "  set in.source other;",
                "  merge in.raw;",
                "run;",
                "data _null_; set in.raw; run;",
                "proc sort data=in.raw out=work.sorted2; by id; run;",
                "proc sql; create table sql.made as select * from sql.src; quit;"));

        assertEquals(List.of("out.result", "work.sorted", "work.sorted2"), List.copyOf(graph.datasetUsage.output));
        assertEquals(List.of("in.source", "other", "in.raw"), List.copyOf(graph.datasetUsage.input));
    }

    @Test
    void datasetListSkipsOptionsAndStopsAtSlash() {
        assertEquals(List.of("a", "b.c"), DatasetUsageCollector.datasetList(" a(drop=x) b.c end=eof / view=v"));
    }
}
