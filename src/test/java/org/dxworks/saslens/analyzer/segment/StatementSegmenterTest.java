package org.dxworks.saslens.analyzer.segment;

import org.dxworks.saslens.analyzer.text.SasSourceScanner;
import org.dxworks.saslens.model.Anomaly;
import org.dxworks.saslens.model.AnomalyType;
import org.dxworks.saslens.model.MacroDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StatementSegmenterTest {

    private static SegmentedSource segment(String source) {
        return StatementSegmenter.segment(SasSourceScanner.scan(source));
    }

    @Test
    void nestedMacrosRecordDepthAndParent() {
        SegmentedSource segmented = segment(
                "%macro outer(a, b=1);\n  %macro inner;\n    %put hi;\n  %mend inner;\n  data x; run;\n%mend outer;");

        List<MacroDefinition> macros = segmented.getMacros();
        assertEquals(2, macros.size());

        MacroDefinition outer = macros.get(0);
        assertEquals("outer", outer.name);
        assertEquals("a, b=1", outer.parameters);
        assertEquals(0, outer.depth);
        assertNull(outer.parent);
        assertEquals(1, outer.startLine);
        assertEquals(6, outer.endLine);

        MacroDefinition inner = macros.get(1);
        assertEquals("inner", inner.name);
        assertNull(inner.parameters);
        assertEquals(1, inner.depth);
        assertEquals("outer", inner.parent);

        assertEquals(List.of(inner), segmented.childrenOf(outer));
        assertEquals(List.of(outer), segmented.getTopLevelMacros());
        assertEquals(2, segmented.ownStatements(outer).size());
        assertEquals(1, segmented.ownStatements(inner).size());

        assertEquals(1, segmented.getSegments().size());
        assertEquals(SegmentType.MACRO_DEFINITION, segmented.getSegments().get(0).getType());
        assertTrue(segmented.getAnomalies().isEmpty());
    }

    @Test
    void queryBlockIsOneSegmentFollowedByTopLevelCode() {
        SegmentedSource segmented = segment("proc sql;\n  select * from a.b;\nquit;\ndata y; run;");

        List<Segment> segments = segmented.getSegments();
        assertEquals(2, segments.size());
        assertEquals(SegmentType.QUERY, segments.get(0).getType());
        assertEquals(SegmentType.TOP_LEVEL, segments.get(1).getType());

        QueryBlock block = segmented.getQueryBlocks().get(0);
        assertTrue(block.isTerminated());
        assertEquals(1, block.getStatements().size());
        assertNull(block.getOwner());
        assertEquals("proc sql;\n  select * from a.b;\nquit;", segments.get(0).text(segmented.getSource()));
    }

    @Test
    void segmentsTileTheSource() {
        String source = "/* c */\n%let a = 1;\n%macro m; %put &a; %mend;\nproc sql; select 1 from t; quit;\n%m\n";
        SegmentedSource segmented = segment(source);

        int expectedStart = 0;
        for (Segment segment : segmented.getSegments()) {
            assertEquals(expectedStart, segment.getStart());
            expectedStart = segment.getEnd();
        }
        assertEquals(source.length(), expectedStart);
    }

    @Test
    void queryLeftOpenInsideMacroEndsAtMend() {
        String source = "%macro m;\nproc sql;\nselect * from t;\n%mend m;";
        SegmentedSource segmented = segment(source);

        QueryBlock block = segmented.getQueryBlocks().get(0);
        assertFalse(block.isTerminated());
        assertEquals(source.indexOf("\n%mend"), block.getEnd());
        assertTrue(segmented.getMacros().get(0).terminated);

        List<Anomaly> anomalies = segmented.getAnomalies();
        assertEquals(1, anomalies.size());
        assertEquals(AnomalyType.UNTERMINATED_QUERY_BLOCK, anomalies.get(0).type);
        assertEquals("m", anomalies.get(0).subject);
        assertEquals(2, anomalies.get(0).line);
    }

    @Test
    void queryLeftOpenAtEndOfInputRunsToEnd() {
        String source = "proc sql;\nselect * from t;\n";
        SegmentedSource segmented = segment(source);

        assertEquals(source.length(), segmented.getQueryBlocks().get(0).getEnd());
        assertEquals(AnomalyType.UNTERMINATED_QUERY_BLOCK, segmented.getAnomalies().get(0).type);
    }

    @Test
    void mendWithoutOpenMacroIsReported() {
        SegmentedSource segmented = segment("%mend;\ndata a; run;");

        assertEquals(1, segmented.getAnomalies().size());
        assertEquals(AnomalyType.UNMATCHED_MACRO_END, segmented.getAnomalies().get(0).type);
        assertTrue(segmented.getMacros().isEmpty());
    }

    @Test
    void mendWithOtherNameStillClosesInnermostMacro() {
        String source = "%macro a;\n%mend b;";
        SegmentedSource segmented = segment(source);

        MacroDefinition a = segmented.getMacros().get(0);
        assertTrue(a.terminated);
        assertEquals(source.length(), a.endOffset);

        Anomaly anomaly = segmented.getAnomalies().get(0);
        assertEquals(AnomalyType.MISMATCHED_MACRO_END, anomaly.type);
        assertEquals("b", anomaly.subject);
    }

    @Test
    void macrosOpenAtEndOfInputRunToEnd() {
        String source = "%macro a;\ndata x; run;\n%macro b;\n%put b;";
        SegmentedSource segmented = segment(source);

        for (MacroDefinition macro : segmented.getMacros()) {
            assertFalse(macro.terminated);
            assertEquals(source.length(), macro.endOffset);
        }
        Set<String> subjects = segmented.getAnomalies().stream()
                .filter(a -> a.type == AnomalyType.UNTERMINATED_MACRO)
                .map(a -> a.subject)
                .collect(Collectors.toSet());
        assertEquals(Set.of("a", "b"), subjects);

        assertEquals(1, segmented.getSegments().size());
        assertEquals(source.length(), segmented.getSegments().get(0).getEnd());
    }

    @Test
    void duplicateMacroNamesGetDistinctBlockIds() {
        SegmentedSource segmented = segment("%macro a; %mend;\n%macro A; %mend;");

        assertEquals("a", segmented.getMacros().get(0).blockId);
        assertEquals("A#2", segmented.getMacros().get(1).blockId);
    }

    @Test
    void parameterListKeepsNestedParentheses() {
        assertEquals("x=(1,2), y", StatementSegmenter.parameterList("(x=(1,2), y) / store"));
        assertNull(StatementSegmenter.parameterList("/ minoperator"));
        assertNull(StatementSegmenter.parameterList(""));
    }
}
