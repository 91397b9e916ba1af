package org.dxworks.saslens.analyzer.complexity;

import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.text.SasStatement;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.model.ComplexityMetrics;
import org.dxworks.saslens.model.ComplexityReport;
import org.dxworks.saslens.model.MacroDefinition;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-count complexity per block: the whole file, the residual top level and each macro body.
 * A macro body covers only the macro's own statements; nested definitions are blocks of their own.
 * Cyclomatic complexity is the number of conditional and loop keywords plus one. No control-flow
 * graph is built.
 */
public final class ComplexityCalculator {

    // matches both "if" and "%if"
    private static final Pattern CONDITIONAL = Pattern.compile("(?i)\\bif\\b");
    private static final Pattern LOOP = Pattern.compile(
            "(?i)\\bdo\\s+(?:%?(?:while|until)\\b|over\\b|&?[A-Za-z_][A-Za-z0-9_.&]*\\s*=)");

    private ComplexityCalculator() {
        // utility class
    }

    public static ComplexityReport calculate(SegmentedSource segmented) {
        ScannedSource scanned = segmented.getScanned();
        ComplexityReport report = new ComplexityReport();

        report.blocks.put(ComplexityReport.FILE_BLOCK,
                measure(scanned, scanned.getStatements(), segmented.getMacros().size()));
        report.blocks.put(ComplexityReport.TOP_LEVEL_BLOCK,
                measure(scanned, segmented.topLevelStatements(), segmented.childrenOf(null).size()));
        for (MacroDefinition macro : segmented.getMacros()) {
            report.blocks.put(macro.blockId,
                    measure(scanned, segmented.ownStatements(macro), segmented.childrenOf(macro).size()));
        }
        return report;
    }

    static ComplexityMetrics measure(ScannedSource scanned, List<SasStatement> statements, int macroSteps) {
        ComplexityMetrics metrics = new ComplexityMetrics();
        countLines(scanned, statements, metrics);
        metrics.macroStepCount = macroSteps;

        for (SasStatement statement : statements) {
            if (!statement.isCode()) continue;
            if (statement.hasKeyword("proc")) metrics.procStepCount++;
            if (statement.hasKeyword("data")) metrics.dataStepCount++;
            metrics.conditionalCount += count(CONDITIONAL, statement.getMasked());
            metrics.loopCount += count(LOOP, statement.getMasked());
        }

        metrics.decisionPoints = metrics.conditionalCount + metrics.loopCount;
        metrics.cyclomaticComplexity = metrics.decisionPoints + 1;
        return metrics;
    }

    // Per line: code if any code character, comment if only comment text, blank otherwise
    private static void countLines(ScannedSource scanned, List<SasStatement> statements, ComplexityMetrics metrics) {
        Map<Integer, int[]> lines = new TreeMap<>();
        for (SasStatement statement : statements) {
            String text = statement.getText();
            String code = statement.getCode();
            int line = scanned.lineOf(statement.getStart());
            int pieceStart = 0;
            for (int i = 0; i <= text.length(); i++) {
                boolean atEnd = i == text.length();
                if (!atEnd && text.charAt(i) != '\n') continue;

                boolean empty = i == pieceStart;
                boolean firstContinues = pieceStart == 0 && statement.getStart() > 0;
                if (!(empty && (firstContinues || atEnd))) {
                    int[] flags = lines.computeIfAbsent(line, k -> new int[2]);
                    String raw = text.substring(pieceStart, i);
                    String kept = code.substring(pieceStart, i);
                    if (!kept.isBlank()) flags[0] = 1;
                    if (!raw.isBlank() && !raw.equals(kept)) flags[1] = 1;
                }
                line++;
                pieceStart = i + 1;
            }
        }

        for (int[] flags : lines.values()) {
            metrics.totalLines++;
            if (flags[0] == 1) {
                metrics.codeLines++;
            } else if (flags[1] == 1) {
                metrics.commentLines++;
            } else {
                metrics.blankLines++;
            }
        }
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
