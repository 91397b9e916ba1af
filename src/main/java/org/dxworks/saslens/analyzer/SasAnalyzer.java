package org.dxworks.saslens.analyzer;

import org.dxworks.saslens.analyzer.chunk.SasCodeChunker;
import org.dxworks.saslens.analyzer.complexity.ComplexityCalculator;
import org.dxworks.saslens.analyzer.dependency.DependencyGraphBuilder;
import org.dxworks.saslens.analyzer.library.LibraryRegistry;
import org.dxworks.saslens.analyzer.segment.SegmentedSource;
import org.dxworks.saslens.analyzer.segment.StatementSegmenter;
import org.dxworks.saslens.analyzer.table.TableOperationExtractor;
import org.dxworks.saslens.analyzer.text.SasSourceScanner;
import org.dxworks.saslens.analyzer.text.ScannedSource;
import org.dxworks.saslens.analyzer.variable.VariableResolver;
import org.dxworks.saslens.model.AnalysisReport;
import org.dxworks.saslens.model.Anomaly;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point of the analysis: runs every component over one SAS source unit and assembles the report.
 * Each run builds its own resolver, registry and graph, so concurrent runs do not interfere.
 */
public class SasAnalyzer implements SourceAnalyzer {

    public static final String LANGUAGE = "sas";

    private final AnalysisOptions options;

    public SasAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public SasAnalyzer(AnalysisOptions options) {
        this.options = options == null ? AnalysisOptions.defaults() : options;
    }

    @Override
    public AnalysisReport analyze(String filePath, String sourceCode) {
        AnalysisOptions effective = options;
        if (effective.getSourceName() == null && filePath != null) {
            Path fileName = Paths.get(filePath).getFileName();
            effective = copyOf(options).withSourceName(fileName == null ? filePath : fileName.toString());
        }
        AnalysisReport report = analyze(sourceCode, effective);
        report.filePath = filePath;
        report.language = LANGUAGE;
        return report;
    }

    /**
     * Analyzes SAS source text.
     *
     * @throws IllegalArgumentException for null, empty, blank or binary input, or a non-positive token budget
     */
    public static AnalysisReport analyze(String sourceText, AnalysisOptions options) {
        AnalysisOptions opts = options == null ? AnalysisOptions.defaults() : options;
        validate(sourceText, opts);

        ScannedSource scanned = SasSourceScanner.scan(sourceText);
        VariableResolver resolver = VariableResolver.fromSource(scanned, opts.getPredefinedVariables());
        SegmentedSource segmented = StatementSegmenter.segment(scanned);
        LibraryRegistry registry = LibraryRegistry.fromSource(scanned, resolver);
        TableOperationExtractor tables = new TableOperationExtractor(registry, resolver);

        AnalysisReport report = new AnalysisReport();
        report.databases = tables.extract(segmented);

        if (!opts.isDatabaseOnly()) {
            report.dependencies = new DependencyGraphBuilder(resolver).build(segmented);
            report.macros = new ArrayList<>(segmented.getMacros());
            report.complexity = ComplexityCalculator.calculate(segmented);
            report.chunks = new SasCodeChunker(opts.getMaxTokenSize(), opts.getSourceName()).chunk(segmented);
        }

        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(scanned.getAnomalies());
        anomalies.addAll(segmented.getAnomalies());
        anomalies.addAll(tables.getAnomalies());
        anomalies.sort(Comparator.comparingInt(a -> a.offset));
        report.anomalies = anomalies;
        return report;
    }

    private static void validate(String sourceText, AnalysisOptions options) {
        if (sourceText == null) {
            throw new IllegalArgumentException("Source text must not be null");
        }
        if (sourceText.isBlank()) {
            throw new IllegalArgumentException("Source text must not be empty or blank");
        }
        if (sourceText.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Source text looks binary: it contains NUL characters");
        }
        if (options.getMaxTokenSize() <= 0) {
            throw new IllegalArgumentException("maxTokenSize must be positive, got " + options.getMaxTokenSize());
        }
    }

    private static AnalysisOptions copyOf(AnalysisOptions options) {
        return new AnalysisOptions()
                .withMaxTokenSize(options.getMaxTokenSize())
                .withDatabaseOnly(options.isDatabaseOnly())
                .withSourceName(options.getSourceName())
                .withVariables(options.getPredefinedVariables());
    }
}
