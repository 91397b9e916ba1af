package org.dxworks.saslens;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.saslens.analyzer.AnalysisOptions;
import org.dxworks.saslens.analyzer.SasAnalyzer;
import org.dxworks.saslens.model.AnalysisReport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String SAS_EXTENSION = ".sas";
    private static final String DATABASE_ONLY_FLAG = "--database-only";

    public static void main(String[] args) throws Exception {
        List<String> positional = new ArrayList<>();
        boolean databaseOnlyFlag = false;
        for (String arg : args) {
            if (DATABASE_ONLY_FLAG.equals(arg)) {
                databaseOnlyFlag = true;
            } else {
                positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            System.err.println("Usage: java -jar saslens.jar <input> <output-file> [--database-only]");
            System.err.println("  <input>:          Path to a .sas file or a directory of them");
            System.err.println("  <output-file>:    Path to output JSONL file");
            System.err.println("  --database-only:  Report only databases and table operations");
            System.exit(2);
        }

        Path input = Paths.get(positional.get(0));
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(positional.get(1));
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting SAS analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        SaslensConfig config = SaslensConfig.load();
        boolean databaseOnly = databaseOnlyFlag || config.isDatabaseOnly();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " SAS files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("database_only", databaseOnly);
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Each file gets its own analyzer state, so files can be processed in parallel
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Analyzing " + file.getFileName());
                }

                try {
                    AnalysisOptions options = new AnalysisOptions()
                            .withMaxTokenSize(config.getMaxTokenSize())
                            .withDatabaseOnly(databaseOnly);
                    AnalysisReport report = analyzeFile(file, options);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(report));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("language", SasAnalyzer.LANGUAGE);
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds",
                        java.time.Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isSasFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (isSasFile(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    static boolean isSasFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(SAS_EXTENSION);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            return true;
        }
    }

    public static AnalysisReport analyzeFile(Path filePath, AnalysisOptions options) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        return new SasAnalyzer(options).analyze(filePath.toString(), sourceCode);
    }
}
