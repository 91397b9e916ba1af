package org.dxworks.saslens;

import org.dxworks.saslens.analyzer.AnalysisOptions;
import org.dxworks.saslens.model.AnalysisReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path dir;

    @Test
    void collectsOnlySasFilesInOrder() throws IOException {
        Files.createDirectories(dir.resolve("jobs"));
        Files.writeString(dir.resolve("jobs/b.sas"), "data b; run;\n");
        Files.writeString(dir.resolve("a.SAS"), "data a; run;\n");
        Files.writeString(dir.resolve("notes.txt"), "not sas\n");

        List<Path> files = App.collectSourceFiles(dir, 100);

        assertEquals(List.of(dir.resolve("a.SAS"), dir.resolve("jobs/b.sas")), files);
    }

    @Test
    void skipsFilesOverTheLineLimit() throws IOException {
        Files.writeString(dir.resolve("small.sas"), "data a;\nrun;\n");
        Files.writeString(dir.resolve("large.sas"), "data a;\n".repeat(10) + "run;\n");

        List<Path> files = App.collectSourceFiles(dir, 5);

        assertEquals(List.of(dir.resolve("small.sas")), files);
    }

    @Test
    void singleFileInput() throws IOException {
        Path file = dir.resolve("one.sas");
        Files.writeString(file, "data a; run;\n");

        assertEquals(List.of(file), App.collectSourceFiles(file, 100));
        assertTrue(App.collectSourceFiles(dir.resolve("missing.sas"), 100).isEmpty());
    }

    @Test
    void byteOrderMarkIsStripped() throws IOException {
        Path file = dir.resolve("bom.sas");
        Files.writeString(file, "\uFEFFlibname d oracle;\nproc sql; select * from d.t; quit;\n", StandardCharsets.UTF_8);

        AnalysisReport report = App.analyzeFile(file, new AnalysisOptions().withDatabaseOnly(true));

        assertEquals("d", report.databases.get(0).databaseName);
        assertEquals(file.toString(), report.filePath);
    }
}
