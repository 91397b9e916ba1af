package org.dxworks.saslens;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SaslensConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        SaslensConfig config = SaslensConfig.load(dir.resolve(SaslensConfig.CONFIG_FILE_NAME));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(4000, config.getMaxTokenSize());
        assertFalse(config.isDatabaseOnly());
    }

    @Test
    void readsValuesFromYaml() throws IOException {
        Path file = dir.resolve(SaslensConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "maxFileLines: 500\nmaxTokenSize: 1200\ndatabaseOnly: true\n", StandardCharsets.UTF_8);

        SaslensConfig config = SaslensConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(1200, config.getMaxTokenSize());
        assertTrue(config.isDatabaseOnly());
    }

    @Test
    void absentKeysKeepTheirDefaults() throws IOException {
        Path file = dir.resolve(SaslensConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "maxTokenSize: 800\n", StandardCharsets.UTF_8);

        SaslensConfig config = SaslensConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(800, config.getMaxTokenSize());
    }

    @Test
    void nonPositiveLimitsFallBackToDefaults() {
        SaslensConfig config = SaslensConfig.with(0, -1, true);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(4000, config.getMaxTokenSize());
        assertTrue(config.isDatabaseOnly());
    }

    @Test
    void unreadableYamlFallsBackToDefaults() throws IOException {
        Path file = dir.resolve(SaslensConfig.CONFIG_FILE_NAME);
        Files.writeString(file, "maxTokenSize: [not, a, number\n", StandardCharsets.UTF_8);

        assertEquals(4000, SaslensConfig.load(file).getMaxTokenSize());
    }
}
