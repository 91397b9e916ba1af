package org.dxworks.saslens;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.saslens.analyzer.chunk.SasCodeChunker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SaslensConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_TOKEN_SIZE = SasCodeChunker.DEFAULT_MAX_TOKEN_SIZE;
    private static final boolean DEFAULT_DATABASE_ONLY = false;
    static final String CONFIG_FILE_NAME = "saslens-config.yml";

    private final int maxFileLines;
    private final int maxTokenSize;
    private final boolean databaseOnly;

    private SaslensConfig(int maxFileLines, int maxTokenSize, boolean databaseOnly) {
        this.maxFileLines = maxFileLines;
        this.maxTokenSize = maxTokenSize;
        this.databaseOnly = databaseOnly;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxTokenSize() {
        return maxTokenSize;
    }

    public boolean isDatabaseOnly() {
        return databaseOnly;
    }

    public static SaslensConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static SaslensConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : DEFAULT_MAX_FILE_LINES,
                        yamlConfig.maxTokenSize != null ? yamlConfig.maxTokenSize : DEFAULT_MAX_TOKEN_SIZE,
                        yamlConfig.databaseOnly != null ? yamlConfig.databaseOnly : DEFAULT_DATABASE_ONLY);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static SaslensConfig defaults() {
        return new SaslensConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_TOKEN_SIZE, DEFAULT_DATABASE_ONLY);
    }

    public static SaslensConfig with(int maxFileLines, int maxTokenSize, boolean databaseOnly) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxTokenSize = maxTokenSize > 0 ? maxTokenSize : DEFAULT_MAX_TOKEN_SIZE;
        return new SaslensConfig(effectiveMaxFileLines, effectiveMaxTokenSize, databaseOnly);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxTokenSize;
        public Boolean databaseOnly;
    }
}
