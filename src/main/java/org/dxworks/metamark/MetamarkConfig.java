package org.dxworks.metamark;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MetamarkConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_NESTING_DEPTH = 128;
    private static final boolean DEFAULT_STRICT_METADATA = false;
    static final String CONFIG_FILE_NAME = "metamark-config.yml";

    private final int maxFileLines;
    private final int maxNestingDepth;
    private final boolean strictMetadata;

    private MetamarkConfig(int maxFileLines, int maxNestingDepth, boolean strictMetadata) {
        this.maxFileLines = maxFileLines;
        this.maxNestingDepth = maxNestingDepth;
        this.strictMetadata = strictMetadata;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /** Deepest allowed stack of components and nested lists. */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /** When set, frontmatter values with no typed counterpart fail the parse instead of becoming "". */
    public boolean isStrictMetadata() {
        return strictMetadata;
    }

    public static MetamarkConfig defaults() {
        return new MetamarkConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_NESTING_DEPTH, DEFAULT_STRICT_METADATA);
    }

    public static MetamarkConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MetamarkConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectiveMaxNestingDepth = (yamlConfig.maxNestingDepth != null && yamlConfig.maxNestingDepth > 0)
                        ? yamlConfig.maxNestingDepth
                        : DEFAULT_MAX_NESTING_DEPTH;
                boolean effectiveStrictMetadata = (yamlConfig.strictMetadata != null)
                        ? yamlConfig.strictMetadata
                        : DEFAULT_STRICT_METADATA;

                return new MetamarkConfig(effectiveMaxFileLines, effectiveMaxNestingDepth, effectiveStrictMetadata);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static MetamarkConfig with(int maxFileLines, int maxNestingDepth, boolean strictMetadata) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
        return new MetamarkConfig(effectiveMaxFileLines, effectiveMaxNestingDepth, strictMetadata);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxNestingDepth;
        public Boolean strictMetadata;
    }
}
