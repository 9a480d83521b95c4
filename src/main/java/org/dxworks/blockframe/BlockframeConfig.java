package org.dxworks.blockframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class BlockframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "blockframe-config.yml";
    private static final boolean DEFAULT_NORMALIZE_BEFORE_SEGMENTING = false;

    private final int maxFileLines;
    private final boolean normalizeBeforeSegmenting;

    private BlockframeConfig(int maxFileLines, boolean normalizeBeforeSegmenting) {
        this.maxFileLines = maxFileLines;
        this.normalizeBeforeSegmenting = normalizeBeforeSegmenting;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isNormalizeBeforeSegmenting() {
        return normalizeBeforeSegmenting;
    }

    public static BlockframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static BlockframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Integer maxFileLines = yamlConfig.maxFileLines;
                Boolean normalize = yamlConfig.normalizeBeforeSegmenting;

                int effectiveMaxFileLines = (maxFileLines != null && maxFileLines > 0)
                        ? maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveNormalize = (normalize != null)
                        ? normalize
                        : DEFAULT_NORMALIZE_BEFORE_SEGMENTING;

                return new BlockframeConfig(effectiveMaxFileLines, effectiveNormalize);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static BlockframeConfig with(int maxFileLines, boolean normalizeBeforeSegmenting) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new BlockframeConfig(effectiveMaxFileLines, normalizeBeforeSegmenting);
    }

    private static BlockframeConfig defaults() {
        return new BlockframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_NORMALIZE_BEFORE_SEGMENTING);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean normalizeBeforeSegmenting;
    }
}
