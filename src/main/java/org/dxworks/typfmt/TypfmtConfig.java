package org.dxworks.typfmt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TypfmtConfig {

    private static final Logger LOG = LoggerFactory.getLogger(TypfmtConfig.class);

    private static final int DEFAULT_MAX_WIDTH = 120;
    private static final int DEFAULT_BLANK_LINES_UPPER_BOUND = 2;
    private static final String CONFIG_FILE_NAME = "typfmt-config.yml";

    private final int maxWidth;
    private final int blankLinesUpperBound;

    private TypfmtConfig(int maxWidth, int blankLinesUpperBound) {
        this.maxWidth = maxWidth;
        this.blankLinesUpperBound = blankLinesUpperBound;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    /** Most blank lines kept between two statements of a code block. */
    public int getBlankLinesUpperBound() {
        return blankLinesUpperBound;
    }

    public static TypfmtConfig defaults() {
        return new TypfmtConfig(DEFAULT_MAX_WIDTH, DEFAULT_BLANK_LINES_UPPER_BOUND);
    }

    public static TypfmtConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TypfmtConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxWidth != null ? yamlConfig.maxWidth : DEFAULT_MAX_WIDTH,
                        yamlConfig.blankLinesUpperBound != null
                                ? yamlConfig.blankLinesUpperBound
                                : DEFAULT_BLANK_LINES_UPPER_BOUND);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static TypfmtConfig with(int maxWidth, int blankLinesUpperBound) {
        int effectiveMaxWidth = maxWidth > 0 ? maxWidth : DEFAULT_MAX_WIDTH;
        int effectiveBlankLines = blankLinesUpperBound >= 0 ? blankLinesUpperBound : DEFAULT_BLANK_LINES_UPPER_BOUND;
        return new TypfmtConfig(effectiveMaxWidth, effectiveBlankLines);
    }

    private static class YamlConfig {
        public Integer maxWidth;
        public Integer blankLinesUpperBound;
    }
}
