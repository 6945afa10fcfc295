package org.dxworks.tagframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TagframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "tagframe-config.yml";
    private static final boolean DEFAULT_VERIFY_ROUND_TRIP = true;
    private static final boolean DEFAULT_RAW_TEXT_ELEMENTS = true;

    private final int maxFileLines;
    private final boolean verifyRoundTrip;
    private final boolean rawTextElements;

    private TagframeConfig(int maxFileLines, boolean verifyRoundTrip, boolean rawTextElements) {
        this.maxFileLines = maxFileLines;
        this.verifyRoundTrip = verifyRoundTrip;
        this.rawTextElements = rawTextElements;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isVerifyRoundTrip() {
        return verifyRoundTrip;
    }

    public boolean isRawTextElements() {
        return rawTextElements;
    }

    public static TagframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static TagframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveVerifyRoundTrip = yamlConfig.verifyRoundTrip != null
                        ? yamlConfig.verifyRoundTrip
                        : DEFAULT_VERIFY_ROUND_TRIP;
                boolean effectiveRawTextElements = yamlConfig.rawTextElements != null
                        ? yamlConfig.rawTextElements
                        : DEFAULT_RAW_TEXT_ELEMENTS;

                return new TagframeConfig(effectiveMaxFileLines, effectiveVerifyRoundTrip, effectiveRawTextElements);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static TagframeConfig defaults() {
        return new TagframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_VERIFY_ROUND_TRIP, DEFAULT_RAW_TEXT_ELEMENTS);
    }

    public static TagframeConfig with(int maxFileLines, boolean verifyRoundTrip, boolean rawTextElements) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new TagframeConfig(effectiveMaxFileLines, verifyRoundTrip, rawTextElements);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean verifyRoundTrip;
        public Boolean rawTextElements;
    }
}
