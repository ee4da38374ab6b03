package com.astrepr.config;

import com.astrepr.codegen.GeneratorOptions;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rendering defaults read from an optional YAML file:
 * <pre>
 * includePositionComments: false
 * sanitizeIdentifiers: true
 * </pre>
 * Keys that are missing fall back to {@link GeneratorOptions#DEFAULTS}. A missing file or one
 * that cannot be read never fails the run.
 */
public class ConverterConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConverterConfig.class);

    public static final String CONFIG_FILE_NAME = "astrepr-config.yml";

    private final boolean includePositionComments;
    private final boolean sanitizeIdentifiers;

    private ConverterConfig(boolean includePositionComments, boolean sanitizeIdentifiers) {
        this.includePositionComments = includePositionComments;
        this.sanitizeIdentifiers = sanitizeIdentifiers;
    }

    public boolean isIncludePositionComments() {
        return includePositionComments;
    }

    public boolean isSanitizeIdentifiers() {
        return sanitizeIdentifiers;
    }

    public GeneratorOptions toGeneratorOptions() {
        return new GeneratorOptions(includePositionComments, sanitizeIdentifiers);
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig(
            GeneratorOptions.DEFAULTS.includePositionComments(),
            GeneratorOptions.DEFAULTS.sanitizeIdentifiers());
    }

    public static ConverterConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            LOGGER.debug("No config file at {}, using defaults", configPath);
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig == null) {
                return defaults();
            }
            ConverterConfig defaults = defaults();
            boolean comments = yamlConfig.includePositionComments != null
                ? yamlConfig.includePositionComments
                : defaults.includePositionComments;
            boolean sanitize = yamlConfig.sanitizeIdentifiers != null
                ? yamlConfig.sanitizeIdentifiers
                : defaults.sanitizeIdentifiers;
            LOGGER.debug("Loaded {}: includePositionComments={} sanitizeIdentifiers={}", configPath, comments, sanitize);
            return new ConverterConfig(comments, sanitize);
        } catch (IOException e) {
            LOGGER.warn("Ignoring unreadable config file {}: {}", configPath, e.getMessage());
            return defaults();
        }
    }

    private static class YamlConfig {
        public Boolean includePositionComments;
        public Boolean sanitizeIdentifiers;
    }
}
