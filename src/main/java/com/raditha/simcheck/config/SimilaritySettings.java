package com.raditha.simcheck.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads similarity checker configuration from simcheck.yml with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > simcheck.yml > defaults
 *
 * <pre>
 * simcheck:
 *   preset: strict
 *   charset: UTF-8
 *   thresholds:
 *     high: 0.9
 *     moderate: 0.6
 *     low: 0.3
 * </pre>
 */
public class SimilaritySettings {

    private static final Logger logger = LoggerFactory.getLogger(SimilaritySettings.class);

    public static final Path DEFAULT_CONFIG_FILE = Path.of("simcheck.yml");
    private static final String CONFIG_KEY = "simcheck";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private SimilaritySettings() {
    }

    /**
     * Load configuration, applying the CLI preset where provided.
     *
     * @param configFile Explicit configuration file (null = simcheck.yml if present)
     * @param presetCLI  CLI preset name (null = use YAML/default)
     * @return Complete similarity configuration
     * @throws IllegalArgumentException if the file is missing, malformed or holds invalid values
     */
    public static SimilarityConfig loadConfig(@Nullable Path configFile, @Nullable String presetCLI) {
        Map<String, Object> config = readSection(configFile);

        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        if (preset != null) {
            logger.debug("Using '{}' preset", preset);
            SimilarityConfig base = SimilarityConfig.preset(preset);
            return new SimilarityConfig(base.thresholds(), readCharset(config));
        }

        return new SimilarityConfig(buildThresholds(config), readCharset(config));
    }

    private static Map<String, Object> readSection(@Nullable Path configFile) {
        Path file = configFile != null ? configFile : DEFAULT_CONFIG_FILE;
        if (!Files.exists(file)) {
            if (configFile != null) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            return Map.of();
        }

        Map<String, Object> root;
        try {
            String content = Files.readString(file);
            if (content.isBlank()) {
                return Map.of();
            }
            root = yamlMapper.readValue(content, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot parse config file " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Loaded configuration from {}", file);

        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) section;
            return map;
        }
        return Map.of();
    }

    private static VerdictThresholds buildThresholds(Map<String, Object> config) {
        Object thresholdsObj = config.get("thresholds");
        if (thresholdsObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> thresholdsMap = (Map<String, Object>) thresholdsObj;
            VerdictThresholds defaults = VerdictThresholds.standard();
            double high = getDouble(thresholdsMap, "high", defaults.high());
            double moderate = getDouble(thresholdsMap, "moderate", defaults.moderate());
            double low = getDouble(thresholdsMap, "low", defaults.low());
            return new VerdictThresholds(high, moderate, low);
        }
        return VerdictThresholds.standard();
    }

    private static Charset readCharset(Map<String, Object> config) {
        String name = getString(config, "charset", null);
        if (name == null) {
            return StandardCharsets.UTF_8;
        }
        return Charset.forName(name);
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
