package com.raditha.similarity.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads similarity configuration from a YAML file (similarity.yml) with CLI
 * overrides.
 *
 * Configuration priority: CLI arguments > similarity.yml > defaults
 */
public final class SimilaritySettings {

    private static final Logger logger = LoggerFactory.getLogger(SimilaritySettings.class);

    public static final String CONFIG_KEY = "similarity_engine";
    public static final String DEFAULT_FILE_NAME = "similarity.yml";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private SimilaritySettings() {
    }

    /**
     * Load configuration from a YAML file without CLI overrides.
     */
    public static SimilarityConfig load(Path configFile) throws IOException {
        return load(configFile, null, 0, null);
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile   YAML file; null or missing means no YAML
     * @param presetCLI    CLI preset name (null = use YAML/default)
     * @param thresholdCLI CLI structural threshold percentage 0-100 (0 = use
     *                     YAML/default)
     * @param semanticCLI  CLI semantic switch (null = use YAML/default)
     * @return Complete similarity configuration
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static SimilarityConfig load(Path configFile, String presetCLI, int thresholdCLI, Boolean semanticCLI)
            throws IOException {
        Map<String, Object> yaml = readSection(configFile);

        String preset = presetCLI != null ? presetCLI : getString(yaml, "preset", null);
        SimilarityConfig base = preset != null ? fromPreset(preset) : fromYaml(yaml);

        if (thresholdCLI != 0) {
            base = base.withStructuralThreshold(thresholdCLI / 100.0);
        }
        if (semanticCLI != null) {
            base = base.withSemanticEnabled(semanticCLI);
        }
        return base;
    }

    /**
     * Resolve a preset name; unknown names fall back to the defaults.
     */
    public static SimilarityConfig fromPreset(String preset) {
        return switch (preset.toLowerCase()) {
            case "strict" -> SimilarityConfig.strict();
            case "lenient" -> SimilarityConfig.lenient();
            case "offline" -> SimilarityConfig.offline();
            default -> SimilarityConfig.defaults();
        };
    }

    static SimilarityConfig fromYaml(Map<String, Object> config) {
        SimilarityConfig defaults = SimilarityConfig.defaults();
        if (config.isEmpty()) {
            return defaults;
        }

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = defaults.excludePatterns();
        }

        return new SimilarityConfig(
                getDouble(config, "structural_threshold", defaults.structuralThreshold()),
                getDouble(config, "semantic_threshold", defaults.semanticThreshold()),
                getDouble(config, "compare_threshold", defaults.compareThreshold()),
                getBoolean(config, "semantic_enabled", defaults.semanticEnabled()),
                getInt(config, "semantic_batch_size", defaults.semanticBatchSize()),
                getInt(config, "max_semantic_comparisons", defaults.maxSemanticComparisons()),
                excludePatterns,
                buildAiConfig(config));
    }

    private static Map<String, Object> readSection(Path configFile) throws IOException {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            logger.debug("No configuration file at {}, using defaults", configFile);
            return Map.of();
        }

        Map<String, Object> root = yamlMapper.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (section instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) section;
            return map;
        }
        logger.warn("{} has no '{}' section, using defaults", configFile, CONFIG_KEY);
        return Map.of();
    }

    private static AiServiceConfig buildAiConfig(Map<String, Object> config) {
        Object aiObj = config.get("ai_service");
        if (aiObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> ai = (Map<String, Object>) aiObj;
            return new AiServiceConfig(
                    getString(ai, "api_key", null),
                    getString(ai, "endpoint", AiServiceConfig.DEFAULT_ENDPOINT),
                    getString(ai, "model", AiServiceConfig.DEFAULT_MODEL),
                    getInt(ai, "timeout_seconds", 60));
        }
        return AiServiceConfig.defaults();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean bool) {
            return bool;
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

    @SuppressWarnings("unchecked")
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return List.of();
    }
}
