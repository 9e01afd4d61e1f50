package com.raditha.similarity.config;

import java.util.List;

/**
 * Configuration for similarity analysis.
 * Defines thresholds, the semantic pass limits and file filtering rules.
 *
 * @param structuralThreshold    Minimum token Jaccard for a structural match
 * @param semanticThreshold      Minimum judged similarity for a semantic match
 * @param compareThreshold       Minimum score kept by file-to-file comparison
 * @param semanticEnabled        Run the semantic pass and pattern descriptions
 * @param semanticBatchSize      Maximum judge calls in flight at once
 * @param maxSemanticComparisons Upper bound on judge calls per run
 * @param excludePatterns        File patterns to exclude (glob format)
 * @param ai                     Semantic judge connection settings
 */
public record SimilarityConfig(
        double structuralThreshold,
        double semanticThreshold,
        double compareThreshold,
        boolean semanticEnabled,
        int semanticBatchSize,
        int maxSemanticComparisons,
        List<String> excludePatterns,
        AiServiceConfig ai) {

    /**
     * Validate configuration.
     */
    public SimilarityConfig {
        requireFraction("structuralThreshold", structuralThreshold);
        requireFraction("semanticThreshold", semanticThreshold);
        requireFraction("compareThreshold", compareThreshold);
        if (semanticBatchSize < 1) {
            throw new IllegalArgumentException("semanticBatchSize must be >= 1");
        }
        if (maxSemanticComparisons < 0) {
            throw new IllegalArgumentException("maxSemanticComparisons must be >= 0");
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        if (ai == null) {
            ai = AiServiceConfig.defaults();
        }
    }

    /**
     * Default preset: 70% structural, 60% semantic, batches of 10.
     */
    public static SimilarityConfig defaults() {
        return new SimilarityConfig(
                0.70, // structuralThreshold
                0.60, // semanticThreshold
                0.70, // compareThreshold
                true, // semanticEnabled
                10, // semanticBatchSize
                100, // maxSemanticComparisons
                defaultExcludePatterns(),
                AiServiceConfig.defaults());
    }

    /**
     * Strict preset: only very close structural matches.
     */
    public static SimilarityConfig strict() {
        return new SimilarityConfig(
                0.85,
                0.75,
                0.85,
                true,
                10,
                100,
                defaultExcludePatterns(),
                AiServiceConfig.defaults());
    }

    /**
     * Lenient preset: more candidates, more false positives.
     */
    public static SimilarityConfig lenient() {
        return new SimilarityConfig(
                0.60,
                0.50,
                0.60,
                true,
                10,
                200,
                defaultExcludePatterns(),
                AiServiceConfig.defaults());
    }

    /**
     * Default thresholds with the semantic judge switched off.
     */
    public static SimilarityConfig offline() {
        return defaults().withSemanticEnabled(false);
    }

    public SimilarityConfig withSemanticEnabled(boolean enabled) {
        return new SimilarityConfig(structuralThreshold, semanticThreshold, compareThreshold,
                enabled, semanticBatchSize, maxSemanticComparisons, excludePatterns, ai);
    }

    public SimilarityConfig withStructuralThreshold(double threshold) {
        return new SimilarityConfig(threshold, semanticThreshold, threshold,
                semanticEnabled, semanticBatchSize, maxSemanticComparisons, excludePatterns, ai);
    }

    /**
     * Default file exclusion patterns.
     */
    public static List<String> defaultExcludePatterns() {
        return List.of(
                "**/node_modules/**",
                "**/.git/**",
                "**/target/**",
                "**/build/**",
                "**/dist/**");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '*') {
                regex.append(".*");
                i++;
            } else if (c == '*') {
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else if ("\\.[]{}()+-^$|".indexOf(c) >= 0) {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return path.matches(regex.toString());
    }

    private static void requireFraction(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
