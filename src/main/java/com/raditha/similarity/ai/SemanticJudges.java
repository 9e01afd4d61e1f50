package com.raditha.similarity.ai;

import com.raditha.similarity.config.SimilarityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Creates the semantic judge described by a configuration.
 */
public final class SemanticJudges {
    private static final Logger logger = LoggerFactory.getLogger(SemanticJudges.class);

    private SemanticJudges() {
    }

    /**
     * Create a judge, or nothing when the semantic pass is disabled or no API
     * key is available. Analysis then runs without semantic matches.
     */
    public static Optional<SemanticJudge> fromConfig(SimilarityConfig config) {
        if (!config.semanticEnabled()) {
            logger.debug("Semantic analysis disabled by configuration");
            return Optional.empty();
        }
        try {
            SemanticJudge judge = new GeminiSemanticJudge(config.ai());
            logger.info("Semantic similarity analysis enabled");
            return Optional.of(judge);
        } catch (IOException e) {
            logger.info("Semantic judge not configured - semantic pass skipped: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
