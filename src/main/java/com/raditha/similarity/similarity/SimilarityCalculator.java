package com.raditha.similarity.similarity;

import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.MatchType;

import java.util.List;

/**
 * Direct comparison of two blocks, used when comparing two files without the
 * full pipeline: an identical hash is an exact match, anything else is scored
 * by token overlap.
 */
public class SimilarityCalculator {

    static final double CONFIDENCE_FACTOR = 0.8;

    private final JaccardSimilarity jaccard;

    public SimilarityCalculator() {
        this(new JaccardSimilarity());
    }

    public SimilarityCalculator(JaccardSimilarity jaccard) {
        this.jaccard = jaccard;
    }

    /**
     * Outcome of comparing two blocks.
     *
     * @param score       Similarity score (0.0-1.0)
     * @param type        Exact or structural
     * @param confidence  Certainty in the method
     * @param suggestions Refactoring hints
     */
    public record Comparison(double score, MatchType type, double confidence, List<String> suggestions) {
    }

    public Comparison calculate(CodeBlock block1, CodeBlock block2) {
        if (block1.hash() == block2.hash()) {
            return new Comparison(1.0, MatchType.EXACT, 1.0, List.of("Exact duplicate found"));
        }

        double score = jaccard.calculate(block1.tokens(), block2.tokens());
        return new Comparison(
                score,
                MatchType.STRUCTURAL,
                score * CONFIDENCE_FACTOR,
                List.of(score > 0.8 ? "High structural similarity" : "Moderate similarity"));
    }
}
