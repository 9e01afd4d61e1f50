package com.raditha.similarity.similarity;

import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.MatchType;
import com.raditha.similarity.model.SimilarityMatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares every pair of blocks from different files by token overlap.
 * Confidence is discounted to 90% of the score since token overlap is a
 * weaker signal than an identical hash.
 */
public class StructuralSimilarityFinder {

    static final double CONFIDENCE_FACTOR = 0.9;
    static final List<String> SUGGESTIONS = List.of(
            "Similar code structure detected",
            "Consider refactoring common patterns");

    private final JaccardSimilarity jaccard;
    private final double threshold;

    public StructuralSimilarityFinder(double threshold) {
        this(new JaccardSimilarity(), threshold);
    }

    public StructuralSimilarityFinder(JaccardSimilarity jaccard, double threshold) {
        this.jaccard = jaccard;
        this.threshold = threshold;
    }

    public List<SimilarityMatch> find(List<CodeBlock> blocks) {
        List<SimilarityMatch> matches = new ArrayList<>();

        for (int i = 0; i < blocks.size(); i++) {
            for (int j = i + 1; j < blocks.size(); j++) {
                CodeBlock block1 = blocks.get(i);
                CodeBlock block2 = blocks.get(j);

                if (block1.filePath().equals(block2.filePath())) {
                    continue;
                }

                double score = jaccard.calculate(block1.tokens(), block2.tokens());
                if (score >= threshold) {
                    matches.add(SimilarityMatch.between(
                            "structural",
                            block1,
                            block2,
                            score,
                            MatchType.STRUCTURAL,
                            score * CONFIDENCE_FACTOR,
                            SUGGESTIONS));
                }
            }
        }

        return matches;
    }
}
