package com.raditha.similarity.model;

import java.util.List;

/**
 * A pairwise relationship between two code blocks.
 * The code is copied so the match outlives the blocks it was built from.
 *
 * @param id                     Stable id derived from both blocks' identity
 * @param sourceFile             File of the first block
 * @param targetFile             File of the second block
 * @param sourceLines            Line range of the first block
 * @param targetLines            Line range of the second block
 * @param sourceCode             Text of the first block
 * @param targetCode             Text of the second block
 * @param similarityScore        Degree of similarity (0.0-1.0)
 * @param matchType              Method that produced the match
 * @param confidence             Certainty in the method (0.0-1.0)
 * @param suggestions            Human-readable refactoring hints
 * @param refactoringOpportunity True when the score is at least 0.8
 */
public record SimilarityMatch(
        String id,
        String sourceFile,
        String targetFile,
        LineRange sourceLines,
        LineRange targetLines,
        String sourceCode,
        String targetCode,
        double similarityScore,
        MatchType matchType,
        double confidence,
        List<String> suggestions,
        boolean refactoringOpportunity) {

    public static final double REFACTORING_THRESHOLD = 0.8;

    public SimilarityMatch {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Build a match between two blocks. The id is {@code prefix} followed by
     * both blocks' file and start line.
     */
    public static SimilarityMatch between(
            String prefix,
            CodeBlock source,
            CodeBlock target,
            double score,
            MatchType type,
            double confidence,
            List<String> suggestions) {
        String id = (prefix == null || prefix.isEmpty() ? "" : prefix + "-")
                + source.location() + "-" + target.location();
        return new SimilarityMatch(
                id,
                source.filePath(),
                target.filePath(),
                source.range(),
                target.range(),
                source.code(),
                target.code(),
                score,
                type,
                confidence,
                suggestions,
                score >= REFACTORING_THRESHOLD);
    }

    /**
     * Check whether either side of this match lives in the given file.
     */
    public boolean touches(String file) {
        return sourceFile.equals(file) || targetFile.equals(file);
    }

    /**
     * Format score as percentage string.
     */
    public String formatScore() {
        return String.format("%.1f%%", similarityScore * 100.0);
    }
}
