package com.raditha.similarity.model;

import java.util.List;

/**
 * Per match type counts plus the aggregate potential savings of a report.
 */
public record ReportStatistics(
        int exactDuplicates,
        int structuralSimilar,
        int semanticSimilar,
        int functionalSimilar,
        int potentialSavings) {

    public static ReportStatistics empty() {
        return new ReportStatistics(0, 0, 0, 0, 0);
    }

    public static ReportStatistics from(List<SimilarityMatch> matches, List<DuplicateCluster> clusters) {
        return new ReportStatistics(
                count(matches, MatchType.EXACT),
                count(matches, MatchType.STRUCTURAL),
                count(matches, MatchType.SEMANTIC),
                count(matches, MatchType.FUNCTIONAL),
                clusters.stream()
                        .mapToInt(c -> c.estimatedSavings().linesOfCode())
                        .sum());
    }

    private static int count(List<SimilarityMatch> matches, MatchType type) {
        return (int) matches.stream()
                .filter(m -> m.matchType() == type)
                .count();
    }
}
