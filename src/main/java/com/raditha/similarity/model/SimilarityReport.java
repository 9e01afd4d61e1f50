package com.raditha.similarity.model;

import java.util.List;

/**
 * Result of one project analysis run.
 *
 * @param id                Report id
 * @param projectPath       Analyzed project
 * @param timestamp         Creation time in epoch milliseconds
 * @param totalFiles        Number of files listed for the project
 * @param totalMatches      Number of similarity matches
 * @param duplicateClusters Clusters sorted by average similarity, highest first
 * @param similarityMatches Matches in pass order: exact, structural, semantic
 * @param statistics        Aggregated counts
 */
public record SimilarityReport(
        String id,
        String projectPath,
        long timestamp,
        int totalFiles,
        int totalMatches,
        List<DuplicateCluster> duplicateClusters,
        List<SimilarityMatch> similarityMatches,
        ReportStatistics statistics) {

    public SimilarityReport {
        duplicateClusters = List.copyOf(duplicateClusters);
        similarityMatches = List.copyOf(similarityMatches);
    }

    public boolean hasMatches() {
        return !similarityMatches.isEmpty();
    }

    /**
     * Get matches of one type.
     */
    public List<SimilarityMatch> getMatches(MatchType type) {
        return similarityMatches.stream()
                .filter(m -> m.matchType() == type)
                .toList();
    }

    /**
     * Format summary statistics for display.
     */
    public String formatSummary() {
        return String.format(
                "Found %d matches in %d clusters across %d files (exact: %d, structural: %d, semantic: %d, functional: %d, ~%d LOC savings)",
                totalMatches,
                duplicateClusters.size(),
                totalFiles,
                statistics.exactDuplicates(),
                statistics.structuralSimilar(),
                statistics.semanticSimilar(),
                statistics.functionalSimilar(),
                statistics.potentialSavings());
    }
}
