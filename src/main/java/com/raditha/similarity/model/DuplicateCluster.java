package com.raditha.similarity.model;

import java.util.List;

/**
 * A group of files and blocks connected by one or more similarity matches,
 * treated as one refactoring unit.
 *
 * @param id                  Cluster id
 * @param files               Files touched, in the order they joined
 * @param codeBlocks          The two seed blocks taken from the originating
 *                            match
 * @param commonPattern       Description of the shared pattern
 * @param averageSimilarity   Mean score of the matches in the cluster
 * @param refactoringPriority Priority derived from the seed match
 * @param estimatedSavings    Expected payoff of refactoring
 */
public record DuplicateCluster(
        String id,
        List<String> files,
        List<CodeBlock> codeBlocks,
        String commonPattern,
        double averageSimilarity,
        RefactoringPriority refactoringPriority,
        EstimatedSavings estimatedSavings) {

    public DuplicateCluster {
        files = List.copyOf(files);
        codeBlocks = List.copyOf(codeBlocks);
    }

    /**
     * Format cluster summary for display.
     */
    public String formatSummary() {
        return String.format("%d files, avg %.1f%% similar, %s priority, ~%d LOC reduction",
                files.size(),
                averageSimilarity * 100,
                refactoringPriority.label(),
                estimatedSavings.linesOfCode());
    }
}
