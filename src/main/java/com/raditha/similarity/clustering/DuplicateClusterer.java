package com.raditha.similarity.clustering;

import com.raditha.similarity.detection.BlockHasher;
import com.raditha.similarity.detection.BlockTokenizer;
import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.DuplicateCluster;
import com.raditha.similarity.model.EstimatedSavings;
import com.raditha.similarity.model.LineRange;
import com.raditha.similarity.model.RefactoringPriority;
import com.raditha.similarity.model.SimilarityMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups pairwise similarity matches into duplicate clusters.
 * <p>
 * Grouping is greedy and single hop: each unprocessed match seeds a cluster,
 * which absorbs every later unprocessed match that touches one of the seed's
 * two files. Files brought in by absorbed matches do not pull in further
 * matches, so a chain of three or more files can end up split across
 * clusters.
 */
public class DuplicateClusterer {

    /** Share of duplicated lines expected to disappear after refactoring. */
    static final double LINE_REDUCTION = 0.7;
    static final int MAINTAINABILITY_PER_MATCH = 10;

    private final CommonPatternExtractor patternExtractor;
    private final BlockHasher hasher;
    private final BlockTokenizer tokenizer;

    public DuplicateClusterer(CommonPatternExtractor patternExtractor) {
        this(patternExtractor, new BlockHasher(), new BlockTokenizer());
    }

    public DuplicateClusterer(CommonPatternExtractor patternExtractor, BlockHasher hasher, BlockTokenizer tokenizer) {
        this.patternExtractor = patternExtractor;
        this.hasher = hasher;
        this.tokenizer = tokenizer;
    }

    /**
     * Cluster matches.
     *
     * @param matches Matches in pass order
     * @return Clusters sorted by average similarity (highest first)
     */
    public List<DuplicateCluster> cluster(List<SimilarityMatch> matches) {
        if (matches.isEmpty()) {
            return List.of();
        }

        List<DuplicateCluster> clusters = new ArrayList<>();
        Set<String> processed = new HashSet<>();

        for (int i = 0; i < matches.size(); i++) {
            SimilarityMatch seed = matches.get(i);
            if (processed.contains(seed.id())) {
                continue;
            }
            processed.add(seed.id());

            Set<String> files = new LinkedHashSet<>();
            files.add(seed.sourceFile());
            files.add(seed.targetFile());

            List<SimilarityMatch> members = new ArrayList<>();
            members.add(seed);

            for (int j = i + 1; j < matches.size(); j++) {
                SimilarityMatch related = matches.get(j);
                if (processed.contains(related.id())) {
                    continue;
                }
                if (related.touches(seed.sourceFile()) || related.touches(seed.targetFile())) {
                    files.add(related.sourceFile());
                    files.add(related.targetFile());
                    members.add(related);
                    processed.add(related.id());
                }
            }

            clusters.add(new DuplicateCluster(
                    "cluster-" + (clusters.size() + 1),
                    new ArrayList<>(files),
                    List.of(
                            toBlock(seed.sourceFile(), seed.sourceLines(), seed.sourceCode()),
                            toBlock(seed.targetFile(), seed.targetLines(), seed.targetCode())),
                    patternExtractor.extract(List.of(seed.sourceCode(), seed.targetCode())),
                    averageSimilarity(members),
                    RefactoringPriority.fromScore(seed.similarityScore()),
                    estimateSavings(members)));
        }

        return clusters.stream()
                .sorted(Comparator.comparingDouble(DuplicateCluster::averageSimilarity).reversed())
                .toList();
    }

    /**
     * 70% of the source-side lines of every match, and a maintainability score
     * proportional to the number of matches.
     */
    static EstimatedSavings estimateSavings(List<SimilarityMatch> members) {
        int totalLines = members.stream()
                .mapToInt(m -> m.sourceLines().lineCount())
                .sum();
        return new EstimatedSavings(
                (int) Math.floor(totalLines * LINE_REDUCTION),
                members.size() * MAINTAINABILITY_PER_MATCH);
    }

    private static double averageSimilarity(List<SimilarityMatch> members) {
        return members.stream()
                .mapToDouble(SimilarityMatch::similarityScore)
                .average()
                .orElse(0.0);
    }

    private CodeBlock toBlock(String file, LineRange lines, String code) {
        return new CodeBlock(
                file,
                lines.startLine(),
                lines.endLine(),
                code,
                hasher.hash(code),
                tokenizer.tokenize(code));
    }
}
