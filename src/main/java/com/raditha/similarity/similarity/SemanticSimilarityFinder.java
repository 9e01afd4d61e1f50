package com.raditha.similarity.similarity;

import com.raditha.similarity.ai.SemanticJudge;
import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.MatchType;
import com.raditha.similarity.model.SimilarityMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Asks the semantic judge whether pairs of blocks from different files do the
 * same thing, regardless of how they are written.
 * <p>
 * Blocks that already have an exact duplicate are left out. Calls are made in
 * batches; a batch is finished before the next starts, so no more than
 * {@code batchSize} calls are in flight at once. A failed call only loses its
 * own pair.
 */
public class SemanticSimilarityFinder {
    private static final Logger logger = LoggerFactory.getLogger(SemanticSimilarityFinder.class);

    private final SemanticJudge judge;
    private final SemanticResponseParser parser;
    private final double threshold;
    private final int batchSize;
    private final int maxComparisons;

    /**
     * @param judge          Model access; null disables the pass
     * @param threshold      Minimum judged similarity to report
     * @param batchSize      Maximum concurrent judge calls
     * @param maxComparisons Upper bound on judge calls per run
     */
    public SemanticSimilarityFinder(SemanticJudge judge, double threshold, int batchSize, int maxComparisons) {
        this(judge, new SemanticResponseParser(), threshold, batchSize, maxComparisons);
    }

    public SemanticSimilarityFinder(SemanticJudge judge, SemanticResponseParser parser,
            double threshold, int batchSize, int maxComparisons) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.judge = judge;
        this.parser = parser;
        this.threshold = threshold;
        this.batchSize = batchSize;
        this.maxComparisons = maxComparisons;
    }

    public boolean isEnabled() {
        return judge != null;
    }

    /**
     * Judge candidate pairs and return the accepted matches in pair order.
     *
     * @param blocks       All blocks of the run
     * @param exactMatches Matches from the exact pass; their blocks are skipped
     */
    public List<SimilarityMatch> find(List<CodeBlock> blocks, List<SimilarityMatch> exactMatches) {
        if (!isEnabled()) {
            return List.of();
        }

        List<BlockPair> pairs = candidatePairs(blocks, exactMatches);
        if (pairs.isEmpty()) {
            return List.of();
        }

        List<SimilarityMatch> matches = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batchSize, pairs.size()));
        try {
            for (int start = 0; start < pairs.size(); start += batchSize) {
                List<BlockPair> batch = pairs.subList(start, Math.min(start + batchSize, pairs.size()));
                if (!runBatch(executor, batch, matches)) {
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        logger.debug("Semantic pass judged {} pairs, accepted {}", pairs.size(), matches.size());
        return matches;
    }

    /**
     * Cross-file pairs of the blocks that have no exact duplicate, capped at
     * {@code maxComparisons}.
     */
    List<BlockPair> candidatePairs(List<CodeBlock> blocks, List<SimilarityMatch> exactMatches) {
        Set<String> duplicated = new HashSet<>();
        for (SimilarityMatch match : exactMatches) {
            duplicated.add(match.sourceFile() + "-" + match.sourceLines().startLine());
            duplicated.add(match.targetFile() + "-" + match.targetLines().startLine());
        }

        List<CodeBlock> eligible = blocks.stream()
                .filter(b -> !duplicated.contains(b.location()))
                .toList();

        List<BlockPair> pairs = new ArrayList<>();
        for (int i = 0; i < eligible.size(); i++) {
            for (int j = i + 1; j < eligible.size(); j++) {
                CodeBlock block1 = eligible.get(i);
                CodeBlock block2 = eligible.get(j);
                if (block1.filePath().equals(block2.filePath())) {
                    continue;
                }
                if (pairs.size() >= maxComparisons) {
                    logger.info("Semantic comparisons capped at {}", maxComparisons);
                    return pairs;
                }
                pairs.add(new BlockPair(block1, block2));
            }
        }
        return pairs;
    }

    /**
     * @return false when interrupted and the pass should stop
     */
    private boolean runBatch(ExecutorService executor, List<BlockPair> batch, List<SimilarityMatch> matches) {
        List<Future<Optional<SimilarityMatch>>> futures = new ArrayList<>();
        for (BlockPair pair : batch) {
            futures.add(executor.submit(() -> judgePair(pair)));
        }

        for (Future<Optional<SimilarityMatch>> future : futures) {
            try {
                future.get().ifPresent(matches::add);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Semantic pass interrupted, keeping {} matches", matches.size());
                return false;
            } catch (ExecutionException e) {
                logger.warn("Failed to analyze semantic similarity: {}", e.getCause().getMessage());
            }
        }
        return true;
    }

    Optional<SimilarityMatch> judgePair(BlockPair pair) {
        CodeBlock block1 = pair.first();
        CodeBlock block2 = pair.second();
        try {
            SemanticVerdict verdict = parser.parse(judge.judge(buildPrompt(block1, block2)));
            if (verdict.similarity() < threshold) {
                return Optional.empty();
            }
            return Optional.of(SimilarityMatch.between(
                    "semantic",
                    block1,
                    block2,
                    verdict.similarity(),
                    verdict.isFunctional() ? MatchType.FUNCTIONAL : MatchType.SEMANTIC,
                    verdict.confidence(),
                    verdict.suggestions()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (Exception e) {
            logger.warn("Failed to analyze semantic similarity of {} and {}: {}",
                    block1.location(), block2.location(), e.getMessage());
            return Optional.empty();
        }
    }

    static String buildPrompt(CodeBlock block1, CodeBlock block2) {
        return """
                Compare these two code blocks for semantic similarity:

                Block 1 (%s):
                ```
                %s
                ```

                Block 2 (%s):
                ```
                %s
                ```

                Analyze:
                1. Functional similarity (do they accomplish the same thing?)
                2. Algorithmic similarity (similar approach/logic?)
                3. Semantic similarity (similar meaning/purpose?)

                Return a JSON object with:
                {
                  "similarity": 0.0-1.0,
                  "type": "functional|algorithmic|semantic",
                  "confidence": 0.0-1.0,
                  "reasoning": "explanation",
                  "suggestions": ["suggestion1", "suggestion2"]
                }
                """.formatted(block1.filePath(), block1.code(), block2.filePath(), block2.code());
    }

    /**
     * Two blocks to be judged together.
     */
    record BlockPair(CodeBlock first, CodeBlock second) {
    }
}
