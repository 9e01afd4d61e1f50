package com.raditha.similarity.analyzer;

import com.raditha.similarity.ai.SemanticJudge;
import com.raditha.similarity.ai.SemanticJudges;
import com.raditha.similarity.clustering.CommonPatternExtractor;
import com.raditha.similarity.clustering.DuplicateClusterer;
import com.raditha.similarity.config.SimilarityConfig;
import com.raditha.similarity.extraction.BlockExtractor;
import com.raditha.similarity.io.ProjectFileAccess;
import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.DuplicateCluster;
import com.raditha.similarity.model.MatchType;
import com.raditha.similarity.model.ReportStatistics;
import com.raditha.similarity.model.SimilarityMatch;
import com.raditha.similarity.model.SimilarityReport;
import com.raditha.similarity.similarity.ExactDuplicateFinder;
import com.raditha.similarity.similarity.SemanticSimilarityFinder;
import com.raditha.similarity.similarity.SimilarityCalculator;
import com.raditha.similarity.similarity.StructuralSimilarityFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main orchestrator for similarity analysis.
 * <p>
 * Runs extraction, the exact, structural and semantic passes, and clustering,
 * reporting progress at 0, 20, 40, 60, 80 and 100 percent. Only one project
 * analysis may run at a time per analyzer; a second request is rejected with
 * {@link AnalysisInProgressException}. The last report of each project is kept
 * in memory.
 * <p>
 * Unreadable files and failed judge calls never fail a run; they only mean
 * fewer blocks or matches.
 */
public class CodeSimilarityAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(CodeSimilarityAnalyzer.class);

    private final ProjectFileAccess fileAccess;
    private final SimilarityConfig config;
    private final BlockExtractor extractor;
    private final ExactDuplicateFinder exactFinder;
    private final StructuralSimilarityFinder structuralFinder;
    private final SemanticSimilarityFinder semanticFinder;
    private final DuplicateClusterer clusterer;
    private final SimilarityCalculator calculator;

    private final AtomicBoolean analyzing = new AtomicBoolean(false);
    private volatile int analysisProgress = 0;
    private final Map<String, SimilarityReport> analysisCache = new ConcurrentHashMap<>();
    private final Set<ProgressListener> progressListeners = new CopyOnWriteArraySet<>();

    /**
     * Create an analyzer whose semantic judge is built from the configuration.
     */
    public CodeSimilarityAnalyzer(ProjectFileAccess fileAccess, SimilarityConfig config) {
        this(fileAccess, SemanticJudges.fromConfig(config).orElse(null), config);
    }

    /**
     * Create an analyzer with an explicit semantic judge.
     *
     * @param fileAccess Project file lister and reader
     * @param judge      Semantic judge; null, or a configuration with the
     *                   semantic pass disabled, runs without semantic matches
     *                   and with the static pattern description
     * @param config     Thresholds and limits
     */
    public CodeSimilarityAnalyzer(ProjectFileAccess fileAccess, SemanticJudge judge, SimilarityConfig config) {
        if (!config.semanticEnabled()) {
            judge = null;
        }
        this.fileAccess = fileAccess;
        this.config = config;
        this.extractor = new BlockExtractor();
        this.exactFinder = new ExactDuplicateFinder();
        this.structuralFinder = new StructuralSimilarityFinder(config.structuralThreshold());
        this.semanticFinder = new SemanticSimilarityFinder(
                judge,
                config.semanticThreshold(),
                config.semanticBatchSize(),
                config.maxSemanticComparisons());
        this.clusterer = new DuplicateClusterer(new CommonPatternExtractor(judge));
        this.calculator = new SimilarityCalculator();
    }

    /**
     * Analyze a whole project.
     *
     * @param projectPath Project root, passed to the file lister
     * @return The new report, also stored as the project's last report
     * @throws AnalysisInProgressException if another analysis is running
     */
    public SimilarityReport analyzeProject(String projectPath) {
        if (!analyzing.compareAndSet(false, true)) {
            throw new AnalysisInProgressException(projectPath);
        }

        try {
            updateProgress(0);
            long started = System.currentTimeMillis();

            // Step 1: Extract code blocks
            List<String> files = listFiles(projectPath);
            List<CodeBlock> blocks = extractCodeBlocks(files);
            updateProgress(20);

            // Step 2: Exact duplicates
            List<SimilarityMatch> matches = new ArrayList<>();
            List<SimilarityMatch> exactMatches = exactFinder.find(blocks);
            matches.addAll(exactMatches);
            updateProgress(40);

            // Step 3: Structural similarities
            matches.addAll(structuralFinder.find(blocks));
            updateProgress(60);

            // Step 4: Semantic similarities
            matches.addAll(semanticFinder.find(blocks, exactMatches));
            updateProgress(80);

            // Step 5: Cluster and summarize
            List<DuplicateCluster> clusters = clusterer.cluster(matches);
            long timestamp = System.currentTimeMillis();
            SimilarityReport report = new SimilarityReport(
                    "similarity-" + timestamp,
                    projectPath,
                    timestamp,
                    files.size(),
                    matches.size(),
                    clusters,
                    matches,
                    ReportStatistics.from(matches, clusters));

            analysisCache.put(projectPath, report);
            updateProgress(100);

            logger.info("Analyzed {} files ({} blocks) in {} ms: {} matches, {} clusters",
                    files.size(), blocks.size(), timestamp - started, matches.size(), clusters.size());
            return report;
        } finally {
            analyzing.set(false);
        }
    }

    /**
     * Compare two files directly, without semantic judging or clustering.
     * A block is never compared with itself, and two blocks of the same file
     * only match when they are identical.
     *
     * @return Matches scoring at least the compare threshold, highest first
     */
    public List<SimilarityMatch> compareFiles(String file1, String file2) {
        List<CodeBlock> blocks1 = extractFileBlocks(file1);
        List<CodeBlock> blocks2 = extractFileBlocks(file2);
        List<SimilarityMatch> matches = new ArrayList<>();

        for (CodeBlock block1 : blocks1) {
            for (CodeBlock block2 : blocks2) {
                boolean sameFile = block1.filePath().equals(block2.filePath());
                // same-file pairs once, in line order, never a block with itself
                if (sameFile && block1.startLine() >= block2.startLine()) {
                    continue;
                }
                SimilarityCalculator.Comparison comparison = calculator.calculate(block1, block2);
                if (sameFile && comparison.type() != MatchType.EXACT) {
                    continue;
                }
                if (comparison.score() >= config.compareThreshold()) {
                    matches.add(SimilarityMatch.between(
                            null,
                            block1,
                            block2,
                            comparison.score(),
                            comparison.type(),
                            comparison.confidence(),
                            comparison.suggestions()));
                }
            }
        }

        matches.sort(Comparator.comparingDouble(SimilarityMatch::similarityScore).reversed());
        return matches;
    }

    /**
     * Register a progress listener.
     *
     * @return Action that unregisters the listener
     */
    public Runnable onProgress(ProgressListener listener) {
        progressListeners.add(listener);
        return () -> progressListeners.remove(listener);
    }

    public boolean isAnalyzing() {
        return analyzing.get();
    }

    public int getAnalysisProgress() {
        return analysisProgress;
    }

    public Optional<SimilarityReport> getLastReport(String projectPath) {
        return Optional.ofNullable(analysisCache.get(projectPath));
    }

    public void clearCache() {
        analysisCache.clear();
    }

    public SimilarityConfig getConfig() {
        return config;
    }

    private List<String> listFiles(String projectPath) {
        try {
            return fileAccess.listProjectTextFiles(projectPath);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to list project files of {}: {}", projectPath, e.getMessage());
            return List.of();
        }
    }

    private List<CodeBlock> extractCodeBlocks(List<String> files) {
        List<CodeBlock> blocks = new ArrayList<>();
        for (String file : files) {
            blocks.addAll(extractFileBlocks(file));
        }
        return blocks;
    }

    private List<CodeBlock> extractFileBlocks(String filePath) {
        try {
            return extractor.extractBlocks(filePath, fileAccess.readTextFile(filePath));
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to extract blocks from {}: {}", filePath, e.getMessage());
            return List.of();
        }
    }

    private void updateProgress(int percent) {
        analysisProgress = percent;
        for (ProgressListener listener : progressListeners) {
            try {
                listener.onProgress(percent);
            } catch (RuntimeException e) {
                logger.warn("Progress listener failed: {}", e.getMessage());
            }
        }
    }
}
