package com.raditha.similarity.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.similarity.config.SimilarityConfig;
import com.raditha.similarity.model.DuplicateCluster;
import com.raditha.similarity.model.ReportStatistics;
import com.raditha.similarity.model.SimilarityMatch;
import com.raditha.similarity.model.SimilarityReport;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders similarity reports and file comparisons as text or JSON.
 */
public class ReportPrinter {

    static final int MAX_MATCHES_SHOWN = 10;
    static final int MAX_SNIPPET_LINES = 8;

    private static final ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final PrintWriter out;

    public ReportPrinter(PrintWriter out) {
        this.out = out;
    }

    public void printJson(Object value) throws JsonProcessingException {
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        out.flush();
    }

    public void printReport(SimilarityReport report, SimilarityConfig config) {
        out.println("=".repeat(80));
        out.println("CODE SIMILARITY REPORT");
        out.println("=".repeat(80));
        out.println();
        out.printf("Project: %s%n", report.projectPath());
        out.printf("Files analyzed: %d%n", report.totalFiles());
        out.printf("Total matches: %d%n", report.totalMatches());
        out.printf("Duplicate clusters: %d%n", report.duplicateClusters().size());
        out.printf("Configuration: structural=%.0f%%, semantic=%s%n",
                config.structuralThreshold() * 100,
                config.semanticEnabled() ? String.format("%.0f%%", config.semanticThreshold() * 100) : "off");
        out.println();

        if (!report.hasMatches()) {
            out.println("No significant code similarity found.");
            out.println();
            out.flush();
            return;
        }

        printStatistics(report.statistics());
        printClusters(report.duplicateClusters());
        printMatches(report.similarityMatches());

        out.println("=".repeat(80));
        out.println(report.formatSummary());
        out.flush();
    }

    public void printComparison(String file1, String file2, List<SimilarityMatch> matches) {
        out.println("=".repeat(80));
        out.printf("COMPARISON: %s <-> %s%n", file1, file2);
        out.println("=".repeat(80));
        out.println();

        if (matches.isEmpty()) {
            out.println("No similar blocks found.");
            out.println();
            out.flush();
            return;
        }
        printMatches(matches);
        out.flush();
    }

    private void printStatistics(ReportStatistics stats) {
        out.println("-".repeat(80));
        out.println("STATISTICS");
        out.println("-".repeat(80));
        out.printf("  Exact duplicates:    %d%n", stats.exactDuplicates());
        out.printf("  Structural similar:  %d%n", stats.structuralSimilar());
        out.printf("  Semantic similar:    %d%n", stats.semanticSimilar());
        out.printf("  Functional similar:  %d%n", stats.functionalSimilar());
        out.printf("  Potential savings:   ~%d LOC%n", stats.potentialSavings());
        out.println();
    }

    private void printClusters(List<DuplicateCluster> clusters) {
        if (clusters.isEmpty()) {
            return;
        }
        out.println("-".repeat(80));
        out.println("CLUSTERS");
        out.println("-".repeat(80));
        for (DuplicateCluster cluster : clusters) {
            out.printf("  %s: %s%n", cluster.id(), cluster.formatSummary());
            out.printf("    Pattern: %s%n", cluster.commonPattern());
            for (String file : cluster.files()) {
                out.printf("    - %s%n", file);
            }
        }
        out.println();
    }

    private void printMatches(List<SimilarityMatch> matches) {
        out.println("-".repeat(80));
        out.println("MATCHES");
        out.println("-".repeat(80));
        int shown = Math.min(MAX_MATCHES_SHOWN, matches.size());
        for (int i = 0; i < shown; i++) {
            SimilarityMatch match = matches.get(i);
            out.printf("#%d %s (%s, confidence %.0f%%)%n",
                    i + 1, match.matchType().label(), match.formatScore(), match.confidence() * 100);
            out.printf("  %s [%s]%n", match.sourceFile(), match.sourceLines().toDisplayString());
            out.printf("  %s [%s]%n", match.targetFile(), match.targetLines().toDisplayString());
            printSnippet(match.sourceCode());
            for (String suggestion : match.suggestions()) {
                out.printf("  * %s%n", suggestion);
            }
            out.println();
        }
        if (matches.size() > shown) {
            out.printf("... and %d more%n%n", matches.size() - shown);
        }
    }

    private void printSnippet(String code) {
        String[] lines = code.split("\n", -1);
        int count = Math.min(MAX_SNIPPET_LINES, lines.length);
        for (int i = 0; i < count; i++) {
            out.println("    | " + lines[i]);
        }
        if (lines.length > count) {
            out.printf("    | ... (%d more lines)%n", lines.length - count);
        }
    }
}
