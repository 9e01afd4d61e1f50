package com.raditha.similarity.clustering;

import com.raditha.similarity.ai.SemanticJudge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Describes the pattern shared by a group of code blocks.
 * Uses the semantic judge when one is available; otherwise, or when the call
 * fails, returns {@link #FALLBACK_PATTERN}.
 */
public class CommonPatternExtractor {
    private static final Logger logger = LoggerFactory.getLogger(CommonPatternExtractor.class);

    public static final String FALLBACK_PATTERN = "Similar code structure";
    public static final String EMPTY_REPLY_PATTERN = "Common pattern detected";

    private final SemanticJudge judge;

    /**
     * @param judge Model access; null means always use the fallback
     */
    public CommonPatternExtractor(SemanticJudge judge) {
        this.judge = judge;
    }

    public String extract(List<String> codes) {
        if (judge == null) {
            return FALLBACK_PATTERN;
        }
        try {
            String reply = judge.judge(buildPrompt(codes));
            if (reply == null || reply.isBlank()) {
                return EMPTY_REPLY_PATTERN;
            }
            return reply.trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Pattern extraction interrupted");
        } catch (Exception e) {
            logger.warn("Pattern extraction failed: {}", e.getMessage());
        }
        return FALLBACK_PATTERN;
    }

    static String buildPrompt(List<String> codes) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze these code blocks and extract the common pattern:\n\n");
        for (int i = 0; i < codes.size(); i++) {
            prompt.append("Block ").append(i + 1).append(":\n```\n")
                    .append(codes.get(i))
                    .append("\n```\n\n");
        }
        prompt.append("Identify the common algorithmic or structural pattern and describe it concisely.");
        return prompt.toString();
    }
}
