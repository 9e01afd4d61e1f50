package com.raditha.similarity.similarity;

import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.MatchType;
import com.raditha.similarity.model.SimilarityMatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds blocks with identical structural hashes.
 * Two ranges of the same file may match each other.
 */
public class ExactDuplicateFinder {

    static final List<String> SUGGESTIONS = List.of("Consider extracting to a shared function or module");

    public List<SimilarityMatch> find(List<CodeBlock> blocks) {
        Map<Integer, List<CodeBlock>> byHash = new LinkedHashMap<>();
        for (CodeBlock block : blocks) {
            byHash.computeIfAbsent(block.hash(), h -> new ArrayList<>()).add(block);
        }

        List<SimilarityMatch> matches = new ArrayList<>();
        for (List<CodeBlock> group : byHash.values()) {
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    matches.add(SimilarityMatch.between(
                            "exact",
                            group.get(i),
                            group.get(j),
                            1.0,
                            MatchType.EXACT,
                            1.0,
                            SUGGESTIONS));
                }
            }
        }
        return matches;
    }
}
