package com.raditha.similarity.similarity;

import java.util.List;

/**
 * What the semantic judge said about a pair of blocks.
 *
 * @param similarity  Judged similarity (0.0-1.0)
 * @param type        functional, algorithmic or semantic
 * @param confidence  Judge's confidence (0.0-1.0)
 * @param reasoning   Free-text explanation
 * @param suggestions Refactoring hints
 */
public record SemanticVerdict(
        double similarity,
        String type,
        double confidence,
        String reasoning,
        List<String> suggestions) {

    public SemanticVerdict {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * The neutral verdict used when a reply cannot be understood.
     */
    public static SemanticVerdict none() {
        return new SemanticVerdict(0.0, null, 0.0, null, List.of());
    }

    public boolean isFunctional() {
        return "functional".equalsIgnoreCase(type);
    }
}
