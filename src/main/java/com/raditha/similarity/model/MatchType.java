package com.raditha.similarity.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a {@link SimilarityMatch} was established.
 */
public enum MatchType {
    /** Identical structural hash */
    EXACT,

    /** High token-set overlap */
    STRUCTURAL,

    /** Judged similar in meaning by the semantic judge */
    SEMANTIC,

    /** Judged to accomplish the same thing by the semantic judge */
    FUNCTIONAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
