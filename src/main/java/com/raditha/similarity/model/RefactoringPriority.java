package com.raditha.similarity.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Refactoring priority of a duplicate cluster, derived from its seed score.
 */
public enum RefactoringPriority {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * At least 0.9 is high, at least 0.7 medium, everything else low.
     */
    public static RefactoringPriority fromScore(double score) {
        if (score >= 0.9) {
            return HIGH;
        }
        if (score >= 0.7) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
