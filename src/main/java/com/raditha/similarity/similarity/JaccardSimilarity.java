package com.raditha.similarity.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard similarity of two token collections, treated as sets.
 * Jaccard = |A ∩ B| / |A ∪ B|, defined as 0 when both are empty.
 */
public class JaccardSimilarity {

    public double calculate(Collection<String> tokens1, Collection<String> tokens2) {
        if (tokens1 == null || tokens2 == null) {
            return 0.0;
        }

        Set<String> set1 = new HashSet<>(tokens1);
        Set<String> set2 = new HashSet<>(tokens2);

        Set<String> union = new HashSet<>(set1);
        union.addAll(set2);
        if (union.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        return (double) intersection.size() / union.size();
    }
}
