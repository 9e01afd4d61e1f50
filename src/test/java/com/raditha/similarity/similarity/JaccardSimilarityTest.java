package com.raditha.similarity.similarity;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JaccardSimilarityTest {

    private final JaccardSimilarity jaccard = new JaccardSimilarity();

    @Test
    void testIdenticalSets() {
        assertEquals(1.0, jaccard.calculate(List.of("a", "b"), List.of("b", "a")), 0.0001);
    }

    @Test
    void testPartialOverlap() {
        // {return, total, sum} vs {return, total, count}: 2 / 4
        assertEquals(0.5, jaccard.calculate(
                List.of("return", "total", "sum"),
                List.of("return", "total", "count")), 0.0001);
    }

    @Test
    void testDuplicatesCountOnce() {
        assertEquals(1.0, jaccard.calculate(List.of("x", "x", "y"), List.of("x", "y")), 0.0001);
    }

    @Test
    void testDisjointAndEmpty() {
        assertEquals(0.0, jaccard.calculate(List.of("a"), List.of("b")), 0.0001);
        assertEquals(0.0, jaccard.calculate(List.of(), List.of()), 0.0001);
        assertEquals(0.0, jaccard.calculate(List.of("a"), List.of()), 0.0001);
        assertEquals(0.0, jaccard.calculate(null, List.of("a")), 0.0001);
    }

    @Property(tries = 200)
    void similarityIsSymmetricAndBounded(
            @ForAll @Size(max = 12) List<String> tokens1,
            @ForAll @Size(max = 12) List<String> tokens2) {
        double forward = jaccard.calculate(tokens1, tokens2);
        double backward = jaccard.calculate(tokens2, tokens1);

        assertEquals(forward, backward, 0.0);
        assertTrue(forward >= 0.0 && forward <= 1.0);
    }
}
