package com.raditha.similarity.similarity;

import com.raditha.similarity.model.MatchType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.similarity.similarity.SimilarityTestBlocks.block;
import static org.junit.jupiter.api.Assertions.*;

class SimilarityCalculatorTest {

    private final SimilarityCalculator calculator = new SimilarityCalculator();

    @Test
    void testEqualHashIsExact() {
        String code = "function f(a) {\n  return a;\n}";

        SimilarityCalculator.Comparison comparison = calculator.calculate(block("a.js", 1, code), block("b.js", 7, code));

        assertEquals(1.0, comparison.score());
        assertEquals(MatchType.EXACT, comparison.type());
        assertEquals(1.0, comparison.confidence());
        assertEquals(List.of("Exact duplicate found"), comparison.suggestions());
    }

    @Test
    void testHighOverlapIsStructural() {
        // same token set, different text
        SimilarityCalculator.Comparison comparison = calculator.calculate(
                block("a.js", 1, "function total(items) {\n  return items.length;\n}"),
                block("b.js", 1, "function total(items){ return items.length; }"));

        assertEquals(1.0, comparison.score(), 0.0001);
        assertEquals(MatchType.STRUCTURAL, comparison.type());
        assertEquals(0.8, comparison.confidence(), 0.0001);
        assertEquals(List.of("High structural similarity"), comparison.suggestions());
    }

    @Test
    void testModerateOverlap() {
        // {function, total, items, return, length} vs {function, total, items, return, size}: 4 / 6
        SimilarityCalculator.Comparison comparison = calculator.calculate(
                block("a.js", 1, "function total(items) { return items.length; }"),
                block("b.js", 1, "function total(items) { return items.size; }"));

        assertEquals(4.0 / 6.0, comparison.score(), 0.0001);
        assertEquals(List.of("Moderate similarity"), comparison.suggestions());
    }
}
