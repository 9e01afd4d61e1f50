package com.raditha.similarity.similarity;

import com.raditha.similarity.model.CodeBlock;
import com.raditha.similarity.model.MatchType;
import com.raditha.similarity.model.SimilarityMatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.similarity.similarity.SimilarityTestBlocks.block;
import static org.junit.jupiter.api.Assertions.*;

class ExactDuplicateFinderTest {

    private static final String ADD = "function add(a, b) {\n  return a + b;\n}";
    private static final String SUB = "function sub(a, b) {\n  return a - b;\n}";

    private final ExactDuplicateFinder finder = new ExactDuplicateFinder();

    @Test
    void testIdenticalBlocksInTwoFiles() {
        List<SimilarityMatch> matches = finder.find(List.of(
                block("a.ts", 1, ADD),
                block("b.ts", 5, ADD),
                block("b.ts", 10, SUB)));

        assertEquals(1, matches.size());
        SimilarityMatch match = matches.get(0);
        assertEquals("exact-a.ts-1-b.ts-5", match.id());
        assertEquals(MatchType.EXACT, match.matchType());
        assertEquals(1.0, match.similarityScore());
        assertEquals(1.0, match.confidence());
        assertTrue(match.refactoringOpportunity());
        assertEquals(List.of("Consider extracting to a shared function or module"), match.suggestions());
    }

    @Test
    void testSameFileDuplicatesMatch() {
        List<SimilarityMatch> matches = finder.find(List.of(
                block("a.ts", 1, ADD),
                block("a.ts", 20, ADD)));

        assertEquals(1, matches.size());
        assertEquals("a.ts", matches.get(0).sourceFile());
        assertEquals("a.ts", matches.get(0).targetFile());
    }

    @Test
    void testEveryPairOfAGroup() {
        List<SimilarityMatch> matches = finder.find(List.of(
                block("a.ts", 1, ADD),
                block("b.ts", 1, ADD),
                block("c.ts", 1, ADD)));

        assertEquals(3, matches.size());
        assertEquals(List.of("exact-a.ts-1-b.ts-1", "exact-a.ts-1-c.ts-1", "exact-b.ts-1-c.ts-1"),
                matches.stream().map(SimilarityMatch::id).toList());
    }

    @Test
    void testIdempotent() {
        List<CodeBlock> blocks = List.of(block("a.ts", 1, ADD), block("b.ts", 1, ADD), block("c.ts", 1, SUB));

        assertEquals(finder.find(blocks), finder.find(blocks));
    }

    @Test
    void testNoBlocks() {
        assertTrue(finder.find(List.of()).isEmpty());
    }
}
