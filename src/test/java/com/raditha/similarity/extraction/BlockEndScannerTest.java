package com.raditha.similarity.extraction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for brace balancing in BlockEndScanner.
 */
class BlockEndScannerTest {

    private BlockEndScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new BlockEndScanner();
    }

    @Test
    void testSimpleBlock() {
        List<String> lines = List.of(
                "function f() {",
                "  return 1;",
                "}",
                "const x = 2;");

        assertEquals(2, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testNestedBlocks() {
        List<String> lines = List.of(
                "function f(a) {",
                "  if (a) {",
                "    return 1;",
                "  }",
                "  return 0;",
                "}");

        assertEquals(5, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testBracesInsideStringsIgnored() {
        List<String> lines = List.of(
                "function f() {",
                "  const s = \"}\";",
                "  const t = '{';",
                "  return s + t;",
                "}");

        assertEquals(4, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testEscapedQuoteDoesNotCloseString() {
        List<String> lines = List.of(
                "function f() {",
                "  const s = \"a \\\" } b\";",
                "}");

        assertEquals(2, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testOtherQuoteInsideStringIgnored() {
        List<String> lines = List.of(
                "function f() {",
                "  const s = \"it's } here\";",
                "}");

        assertEquals(2, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testUnbalancedRunsToEndOfFile() {
        List<String> lines = List.of(
                "function f() {",
                "  return 1;",
                "  // never closed");

        assertEquals(2, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testEndIsAlwaysAfterStart() {
        // Depth is zero on the first line, so the next line ends the block
        List<String> lines = List.of(
                "function f() { return 1; }",
                "const y = 3;");

        assertEquals(1, scanner.findBlockEnd(lines, 0));
    }

    @Test
    void testStartAtLastLine() {
        List<String> lines = List.of("x", "function f() {");

        assertEquals(1, scanner.findBlockEnd(lines, 1));
    }
}
