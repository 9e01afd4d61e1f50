package com.raditha.similarity.extraction;

import com.raditha.similarity.detection.BlockHasher;
import com.raditha.similarity.detection.BlockTokenizer;
import com.raditha.similarity.model.CodeBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BlockExtractor.
 */
class BlockExtractorTest {

    private static final String SCRIPT = """
            import { api } from './api';

            export function add(a, b) {
              return a + b;
            }

            export class Cart {
              total(items) {
                let sum = 0;
                for (const item of items) {
                  sum += item.price;
                }
                return sum;
              }
            }
            """;

    private BlockExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new BlockExtractor();
    }

    @Test
    void testFunctionsBeforeClasses() {
        List<BlockExtractor.BlockRegion> regions = extractor.extractBlocks(SCRIPT, Language.TYPESCRIPT);

        assertEquals(3, regions.size());

        BlockExtractor.BlockRegion add = regions.get(0);
        assertEquals(3, add.startLine());
        assertEquals(5, add.endLine());
        assertTrue(add.code().startsWith("export function add(a, b) {"));
        assertTrue(add.code().endsWith("}"));

        BlockExtractor.BlockRegion total = regions.get(1);
        assertEquals(8, total.startLine());
        assertEquals(14, total.endLine());

        BlockExtractor.BlockRegion cart = regions.get(2);
        assertEquals(7, cart.startLine());
        assertEquals(15, cart.endLine());
    }

    @Test
    void testBlocksCarryHashAndTokens() {
        List<CodeBlock> blocks = extractor.extractBlocks("src/cart.ts", SCRIPT);
        CodeBlock add = blocks.get(0);

        assertEquals("src/cart.ts", add.filePath());
        assertEquals(new BlockHasher().hash(add.code()), add.hash());
        assertEquals(new BlockTokenizer().tokenize(add.code()), add.tokens());
        assertTrue(add.tokens().contains("return"));
    }

    @Test
    void testUnknownLanguageYieldsNothing() {
        assertTrue(extractor.extractBlocks("notes.md", "function f() {\n}\n").isEmpty());
        assertTrue(extractor.extractBlocks("Makefile", SCRIPT).isEmpty());
    }

    @Test
    void testEmptyContent() {
        assertTrue(extractor.extractBlocks("a.js", "").isEmpty());
        assertTrue(extractor.extractBlocks("", Language.JAVASCRIPT).isEmpty());
    }

    @Test
    void testControlStatementsAreNotBlocks() {
        String content = """
                if (ready) {
                  start();
                }
                for (let i = 0; i < 3; i++) {
                  tick(i);
                }
                """;

        assertTrue(extractor.extractBlocks("main.js", content).isEmpty());
    }

    @Test
    void testJavaMethodsAndClass() {
        String content = """
                public class Calculator {
                    public int add(int a, int b) {
                        return a + b;
                    }
                }
                """;

        List<CodeBlock> blocks = extractor.extractBlocks("Calculator.java", content);

        assertEquals(2, blocks.size());
        assertEquals(2, blocks.get(0).startLine());
        assertEquals(4, blocks.get(0).endLine());
        assertEquals(1, blocks.get(1).startLine());
        assertEquals(5, blocks.get(1).endLine());
    }

    @Test
    void testPythonBlocksEndOnFollowingLine() {
        // no braces: depth is already zero on the line after the def
        String content = """
                def total(items):
                    result = 0
                    for item in items:
                        result += item.price
                    return result
                """;

        List<CodeBlock> blocks = extractor.extractBlocks("cart.py", content);

        assertEquals(1, blocks.size());
        assertEquals(1, blocks.get(0).startLine());
        assertEquals(2, blocks.get(0).endLine());
    }

    @Test
    void testCarriageReturnsStayInCode() {
        String content = "function f() {\r\n  return 1;\r\n}\r\n";

        List<CodeBlock> blocks = extractor.extractBlocks("crlf.js", content);

        assertEquals(1, blocks.size());
        assertEquals(1, blocks.get(0).startLine());
        assertEquals(3, blocks.get(0).endLine());
        assertTrue(blocks.get(0).code().contains("\r"));
    }
}
