package com.raditha.similarity.extraction;

import com.raditha.similarity.detection.BlockHasher;
import com.raditha.similarity.detection.BlockTokenizer;
import com.raditha.similarity.model.CodeBlock;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Scans file text line by line and cuts out function and class blocks.
 * <p>
 * A line starts a block when its trimmed text matches one of the
 * language's start patterns. The end is found with {@link BlockEndScanner}.
 * This is a heuristic: it does not parse, and languages without patterns
 * produce no blocks.
 */
public class BlockExtractor {

    private final BlockEndScanner endScanner;
    private final BlockHasher hasher;
    private final BlockTokenizer tokenizer;

    public BlockExtractor() {
        this(new BlockEndScanner(), new BlockHasher(), new BlockTokenizer());
    }

    public BlockExtractor(BlockEndScanner endScanner, BlockHasher hasher, BlockTokenizer tokenizer) {
        this.endScanner = endScanner;
        this.hasher = hasher;
        this.tokenizer = tokenizer;
    }

    /**
     * A block located in a file before it is attached to a path and
     * fingerprinted.
     *
     * @param startLine Starting line number (1-indexed)
     * @param endLine   Ending line number (1-indexed, inclusive)
     * @param code      Block text, lines joined with '\n'
     */
    public record BlockRegion(int startLine, int endLine, String code) {
    }

    /**
     * Extract all blocks from a file and attach path, hash and tokens.
     * The language is detected from the file extension.
     */
    public List<CodeBlock> extractBlocks(String filePath, String content) {
        Language language = Language.fromPath(filePath);
        return extractBlocks(content, language).stream()
                .map(region -> toCodeBlock(filePath, region))
                .toList();
    }

    /**
     * Locate function blocks first, then class blocks.
     *
     * @param content  File text
     * @param language Language whose start patterns are used
     * @return Regions in discovery order; empty for unknown languages
     */
    public List<BlockRegion> extractBlocks(String content, Language language) {
        if (content == null || content.isEmpty() || language.isPlainText()) {
            return List.of();
        }

        List<String> lines = Arrays.asList(content.split("\n", -1));
        List<BlockRegion> regions = new ArrayList<>();
        regions.addAll(scan(lines, language::isFunctionStart));
        regions.addAll(scan(lines, language::isClassStart));
        return regions;
    }

    /**
     * Fingerprint a region found in {@code filePath}.
     */
    public CodeBlock toCodeBlock(String filePath, BlockRegion region) {
        return new CodeBlock(
                filePath,
                region.startLine(),
                region.endLine(),
                region.code(),
                hasher.hash(region.code()),
                tokenizer.tokenize(region.code()));
    }

    private List<BlockRegion> scan(List<String> lines, Predicate<String> isStart) {
        List<BlockRegion> regions = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            if (!isStart.test(lines.get(i).trim())) {
                continue;
            }
            int end = endScanner.findBlockEnd(lines, i);
            if (end > i) {
                regions.add(new BlockRegion(
                        i + 1,
                        end + 1,
                        String.join("\n", lines.subList(i, end + 1))));
            }
        }

        return regions;
    }
}
