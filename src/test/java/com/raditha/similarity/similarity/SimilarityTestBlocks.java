package com.raditha.similarity.similarity;

import com.raditha.similarity.detection.BlockHasher;
import com.raditha.similarity.detection.BlockTokenizer;
import com.raditha.similarity.model.CodeBlock;

/**
 * Builds fingerprinted blocks for similarity tests.
 */
final class SimilarityTestBlocks {

    private static final BlockHasher hasher = new BlockHasher();
    private static final BlockTokenizer tokenizer = new BlockTokenizer();

    private SimilarityTestBlocks() {
    }

    static CodeBlock block(String file, int startLine, String code) {
        int lines = code.split("\n", -1).length;
        return new CodeBlock(file, startLine, startLine + lines - 1, code,
                hasher.hash(code), tokenizer.tokenize(code));
    }
}
