package com.raditha.similarity.model;

import java.util.List;

/**
 * A contiguous line range within one file believed to be a function, class or
 * other logical unit.
 *
 * @param filePath  Owning file
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 * @param code      Raw text of the block
 * @param hash      Structural fingerprint of {@code code}
 * @param tokens    Lower-cased identifier and keyword tokens
 */
public record CodeBlock(
        String filePath,
        int startLine,
        int endLine,
        String code,
        int hash,
        List<String> tokens) {

    public CodeBlock {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public LineRange range() {
        return new LineRange(startLine, endLine);
    }

    /**
     * Identity of the block inside a project: file plus start line.
     */
    public String location() {
        return filePath + "-" + startLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
