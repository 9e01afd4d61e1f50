package com.raditha.similarity.model;

/**
 * Inclusive, 1-based line span inside a source file.
 *
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record LineRange(int startLine, int endLine) {

    public LineRange {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    String.format("endLine %d precedes startLine %d", endLine, startLine));
        }
    }

    /**
     * Get total number of lines in this range.
     */
    public int lineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
