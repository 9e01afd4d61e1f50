package com.raditha.similarity.extraction;

import java.util.List;

/**
 * Finds the line on which a block that starts on a given line ends, by
 * balancing curly braces.
 * <p>
 * Braces inside single or double quoted literals are ignored. A quote closes
 * the literal only when it matches the opening quote and is not directly
 * preceded by a backslash. The literal state carries across line breaks.
 * Raw strings, template strings and comments are not understood.
 */
public class BlockEndScanner {

    /**
     * Find the end of the block starting at {@code startIndex}.
     *
     * @param lines      File content split into lines
     * @param startIndex 0-based index of the block's first line
     * @return 0-based index of the first line after {@code startIndex} on which
     *         the brace depth is zero, or the last line of the file if the
     *         depth never returns to zero
     */
    public int findBlockEnd(List<String> lines, int startIndex) {
        int depth = 0;
        boolean inString = false;
        char quote = 0;

        for (int i = startIndex; i < lines.size(); i++) {
            String line = lines.get(i);

            for (int j = 0; j < line.length(); j++) {
                char c = line.charAt(j);

                if (!inString && (c == '"' || c == '\'')) {
                    inString = true;
                    quote = c;
                } else if (inString && c == quote && !escaped(line, j)) {
                    inString = false;
                    quote = 0;
                } else if (!inString) {
                    if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                    }
                }
            }

            if (depth == 0 && i > startIndex) {
                return i;
            }
        }

        return lines.size() - 1;
    }

    private static boolean escaped(String line, int index) {
        return index > 0 && line.charAt(index - 1) == '\\';
    }
}
