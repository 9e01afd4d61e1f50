package com.raditha.similarity.detection;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits block text into lower-cased identifier and keyword tokens.
 * Punctuation and operators are dropped, as are single-character tokens.
 */
public class BlockTokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public List<String> tokenize(String code) {
        if (code == null || code.isEmpty()) {
            return List.of();
        }
        String words = NON_WORD.matcher(code).replaceAll(" ").toLowerCase(Locale.ROOT);
        return Arrays.stream(WHITESPACE.split(words))
                .filter(token -> token.length() > 1)
                .toList();
    }
}
