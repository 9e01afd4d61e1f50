package com.raditha.similarity.detection;

/**
 * Computes the structural fingerprint of a block of code.
 * <p>
 * A 32-bit polynomial rolling hash over the characters of the text:
 * {@code h = (h << 5) - h + c}, wrapping on overflow. Identical text always
 * hashes identically; distinct text collides only rarely.
 */
public class BlockHasher {

    public int hash(String code) {
        int hash = 0;
        if (code == null) {
            return hash;
        }
        for (int i = 0; i < code.length(); i++) {
            hash = (hash << 5) - hash + code.charAt(i);
        }
        return hash;
    }
}
