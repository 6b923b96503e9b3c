package io.vidsort4j.fingerprint;

import java.util.Locale;

/**
 * Helpers for 64-bit perceptual hashes stored as 16 lowercase hex characters.
 */
public final class PerceptualHashes {

    public static final int BITS = 64;

    private PerceptualHashes() {
    }

    public static String toHex(long hash) {
        return String.format(Locale.ROOT, "%016x", hash);
    }

    public static long fromHex(String hex) {
        if (hex == null || hex.length() != 16) {
            throw new IllegalArgumentException("perceptual hash must be 16 hex characters: " + hex);
        }
        return Long.parseUnsignedLong(hex, 16);
    }

    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    public static int hammingDistance(String a, String b) {
        return hammingDistance(fromHex(a), fromHex(b));
    }
}
