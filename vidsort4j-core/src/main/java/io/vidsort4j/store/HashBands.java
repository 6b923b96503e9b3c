package io.vidsort4j.store;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a 64-bit hash into {@code threshold + 1} contiguous bit bands.
 *
 * <p>Two hashes within Hamming distance {@code threshold} must agree exactly on at least one band
 * (pigeonhole), so band keys give a complete candidate set for a near-duplicate lookup.
 */
public final class HashBands {

    private final int[] offsets;
    private final int[] widths;

    public HashBands(int threshold) {
        int bands = threshold + 1;
        if (bands < 1 || bands > 64) {
            throw new IllegalArgumentException("threshold must be within [0, 63]");
        }
        this.offsets = new int[bands];
        this.widths = new int[bands];
        int base = 64 / bands;
        int extra = 64 % bands;
        int offset = 0;
        for (int i = 0; i < bands; i++) {
            int width = base + (i < extra ? 1 : 0);
            offsets[i] = offset;
            widths[i] = width;
            offset += width;
        }
    }

    public int count() {
        return offsets.length;
    }

    /**
     * Band keys of the form {@code "<index>:<hex value>"}.
     */
    public List<String> keys(long hash) {
        List<String> keys = new ArrayList<>(offsets.length);
        for (int i = 0; i < offsets.length; i++) {
            keys.add(i + ":" + Long.toHexString(band(hash, i)));
        }
        return keys;
    }

    long band(long hash, int index) {
        int width = widths[index];
        long mask = width == 64 ? -1L : (1L << width) - 1;
        return (hash >>> offsets[index]) & mask;
    }
}
