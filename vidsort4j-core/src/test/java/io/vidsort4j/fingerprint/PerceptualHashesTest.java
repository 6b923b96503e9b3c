package io.vidsort4j.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PerceptualHashesTest {

    @Test
    void hexShouldBeSixteenLowercaseDigits() {
        assertEquals("0000000000000001", PerceptualHashes.toHex(1L));
        assertEquals("ffffffffffffffff", PerceptualHashes.toHex(-1L));
        assertEquals(-1L, PerceptualHashes.fromHex("FFFFFFFFFFFFFFFF"));
    }

    @Test
    void malformedHexShouldFail() {
        assertThrows(IllegalArgumentException.class, () -> PerceptualHashes.fromHex("abc"));
        assertThrows(IllegalArgumentException.class, () -> PerceptualHashes.fromHex("zzzzzzzzzzzzzzzz"));
    }

    @Test
    void hammingDistanceShouldCountDifferingBits() {
        assertEquals(0, PerceptualHashes.hammingDistance("00000000000000ff", "00000000000000ff"));
        assertEquals(8, PerceptualHashes.hammingDistance("00000000000000ff", "0000000000000000"));
        assertEquals(64, PerceptualHashes.hammingDistance(0L, -1L));
    }
}
