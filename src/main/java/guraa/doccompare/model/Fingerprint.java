package guraa.doccompare.model;

import lombok.EqualsAndHashCode;

/**
 * Fixed-width bit vector summarising the visual content of an image.
 * Bit 0 is the most significant bit of the hex form.
 */
@EqualsAndHashCode
public final class Fingerprint {

    private final long[] words;
    private final int bitWidth;

    private Fingerprint(long[] words, int bitWidth) {
        this.words = words;
        this.bitWidth = bitWidth;
    }

    /**
     * Create a fingerprint from a bit array.
     *
     * @param bits The bits, index 0 first
     * @return The fingerprint
     */
    public static Fingerprint fromBits(boolean[] bits) {
        if (bits == null || bits.length == 0) {
            throw new IllegalArgumentException("A fingerprint needs at least one bit");
        }
        long[] words = new long[(bits.length + 63) / 64];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i / 64] |= 1L << (63 - (i % 64));
            }
        }
        return new Fingerprint(words, bits.length);
    }

    /**
     * Create a 64-bit fingerprint from a long value.
     *
     * @param value The value, most significant bit first
     * @return The fingerprint
     */
    public static Fingerprint fromLong(long value) {
        return new Fingerprint(new long[]{value}, 64);
    }

    /**
     * Parse a hex string; every hex digit contributes four bits.
     *
     * @param hex The hex string
     * @return The fingerprint
     */
    public static Fingerprint fromHex(String hex) {
        if (hex == null || hex.isEmpty()) {
            throw new IllegalArgumentException("Hex fingerprint must not be empty");
        }
        boolean[] bits = new boolean[hex.length() * 4];
        for (int i = 0; i < hex.length(); i++) {
            int digit = Character.digit(hex.charAt(i), 16);
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid hex digit '" + hex.charAt(i) + "' in fingerprint " + hex);
            }
            for (int b = 0; b < 4; b++) {
                bits[i * 4 + b] = (digit & (8 >> b)) != 0;
            }
        }
        return fromBits(bits);
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public boolean getBit(int index) {
        if (index < 0 || index >= bitWidth) {
            throw new IndexOutOfBoundsException("Bit " + index + " outside fingerprint of width " + bitWidth);
        }
        return (words[index / 64] & (1L << (63 - (index % 64)))) != 0;
    }

    /**
     * Count the bits that differ between two fingerprints of the same width.
     *
     * @param other The other fingerprint
     * @return The Hamming distance
     */
    public int hammingDistance(Fingerprint other) {
        if (other.bitWidth != bitWidth) {
            throw new IllegalArgumentException("Cannot compare fingerprints of width "
                    + bitWidth + " and " + other.bitWidth);
        }
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    public String toHex() {
        StringBuilder hex = new StringBuilder();
        int digits = (bitWidth + 3) / 4;
        for (int i = 0; i < digits; i++) {
            int digit = 0;
            for (int b = 0; b < 4; b++) {
                int index = i * 4 + b;
                if (index < bitWidth && getBit(index)) {
                    digit |= 8 >> b;
                }
            }
            hex.append(Character.forDigit(digit, 16));
        }
        return hex.toString();
    }

    @Override
    public String toString() {
        return "Fingerprint[" + bitWidth + "]" + toHex();
    }
}
