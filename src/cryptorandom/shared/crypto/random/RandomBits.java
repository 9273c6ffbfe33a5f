package cryptorandom.shared.crypto.random;

/**
 * Conversions from raw random bytes to numbers.
 *
 * Multi-byte values are always decoded little-endian: {@code b[offset]} is the least significant byte.
 */
public class RandomBits {

    /** 2^-53 */
    public static final double DOUBLE_UNIT = 0x1.0p-53;
    /** 2^-24 */
    public static final float FLOAT_UNIT = 0x1.0p-24f;

    public static int intLE(byte[] b, int offset) {
        return (b[offset] & 0xFF)
                | (b[offset + 1] & 0xFF) << 8
                | (b[offset + 2] & 0xFF) << 16
                | (b[offset + 3] & 0xFF) << 24;
    }

    public static long longLE(byte[] b, int offset) {
        return (intLE(b, offset) & 0xFFFFFFFFL) | ((long) intLE(b, offset + 4)) << 32;
    }

    /** Smallest all-ones mask covering every set bit of {@code range}, treating it as unsigned. */
    public static int mask32(int range) {
        int mask = range;
        mask |= mask >>> 1;
        mask |= mask >>> 2;
        mask |= mask >>> 4;
        mask |= mask >>> 8;
        mask |= mask >>> 16;
        return mask;
    }

    public static long mask64(long range) {
        long mask = range;
        mask |= mask >>> 1;
        mask |= mask >>> 2;
        mask |= mask >>> 4;
        mask |= mask >>> 8;
        mask |= mask >>> 16;
        mask |= mask >>> 32;
        return mask;
    }

    /** The top 53 bits of {@code bits} as a double in [0, 1). */
    public static double toDouble(long bits) {
        return (bits >>> 11) * DOUBLE_UNIT;
    }

    /** The top 24 bits of {@code bits} as a float in [0, 1). */
    public static float toSingle(int bits) {
        return (bits >>> 8) * FLOAT_UNIT;
    }
}
