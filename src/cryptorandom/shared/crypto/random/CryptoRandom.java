package cryptorandom.shared.crypto.random;

import java.util.*;

/**
 * A {@link Random} whose every output is drawn from an {@link EntropySource}.
 *
 * There is no seed and no reproducibility: {@link #setSeed(long)} is ignored. Integer ranges use
 * masked rejection sampling, so results are unbiased for any bounds. Usually constructed over a
 * {@link PerProcessorByteCache}; an uncached source gives the same distribution at a higher cost
 * per call.
 */
public class CryptoRandom extends Random {

    private final EntropySource entropy;

    public CryptoRandom(EntropySource entropy) {
        this.entropy = Objects.requireNonNull(entropy);
    }

    public static CryptoRandom cached(EntropySource source) {
        return new CryptoRandom(new PerProcessorByteCache(source));
    }

    public static CryptoRandom uncached(EntropySource source) {
        return new CryptoRandom(source);
    }

    public EntropySource source() {
        return entropy;
    }

    /** Seeding is not supported, the entropy source is never reseeded from here. */
    @Override
    public void setSeed(long seed) {}

    @Override
    protected int next(int bits) {
        return nextInt() >>> (32 - bits);
    }

    /**
     * @return a uniform int in [0, {@link Integer#MAX_VALUE})
     */
    public int nextNonNegativeInt() {
        byte[] four = new byte[4];
        int result;
        do {
            entropy.fill(four, 0, 4);
            result = RandomBits.intLE(four, 0) & 0x7FFF_FFFF;
        } while (result == Integer.MAX_VALUE);
        return result;
    }

    /**
     * @param maxValue exclusive upper bound, must be non-negative
     * @return a uniform int in [0, maxValue), or 0 if maxValue is 0
     */
    @Override
    public int nextInt(int maxValue) {
        if (maxValue < 0)
            throw new IllegalArgumentException("maxValue must be non-negative: " + maxValue);
        return nextInt(0, maxValue);
    }

    /**
     * @param minValue inclusive lower bound
     * @param maxValue exclusive upper bound, must be at least minValue
     * @return a uniform int in [minValue, maxValue), or minValue if the bounds are equal
     */
    @Override
    public int nextInt(int minValue, int maxValue) {
        if (minValue == maxValue)
            return minValue;
        if (minValue > maxValue)
            throw new IllegalArgumentException("minValue " + minValue + " is greater than maxValue " + maxValue);

        // unsigned, zero is a possible result
        int range = maxValue - minValue - 1;
        if (range == 0)
            return minValue;
        int mask = RandomBits.mask32(range);

        byte[] four = new byte[4];
        int result;
        do {
            entropy.fill(four, 0, 4);
            result = RandomBits.intLE(four, 0) & mask;
        } while (Integer.compareUnsigned(result, range) > 0);
        return minValue + result;
    }

    @Override
    public int nextInt() {
        byte[] four = new byte[4];
        entropy.fill(four, 0, 4);
        return RandomBits.intLE(four, 0);
    }

    @Override
    public long nextLong() {
        byte[] eight = new byte[8];
        entropy.fill(eight, 0, 8);
        return RandomBits.longLE(eight, 0);
    }

    @Override
    public long nextLong(long maxValue) {
        if (maxValue < 0)
            throw new IllegalArgumentException("maxValue must be non-negative: " + maxValue);
        return nextLong(0, maxValue);
    }

    @Override
    public long nextLong(long minValue, long maxValue) {
        if (minValue == maxValue)
            return minValue;
        if (minValue > maxValue)
            throw new IllegalArgumentException("minValue " + minValue + " is greater than maxValue " + maxValue);

        long range = maxValue - minValue - 1;
        if (range == 0)
            return minValue;
        long mask = RandomBits.mask64(range);

        byte[] eight = new byte[8];
        long result;
        do {
            entropy.fill(eight, 0, 8);
            result = RandomBits.longLE(eight, 0) & mask;
        } while (Long.compareUnsigned(result, range) > 0);
        return minValue + result;
    }

    /**
     * @throws NullPointerException if bytes is null
     */
    @Override
    public void nextBytes(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        entropy.fill(bytes, 0, bytes.length);
    }

    public void nextBytes(byte[] bytes, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, bytes.length);
        entropy.fill(bytes, offset, len);
    }

    /**
     * @return a uniform double in [0.0, 1.0) with 53 random bits
     */
    @Override
    public double nextDouble() {
        return RandomBits.toDouble(nextLong());
    }

    /**
     * @return a uniform float in [0.0, 1.0) with 24 random bits
     */
    public float nextSingle() {
        return RandomBits.toSingle(nextInt());
    }

    @Override
    public float nextFloat() {
        return nextSingle();
    }
}
