package cryptorandom.server.tests;

import cryptorandom.server.crypto.random.*;
import cryptorandom.shared.crypto.random.*;
import org.junit.*;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.*;

@RunWith(Parameterized.class)
public class UniformityTests {

    private static final int SAMPLES = 200_000;
    // upper tail probability of about 1e-5
    private static final double Z = 4.265;

    private final int buckets;
    private final boolean cached;

    public UniformityTests(int buckets, boolean cached) {
        this.buckets = buckets;
        this.cached = cached;
    }

    @Parameterized.Parameters(name = "k={0} cached={1}")
    public static Collection<Object[]> parameters() {
        List<Object[]> res = new ArrayList<>();
        for (int k : new int[]{2, 3, 7, 16, 17, 100})
            for (boolean cached : new boolean[]{true, false})
                res.add(new Object[]{k, cached});
        return res;
    }

    private CryptoRandom random() {
        EntropySource source = new SecureRandomEntropySource();
        return cached ? CryptoRandom.cached(source) : CryptoRandom.uncached(source);
    }

    /** Wilson-Hilferty approximation of the chi-squared quantile. */
    private static double critical(int degreesOfFreedom) {
        double a = 2.0 / (9 * degreesOfFreedom);
        return degreesOfFreedom * Math.pow(1 - a + Z * Math.sqrt(a), 3);
    }

    private static double chiSquared(long[] counts, int samples) {
        double expected = (double) samples / counts.length;
        double sum = 0;
        for (long c : counts)
            sum += (c - expected) * (c - expected) / expected;
        return sum;
    }

    @Test
    public void integers() {
        CryptoRandom r = random();
        long[] counts = new long[buckets];
        for (int i = 0; i < SAMPLES; i++)
            counts[r.nextInt(0, buckets)]++;
        double x2 = chiSquared(counts, SAMPLES);
        Assert.assertTrue("chi^2 " + x2 + " for k=" + buckets, x2 < critical(buckets - 1));
    }

    @Test
    public void offsetIntegers() {
        CryptoRandom r = random();
        long[] counts = new long[buckets];
        int min = -1_000_003;
        for (int i = 0; i < SAMPLES; i++)
            counts[r.nextInt(min, min + buckets) - min]++;
        double x2 = chiSquared(counts, SAMPLES);
        Assert.assertTrue("chi^2 " + x2 + " for k=" + buckets, x2 < critical(buckets - 1));
    }

    @Test
    public void doubles() {
        CryptoRandom r = random();
        long[] counts = new long[buckets];
        for (int i = 0; i < SAMPLES; i++)
            counts[(int) (r.nextDouble() * buckets)]++;
        double x2 = chiSquared(counts, SAMPLES);
        Assert.assertTrue("chi^2 " + x2 + " for k=" + buckets, x2 < critical(buckets - 1));
    }

    @Test
    public void singles() {
        CryptoRandom r = random();
        long[] counts = new long[buckets];
        for (int i = 0; i < SAMPLES; i++)
            counts[(int) ((double) r.nextSingle() * buckets)]++;
        double x2 = chiSquared(counts, SAMPLES);
        Assert.assertTrue("chi^2 " + x2 + " for k=" + buckets, x2 < critical(buckets - 1));
    }
}
