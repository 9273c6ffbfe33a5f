package cryptorandom.server.tests;

import cryptorandom.server.crypto.random.*;
import cryptorandom.shared.crypto.random.*;
import org.junit.*;

import java.security.*;
import java.util.*;

public class EntropySourceTests {

    private static boolean allZero(byte[] b, int from, int to) {
        for (int i = from; i < to; i++)
            if (b[i] != 0)
                return false;
        return true;
    }

    private static void checkSlices(EntropySource source) {
        byte[] b = new byte[64];
        source.fill(b, 16, 32);
        Assert.assertTrue("prefix untouched", allZero(b, 0, 16));
        Assert.assertTrue("suffix untouched", allZero(b, 48, 64));
        Assert.assertFalse("slice filled", allZero(b, 16, 48));

        byte[] whole = source.randomBytes(64);
        Assert.assertFalse(allZero(whole, 0, 64));
        Assert.assertFalse(Arrays.equals(whole, source.randomBytes(64)));

        source.fillAll(new byte[0]);
        source.fill(b, 64, 0);

        Assert.assertThrows(IndexOutOfBoundsException.class, () -> source.fill(new byte[10], 5, 100));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> source.fill(new byte[10], 0, -5));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> source.fill(new byte[10], -1, 2));
    }

    @Test
    public void platformDefault() {
        checkSlices(new SecureRandomEntropySource());
    }

    @Test
    public void namedAlgorithm() {
        SecureRandomEntropySource sha1 = SecureRandomEntropySource.forAlgorithm("SHA1PRNG");
        Assert.assertEquals("SHA1PRNG", sha1.algorithm());
        checkSlices(sha1);
    }

    @Test
    public void unknownAlgorithm() {
        Assert.assertThrows(EntropyException.class, () -> SecureRandomEntropySource.forAlgorithm("NoSuchPRNG"));
    }

    @Test
    public void jdkDrbg() {
        SecureRandomEntropySource drbg = SecureRandomEntropySource.drbg(256, false);
        Assert.assertEquals("DRBG", drbg.algorithm());
        checkSlices(drbg);
        checkSlices(SecureRandomEntropySource.drbg(128, true));
    }

    @Test
    public void bouncyCastleDrbg() {
        BouncyCastleDrbgEntropySource drbg = new BouncyCastleDrbgEntropySource(false);
        checkSlices(drbg);
        checkSlices(new BouncyCastleDrbgEntropySource(true));

        // independent instances never share output
        byte[] a = drbg.randomBytes(32);
        byte[] b = new BouncyCastleDrbgEntropySource(false).randomBytes(32);
        Assert.assertFalse(Arrays.equals(a, b));
    }

    @Test
    public void largeRequests() {
        EntropySource source = new BouncyCastleDrbgEntropySource(false);
        byte[] big = new byte[1 << 20];
        CryptoRandom.cached(source).nextBytes(big);
        Assert.assertFalse(allZero(big, 0, 1024));
        Assert.assertFalse(allZero(big, big.length - 1024, big.length));
    }

    @Test
    public void badSlicesDrawNothing() {
        int[] drawn = new int[1];
        SecureRandom counting = new SecureRandom() {
            @Override
            public void nextBytes(byte[] bytes) {
                drawn[0] += bytes.length;
                super.nextBytes(bytes);
            }
        };
        SecureRandomEntropySource source = new SecureRandomEntropySource(counting);
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> source.fill(new byte[10], 5, 100));
        Assert.assertThrows(IndexOutOfBoundsException.class, () -> source.fill(new byte[10], 0, -5));
        Assert.assertEquals(0, drawn[0]);

        source.fill(new byte[10], 5, 5);
        Assert.assertEquals(5, drawn[0]);
    }

    @Test
    public void failuresPropagate() {
        SecureRandom broken = new SecureRandom() {
            @Override
            public void nextBytes(byte[] bytes) {
                throw new ProviderException("entropy pool unavailable");
            }
        };
        SecureRandomEntropySource source = new SecureRandomEntropySource(broken);
        EntropyException e = Assert.assertThrows(EntropyException.class, () -> source.fillAll(new byte[8]));
        Assert.assertTrue(e.getCause() instanceof ProviderException);

        CryptoRandom random = CryptoRandom.cached(source);
        Assert.assertThrows(EntropyException.class, random::nextDouble);
        Assert.assertThrows(EntropyException.class, () -> random.nextInt(0, 10));
        Assert.assertThrows(EntropyException.class, () -> random.nextBytes(new byte[5000]));
    }
}
