package cryptorandom.server.crypto.random;

import cryptorandom.server.util.*;
import cryptorandom.shared.crypto.random.*;

import java.util.logging.*;

/**
 * Builds {@link CryptoRandom} instances from configuration.
 *
 * Parameters:
 * <ul>
 *     <li>entropy-source: default | jca | drbg | bc-drbg</li>
 *     <li>jca-algorithm: required for jca, e.g. NativePRNGNonBlocking</li>
 *     <li>drbg-strength: security strength in bits for drbg (default 256)</li>
 *     <li>prediction-resistance: for drbg and bc-drbg (default false)</li>
 *     <li>byte-cache: serve small requests from per-processor caches (default true)</li>
 *     <li>byte-cache-size, request-cache-limit, byte-cache-slots</li>
 * </ul>
 */
public class CryptoRandoms {
    private static final Logger LOG = Logging.LOG();

    public static EntropySource buildEntropySource(Args a) {
        String type = a.getArg("entropy-source", "default");
        boolean predictionResistance = a.getBoolean("prediction-resistance", false);
        switch (type) {
            case "default":
                return new SecureRandomEntropySource();
            case "jca":
                return SecureRandomEntropySource.forAlgorithm(a.getArg("jca-algorithm"));
            case "drbg":
                return SecureRandomEntropySource.drbg(a.getInt("drbg-strength", 256), predictionResistance);
            case "bc-drbg":
                return new BouncyCastleDrbgEntropySource(predictionResistance);
            default:
                throw new IllegalStateException("Unknown entropy-source: " + type);
        }
    }

    public static PerProcessorByteCache buildCache(EntropySource source, Args a) {
        int cacheSize = a.getInt("byte-cache-size", PerProcessorByteCache.DEFAULT_CACHE_SIZE);
        if (cacheSize < 2)
            throw new IllegalStateException("byte-cache-size must be at least 2: " + cacheSize);
        int limit = a.getInt("request-cache-limit", Math.max(1, cacheSize / 4));
        if (limit <= 0 || limit >= cacheSize)
            throw new IllegalStateException("request-cache-limit must be in (0, " + cacheSize + "): " + limit);
        int slots = a.getInt("byte-cache-slots", Runtime.getRuntime().availableProcessors());
        if (slots <= 0)
            throw new IllegalStateException("byte-cache-slots must be positive: " + slots);
        return new PerProcessorByteCache(source, cacheSize, limit, slots, ProcessorHint.THREAD_ID);
    }

    public static CryptoRandom build(Args a) {
        EntropySource source = buildEntropySource(a);
        if (! a.getBoolean("byte-cache", true)) {
            LOG.info("Byte cache disabled, every request goes to the entropy source");
            return CryptoRandom.uncached(source);
        }
        return new CryptoRandom(buildCache(source, a));
    }

    private static class Shared {
        static final CryptoRandom INSTANCE = CryptoRandom.cached(new SecureRandomEntropySource());
    }

    /** A process wide, cached instance backed by the platform default {@link java.security.SecureRandom}. */
    public static CryptoRandom shared() {
        return Shared.INSTANCE;
    }
}
