package cryptorandom.server.crypto.random;

import cryptorandom.server.util.Logging;
import cryptorandom.shared.crypto.random.EntropyException;
import cryptorandom.shared.crypto.random.EntropySource;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.prng.SP800SecureRandom;
import org.bouncycastle.crypto.prng.SP800SecureRandomBuilder;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.*;
import java.util.logging.*;

/**
 * Entropy from a SHA-512 Hash_DRBG (NIST SP 800-90A), seeded from the platform {@link SecureRandom}.
 *
 * Every instance gets its own personalization string, so two instances never share an output stream
 * even if the seed source were to repeat.
 */
public class BouncyCastleDrbgEntropySource implements EntropySource {
    private static final Logger LOG = Logging.LOG();
    private static final int SECURITY_STRENGTH = 256;
    public static final String ALGORITHM = "SHA512-Hash_DRBG";
    // Hash_DRBG limits a single request to 2^18 bits
    private static final int MAX_REQUEST_BYTES = (1 << 18) / 8;

    private final SP800SecureRandom drbg;

    public BouncyCastleDrbgEntropySource(SecureRandom seedSource, boolean predictionResistance) {
        byte[] personalization = ("cryptorandom:" + UUID.randomUUID()).getBytes(StandardCharsets.UTF_8);
        byte[] nonce = new byte[32];
        seedSource.nextBytes(nonce);
        this.drbg = new SP800SecureRandomBuilder(seedSource, predictionResistance)
                .setPersonalizationString(personalization)
                .setSecurityStrength(SECURITY_STRENGTH)
                .setEntropyBitsRequired(SECURITY_STRENGTH)
                .buildHash(new SHA512Digest(), nonce, predictionResistance);
        LOG.fine("Entropy source: " + ALGORITHM + (predictionResistance ? " with prediction resistance" : ""));
    }

    public BouncyCastleDrbgEntropySource(boolean predictionResistance) {
        this(new SecureRandom(), predictionResistance);
    }

    public String algorithm() {
        return ALGORITHM;
    }

    @Override
    public void fill(byte[] b, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, b.length);
        if (len == 0)
            return;
        if (offset == 0 && len == b.length && len <= MAX_REQUEST_BYTES) {
            generate(b);
            return;
        }
        for (int done = 0; done < len; ) {
            byte[] r = new byte[Math.min(MAX_REQUEST_BYTES, len - done)];
            generate(r);
            System.arraycopy(r, 0, b, offset + done, r.length);
            Arrays.fill(r, (byte) 0);
            done += r.length;
        }
    }

    private void generate(byte[] r) {
        try {
            drbg.nextBytes(r);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Hash DRBG failed", e);
            throw new EntropyException("Hash DRBG failed", e);
        }
    }
}
