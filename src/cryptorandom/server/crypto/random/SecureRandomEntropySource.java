package cryptorandom.server.crypto.random;

import cryptorandom.server.util.*;
import cryptorandom.shared.crypto.random.*;

import java.security.*;
import java.util.*;
import java.util.logging.*;

/** Entropy from a JCA {@link SecureRandom}. */
public class SecureRandomEntropySource implements EntropySource {
    private static final Logger LOG = Logging.LOG();
    // Secure RBG algorithm set name
    private static final String DRBG_ALGO = "DRBG";

    private final SecureRandom prng;

    public SecureRandomEntropySource(SecureRandom prng) {
        this.prng = prng;
        LOG.fine("Entropy source: " + prng.getAlgorithm() + " from " + prng.getProvider().getName());
    }

    public SecureRandomEntropySource() {
        this(new SecureRandom());
    }

    public static SecureRandomEntropySource forAlgorithm(String algorithm) {
        try {
            return new SecureRandomEntropySource(SecureRandom.getInstance(algorithm));
        } catch (NoSuchAlgorithmException e) {
            throw new EntropyException("No SecureRandom algorithm " + algorithm, e);
        }
    }

    /**
     * A NIST SP 800-90A DRBG from the installed providers.
     *
     * @param minSecurityStrength in bits, e.g. 128 or 256
     * @param predictionResistance reseed from the system entropy source on every request
     */
    public static SecureRandomEntropySource drbg(int minSecurityStrength, boolean predictionResistance) {
        SecureRandomParameters params = DrbgParameters.instantiation(
                minSecurityStrength,
                predictionResistance ?
                        DrbgParameters.Capability.PR_AND_RESEED :
                        DrbgParameters.Capability.RESEED_ONLY,
                "cryptorandom".getBytes());
        try {
            return new SecureRandomEntropySource(SecureRandom.getInstance(DRBG_ALGO, params));
        } catch (NoSuchAlgorithmException e) {
            throw new EntropyException("No DRBG supporting strength " + minSecurityStrength
                    + (predictionResistance ? " with prediction resistance" : ""), e);
        }
    }

    public String algorithm() {
        return prng.getAlgorithm();
    }

    @Override
    public void fill(byte[] b, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, b.length);
        if (len == 0)
            return;
        byte[] r = offset == 0 && len == b.length ? b : new byte[len];
        try {
            prng.nextBytes(r);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Entropy source " + prng.getAlgorithm() + " failed", e);
            throw new EntropyException("Entropy source " + prng.getAlgorithm() + " failed", e);
        }
        if (r != b) {
            System.arraycopy(r, 0, b, offset, len);
            Arrays.fill(r, (byte) 0);
        }
    }
}
