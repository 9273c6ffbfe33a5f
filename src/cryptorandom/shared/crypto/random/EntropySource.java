package cryptorandom.shared.crypto.random;

import jsinterop.annotations.JsType;

/**
 * Fills buffers with cryptographically secure random bytes.
 *
 * Implementations must be safe to call concurrently and must never return predictable or partially
 * filled output; failure is reported by throwing {@link EntropyException}.
 */
@JsType
public interface EntropySource {

    void fill(byte[] b, int offset, int len);

    default void fillAll(byte[] b) {
        fill(b, 0, b.length);
    }

    default byte[] randomBytes(int len) {
        byte[] res = new byte[len];
        fill(res, 0, len);
        return res;
    }
}
