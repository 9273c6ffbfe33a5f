package cryptorandom.shared.crypto.random;

import jsinterop.annotations.JsConstructor;

/** The underlying entropy source could not produce random bytes. */
public class EntropyException extends RuntimeException {

    @JsConstructor
    public EntropyException(String msg) {
        super(msg);
    }

    public EntropyException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
