package cryptorandom.shared.crypto.random;

/**
 * Chooses which cache slot the calling thread should use.
 *
 * The result is only an affinity hint: any value is reduced into {@code [0, slots)} by the caller,
 * and threads sharing a slot simply serialize on that slot's lock.
 */
@FunctionalInterface
public interface ProcessorHint {

    int currentSlot(int slots);

    /** The JVM has no current-cpu query, so spread threads by id. Stable for the life of a thread. */
    ProcessorHint THREAD_ID = slots -> {
        if (slots <= 1)
            return 0;
        long id = Thread.currentThread().getId();
        int h = (int) (id ^ (id >>> 32)) * 0x9E3779B9;
        return (h >>> 1) % slots;
    };

    static ProcessorHint fixed(int slot) {
        return slots -> slot;
    }
}
