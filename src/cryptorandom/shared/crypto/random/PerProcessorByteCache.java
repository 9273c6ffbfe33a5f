package cryptorandom.shared.crypto.random;

import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.logging.*;

/**
 * An {@link EntropySource} that amortizes calls to another source through one byte cache per
 * logical processor slot.
 *
 * Small requests are served out of the calling thread's slot under that slot's lock. Requests
 * larger than {@link #requestCacheLimit()} go straight to the underlying source and never touch a
 * cache. Bytes are zeroed in the cache as soon as they have been copied out, so no byte is ever
 * served twice or left behind in the backing buffer.
 */
public class PerProcessorByteCache implements EntropySource {
    private static final Logger LOG = Logger.getGlobal();

    public static final int DEFAULT_CACHE_SIZE = 4096;

    private final EntropySource source;
    private final int cacheSize, requestCacheLimit;
    private final ProcessorHint hint;
    private final AtomicReferenceArray<ByteCache> caches;

    public PerProcessorByteCache(EntropySource source,
                                 int cacheSize,
                                 int requestCacheLimit,
                                 int slots,
                                 ProcessorHint hint) {
        if (cacheSize <= 0)
            throw new IllegalArgumentException("Cache size must be positive: " + cacheSize);
        if (requestCacheLimit <= 0 || requestCacheLimit >= cacheSize)
            throw new IllegalArgumentException("Request cache limit must be in (0, " + cacheSize + "): " + requestCacheLimit);
        if (slots <= 0)
            throw new IllegalArgumentException("Slot count must be positive: " + slots);
        this.source = Objects.requireNonNull(source);
        this.cacheSize = cacheSize;
        this.requestCacheLimit = requestCacheLimit;
        this.hint = Objects.requireNonNull(hint);
        this.caches = new AtomicReferenceArray<>(slots);
        LOG.fine("Byte cache: " + slots + " slots of " + cacheSize + " bytes, bypass above " + requestCacheLimit);
    }

    public PerProcessorByteCache(EntropySource source, int cacheSize) {
        this(source, cacheSize, cacheSize / 4, Runtime.getRuntime().availableProcessors(), ProcessorHint.THREAD_ID);
    }

    public PerProcessorByteCache(EntropySource source) {
        this(source, DEFAULT_CACHE_SIZE);
    }

    private static final class ByteCache {
        final byte[] bytes;
        int position;

        ByteCache(int size) {
            this.bytes = new byte[size];
            this.position = size;
        }
    }

    @Override
    public void fill(byte[] b, int offset, int len) {
        Objects.checkFromIndexSize(offset, len, b.length);
        if (len == 0)
            return;
        if (len > requestCacheLimit) {
            source.fill(b, offset, len);
            return;
        }

        ByteCache cache = slot(hint.currentSlot(caches.length()));
        synchronized (cache) {
            byte[] bytes = cache.bytes;
            int position = cache.position;
            if (position + len > cacheSize) {
                source.fill(bytes, 0, cacheSize);
                position = 0;
            }
            // advance before copying so a failure below can never lead to these bytes being served again
            cache.position = position + len;
            System.arraycopy(bytes, position, b, offset, len);
            Arrays.fill(bytes, position, position + len, (byte) 0);
        }
    }

    private ByteCache slot(int hinted) {
        int slots = caches.length();
        int index = slots == 1 ? 0 : Math.floorMod(hinted, slots);
        ByteCache cache = caches.get(index);
        if (cache != null)
            return cache;
        caches.compareAndSet(index, null, new ByteCache(cacheSize));
        return caches.get(index);
    }

    public int slots() {
        return caches.length();
    }

    public int cacheSize() {
        return cacheSize;
    }

    public int requestCacheLimit() {
        return requestCacheLimit;
    }

    /**
     * @return the read position of a slot's cache, or empty if that slot has never been used
     */
    public OptionalInt position(int slot) {
        ByteCache cache = caches.get(slot);
        if (cache == null)
            return OptionalInt.empty();
        synchronized (cache) {
            return OptionalInt.of(cache.position);
        }
    }

    /** A copy of a slot's backing buffer. Bytes before the read position have already been served and zeroed. */
    byte[] snapshot(int slot) {
        ByteCache cache = caches.get(slot);
        if (cache == null)
            return new byte[0];
        synchronized (cache) {
            return Arrays.copyOf(cache.bytes, cache.bytes.length);
        }
    }
}
