package io.github.hunghhdev.agedcache.core;

/**
 * Immutable snapshot of the counters kept by an {@link AgedCache}.
 *
 * <p>Removals are split by cause: an <em>expiration</em> is an entry
 * unlinked because its retention elapsed, an <em>eviction</em> is a live
 * entry removed through {@link AgedCacheClient#evict}. Key replacement and
 * {@link AgedCacheClient#clear()} are counted as neither.</p>
 */
public final class CacheStatistics {
    private final long hitCount;
    private final long missCount;
    private final long putCount;
    private final long expirationCount;
    private final long evictionCount;

    public CacheStatistics(long hitCount, long missCount, long putCount,
                           long expirationCount, long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.putCount = putCount;
        this.expirationCount = expirationCount;
        this.evictionCount = evictionCount;
    }

    public long getHitCount() {
        return hitCount;
    }

    /**
     * Returns the number of lookups that found nothing, whether the key was
     * never stored or its entry had expired.
     */
    public long getMissCount() {
        return missCount;
    }

    public long getPutCount() {
        return putCount;
    }

    public long getExpirationCount() {
        return expirationCount;
    }

    public long getEvictionCount() {
        return evictionCount;
    }

    /**
     * Returns expirations plus evictions.
     */
    public long getRemovalCount() {
        return expirationCount + evictionCount;
    }

    public long getRequestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns the hit rate as a value between 0.0 and 1.0, or 0.0 if there
     * were no lookups.
     */
    public double getHitRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public double getMissRate() {
        long total = getRequestCount();
        return total == 0 ? 0.0 : (double) missCount / total;
    }

    @Override
    public String toString() {
        return "CacheStatistics{hits=" + hitCount
            + ", misses=" + missCount
            + ", puts=" + putCount
            + ", expirations=" + expirationCount
            + ", evictions=" + evictionCount + "}";
    }
}
