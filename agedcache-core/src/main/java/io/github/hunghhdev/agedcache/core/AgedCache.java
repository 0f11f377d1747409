package io.github.hunghhdev.agedcache.core;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AgedCache: implementation of AgedCacheClient that keeps its entries in a
 * singly linked list, newest entry first.
 *
 * <p>No map, list or set from {@code java.util} holds the entries. Lookups,
 * key replacement and expiration sweeps are linear scans of the chain.</p>
 *
 * <p><strong>Thread Safety:</strong> this class is not thread-safe. Callers
 * sharing one instance between threads must guard every call with a single
 * external lock.</p>
 *
 * <p>An entry is expired once {@code expiresAt < now}; an entry whose
 * expiration equals the current time is still live. Expired entries stay
 * linked until the next sweep, which runs at the start of every query.
 * {@code put} does not sweep, so a cache that is written often and queried
 * rarely keeps its expired entries in memory until the next query or
 * {@link #cleanupExpired()}.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class AgedCache<K, V> implements AgedCacheClient<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(AgedCache.class);

    private final TimeSource timeSource;
    private final CacheEventDispatcher<K, V> eventDispatcher;
    private CacheEntry<K, V> head;

    private long hitCount;
    private long missCount;
    private long putCount;
    private long expirationCount;
    private long evictionCount;

    /**
     * Creates a cache that reads the system clock.
     */
    public AgedCache() {
        this(TimeSource.system());
    }

    /**
     * Creates a cache that reads the given JDK clock.
     *
     * @param clock clock used for all expiration decisions
     */
    public AgedCache(Clock clock) {
        this(TimeSource.of(clock));
    }

    /**
     * Creates a cache with the given time source.
     *
     * @param timeSource time source used for all expiration decisions
     */
    public AgedCache(TimeSource timeSource) {
        this(timeSource, new CacheEventDispatcher<>(null));
    }

    private AgedCache(TimeSource timeSource, CacheEventDispatcher<K, V> eventDispatcher) {
        this.timeSource = Objects.requireNonNull(timeSource, "TimeSource must not be null");
        this.eventDispatcher = eventDispatcher;
        this.head = null;
    }

    @Override
    public void put(K key, V value, int retentionMillis) {
        store(key, value, retentionMillis);
    }

    @Override
    public void put(K key, V value, Duration retention) {
        Objects.requireNonNull(retention, "Retention must not be null");
        long retentionMillis;
        try {
            retentionMillis = retention.toMillis();
        } catch (ArithmeticException e) {
            retentionMillis = retention.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        store(key, value, retentionMillis);
    }

    private void store(K key, V value, long retentionMillis) {
        long expiresAt = computeExpiresAt(currentTime("put"), retentionMillis);
        // Key uniqueness: drop the previous entry before linking the new one
        remove(key);
        CacheEntry<K, V> newEntry = new CacheEntry<>(key, value, expiresAt);
        newEntry.next = head;
        head = newEntry;
        putCount++;
        logger.trace("Stored key '{}' expiring at {}", key, expiresAt);
        eventDispatcher.fireOnPut(key, value);
    }

    @Override
    public V get(K key) {
        sweepExpired(currentTime("get"));
        CacheEntry<K, V> entry = findEntry(key);
        if (entry == null) {
            missCount++;
            logger.trace("Cache miss for key '{}'", key);
            return null;
        }
        hitCount++;
        return entry.value;
    }

    @Override
    public Optional<V> find(K key) {
        return Optional.ofNullable(get(key));
    }

    @Override
    public boolean containsKey(K key) {
        sweepExpired(currentTime("containsKey"));
        return findEntry(key) != null;
    }

    @Override
    public Optional<Duration> getRemainingRetention(K key) {
        long currentTime = currentTime("getRemainingRetention");
        sweepExpired(currentTime);
        CacheEntry<K, V> entry = findEntry(key);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(remainingMillis(entry.expiresAt, currentTime)));
    }

    @Override
    public boolean evict(K key) {
        long currentTime = currentTime("evict");
        CacheEntry<K, V> removed = remove(key);
        if (removed == null) {
            return false;
        }
        if (removed.expiresAt < currentTime) {
            // Already expired, the caller could not have seen it
            expirationCount++;
            eventDispatcher.fireOnExpire(key);
            return false;
        }
        evictionCount++;
        logger.debug("Evicted key '{}'", key);
        eventDispatcher.fireOnEvict(key);
        return true;
    }

    @Override
    public void clear() {
        head = null;
        logger.debug("Cache cleared");
        eventDispatcher.fireOnClear();
    }

    @Override
    public boolean isEmpty() {
        sweepExpired(currentTime("isEmpty"));
        return head == null;
    }

    @Override
    public int size() {
        sweepExpired(currentTime("size"));
        int count = 0;
        CacheEntry<K, V> current = head;
        while (current != null) {
            count++;
            current = current.next;
        }
        return count;
    }

    @Override
    public int cleanupExpired() {
        int removed = sweepExpired(currentTime("cleanupExpired"));
        if (removed == 0) {
            logger.debug("No expired cache entries found during cleanup");
        }
        return removed;
    }

    @Override
    public CacheStatistics getStatistics() {
        return new CacheStatistics(hitCount, missCount, putCount, expirationCount, evictionCount);
    }

    @Override
    public void resetStatistics() {
        hitCount = 0;
        missCount = 0;
        putCount = 0;
        expirationCount = 0;
        evictionCount = 0;
    }

    /**
     * Unlinks every entry with {@code expiresAt < currentTime}. The whole
     * chain is walked because entries are ordered by insertion, not by expiration.
     *
     * @return number of entries unlinked
     */
    private int sweepExpired(long currentTime) {
        List<K> expiredKeys = null;
        CacheEntry<K, V> current = head;
        CacheEntry<K, V> prev = null;

        while (current != null) {
            if (current.expiresAt < currentTime) {
                if (prev == null) {
                    head = current.next;
                } else {
                    prev.next = current.next;
                }
                if (expiredKeys == null) {
                    expiredKeys = new ArrayList<>();
                }
                expiredKeys.add(current.key);
            } else {
                prev = current;
            }
            current = current.next;
        }

        if (expiredKeys == null) {
            return 0;
        }
        expirationCount += expiredKeys.size();
        logger.debug("Cleaned up {} expired cache entries", expiredKeys.size());
        // Listeners run only once the chain is consistent, so they may call back into the cache
        eventDispatcher.fireOnExpireAll(expiredKeys);
        return expiredKeys.size();
    }

    /**
     * Unlinks the first entry with the given key.
     *
     * @return the unlinked entry, or null if no entry had the key
     */
    private CacheEntry<K, V> remove(K key) {
        CacheEntry<K, V> current = head;
        CacheEntry<K, V> prev = null;

        while (current != null) {
            if (Objects.equals(current.key, key)) {
                if (prev == null) {
                    head = current.next;
                } else {
                    prev.next = current.next;
                }
                current.next = null;
                return current;
            }
            prev = current;
            current = current.next;
        }
        return null;
    }

    private CacheEntry<K, V> findEntry(K key) {
        CacheEntry<K, V> current = head;
        while (current != null) {
            if (Objects.equals(current.key, key)) {
                return current;
            }
            current = current.next;
        }
        return null;
    }

    private long currentTime(String operation) {
        try {
            return timeSource.now();
        } catch (RuntimeException e) {
            throw new AgedCacheException("Failed to read current time during " + operation, e);
        }
    }

    private static long computeExpiresAt(long currentTime, long retentionMillis) {
        try {
            return Math.addExact(currentTime, retentionMillis);
        } catch (ArithmeticException e) {
            return retentionMillis > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    private static long remainingMillis(long expiresAt, long currentTime) {
        try {
            return Math.subtractExact(expiresAt, currentTime);
        } catch (ArithmeticException e) {
            // Only live entries get here, so expiresAt >= currentTime and the true difference is positive
            return Long.MAX_VALUE;
        }
    }

    /**
     * Creates a builder for AgedCache.
     *
     * @param <K> key type
     * @param <V> value type
     * @return a new builder instance
     */
    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Builder for AgedCache.
     */
    public static class Builder<K, V> {
        private TimeSource timeSource;
        private final List<CacheEventListener<K, V>> eventListeners = new ArrayList<>();

        private Builder() {
            this.timeSource = TimeSource.system();
        }

        /**
         * Sets the time source used for all expiration decisions.
         *
         * @param timeSource the time source
         * @return this builder
         */
        public Builder<K, V> timeSource(TimeSource timeSource) {
            this.timeSource = Objects.requireNonNull(timeSource, "TimeSource must not be null");
            return this;
        }

        /**
         * Uses a JDK clock as the time source.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder<K, V> clock(Clock clock) {
            this.timeSource = TimeSource.of(clock);
            return this;
        }

        /**
         * Registers a listener for cache events. Listeners are called in
         * registration order.
         *
         * @param listener the listener
         * @return this builder
         */
        public Builder<K, V> addEventListener(CacheEventListener<K, V> listener) {
            eventListeners.add(Objects.requireNonNull(listener, "CacheEventListener must not be null"));
            return this;
        }

        /**
         * Builds a new AgedCache instance.
         *
         * @return a new, empty AgedCache
         */
        public AgedCache<K, V> build() {
            return new AgedCache<>(timeSource, new CacheEventDispatcher<>(eventListeners));
        }
    }

    /**
     * One key/value pair and its absolute expiration time. Only {@code next}
     * changes after construction.
     */
    private static final class CacheEntry<K, V> {
        private final K key;
        private final V value;
        private final long expiresAt;
        private CacheEntry<K, V> next;

        CacheEntry(K key, V value, long expiresAt) {
            this.key = key;
            this.value = value;
            this.expiresAt = expiresAt;
            this.next = null;
        }
    }
}
