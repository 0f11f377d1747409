package io.github.hunghhdev.agedcache.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache whose entries carry a retention period and become
 * unretrievable once it elapses.
 *
 * <p>Expired entries are removed lazily, as a side effect of the query
 * operations ({@link #get}, {@link #find}, {@link #containsKey},
 * {@link #getRemainingRetention}, {@link #size}, {@link #isEmpty}) or of an
 * explicit {@link #cleanupExpired()}. Storing a value never sweeps.</p>
 *
 * @param <K> key type, compared by {@code equals}
 * @param <V> value type
 */
public interface AgedCacheClient<K, V> {

    /**
     * Stores a value, replacing any entry with the same key.
     * A zero or negative retention yields an entry that is already due to expire.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param retentionMillis how long the entry stays retrievable, in milliseconds
     */
    void put(K key, V value, int retentionMillis);

    /**
     * Stores a value with the retention given as a duration.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param retention how long the entry stays retrievable
     */
    void put(K key, V value, Duration retention);

    /**
     * Returns the value of the live entry for {@code key}, or {@code null}
     * if there is none. A key that was never stored and one whose entry
     * expired look the same.
     */
    V get(K key);

    Optional<V> find(K key);

    /**
     * Tells whether a live entry exists for the key, which {@link #get}
     * cannot do for entries holding {@code null}.
     */
    boolean containsKey(K key);

    /**
     * Gets the time left before the entry for {@code key} expires.
     *
     * @param key the cache key
     * @return remaining retention, empty if there is no live entry
     */
    Optional<Duration> getRemainingRetention(K key);

    /**
     * Removes the entry for {@code key}.
     *
     * @param key the cache key
     * @return true if an entry was removed
     */
    boolean evict(K key);

    void clear();

    boolean isEmpty();

    int size();

    /**
     * Removes every expired entry now.
     *
     * @return number of entries removed
     */
    int cleanupExpired();

    CacheStatistics getStatistics();

    void resetStatistics();
}
