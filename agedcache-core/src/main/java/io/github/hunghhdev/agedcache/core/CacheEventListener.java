package io.github.hunghhdev.agedcache.core;

/**
 * Listener for cache events. Implementations receive callbacks when entries
 * are stored, expire, are evicted, or when the cache is cleared.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface CacheEventListener<K, V> {

    default void onPut(K key, V value) {}

    /**
     * Called when a sweep unlinks an entry whose retention has elapsed.
     */
    default void onExpire(K key) {}

    default void onEvict(K key) {}

    default void onClear() {}
}
