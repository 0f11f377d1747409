package io.github.hunghhdev.agedcache.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

final class CacheEventDispatcher<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(CacheEventDispatcher.class);

    private final List<CacheEventListener<K, V>> listeners;

    CacheEventDispatcher(List<CacheEventListener<K, V>> listeners) {
        this.listeners = listeners != null ? new ArrayList<>(listeners) : new ArrayList<>();
    }

    void fireOnPut(K key, V value) {
        for (CacheEventListener<K, V> listener : listeners) {
            try {
                listener.onPut(key, value);
            } catch (Exception e) {
                logger.warn("CacheEventListener.onPut failed for key '{}': {}", key, e.getMessage());
            }
        }
    }

    void fireOnExpire(K key) {
        for (CacheEventListener<K, V> listener : listeners) {
            try {
                listener.onExpire(key);
            } catch (Exception e) {
                logger.warn("CacheEventListener.onExpire failed for key '{}': {}", key, e.getMessage());
            }
        }
    }

    void fireOnExpireAll(Iterable<K> keys) {
        for (K key : keys) {
            fireOnExpire(key);
        }
    }

    void fireOnEvict(K key) {
        for (CacheEventListener<K, V> listener : listeners) {
            try {
                listener.onEvict(key);
            } catch (Exception e) {
                logger.warn("CacheEventListener.onEvict failed for key '{}': {}", key, e.getMessage());
            }
        }
    }

    void fireOnClear() {
        for (CacheEventListener<K, V> listener : listeners) {
            try {
                listener.onClear();
            } catch (Exception e) {
                logger.warn("CacheEventListener.onClear failed: {}", e.getMessage());
            }
        }
    }
}
