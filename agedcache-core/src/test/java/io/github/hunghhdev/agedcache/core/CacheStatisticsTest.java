package io.github.hunghhdev.agedcache.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CacheStatisticsTest {

    @Test
    void testRatesWithoutRequests() {
        CacheStatistics stats = new CacheStatistics(0, 0, 3, 0, 0);

        assertEquals(0, stats.getRequestCount());
        assertEquals(0.0, stats.getHitRate());
        assertEquals(0.0, stats.getMissRate());
    }

    @Test
    void testRates() {
        CacheStatistics stats = new CacheStatistics(3, 1, 4, 2, 1);

        assertEquals(4, stats.getRequestCount());
        assertEquals(0.75, stats.getHitRate(), 0.0001);
        assertEquals(0.25, stats.getMissRate(), 0.0001);
        assertEquals(3, stats.getRemovalCount());
    }

    @Test
    void testToString() {
        CacheStatistics stats = new CacheStatistics(1, 1, 2, 3, 0);

        assertEquals("CacheStatistics{hits=1, misses=1, puts=2, expirations=3, evictions=0}", stats.toString());
    }
}
