package io.github.hunghhdev.agedcache.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeSourceTest {

    @Test
    void testSystemTimeSourceFollowsWallClock() {
        long before = System.currentTimeMillis();
        long now = TimeSource.system().now();
        long after = System.currentTimeMillis();

        assertTrue(now >= before);
        assertTrue(now <= after);
    }

    @Test
    void testClockAdapterReadsClockMillis() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_123L), ZoneOffset.UTC);

        assertEquals(1_700_000_000_123L, TimeSource.of(clock).now());
    }

    @Test
    void testClockAdapterRejectsNull() {
        NullPointerException exception = assertThrows(NullPointerException.class, () -> TimeSource.of(null));
        assertEquals("Clock must not be null", exception.getMessage());
    }
}
