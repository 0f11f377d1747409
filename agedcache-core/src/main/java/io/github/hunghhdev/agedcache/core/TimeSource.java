package io.github.hunghhdev.agedcache.core;

import java.time.Clock;
import java.util.Objects;

/**
 * Source of the current time used for every expiration decision.
 *
 * <p>Injecting a time source decouples the cache from the wall clock, so
 * tests can fix or advance "now" without sleeping.</p>
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * Returns the current time in milliseconds since the Unix epoch.
     *
     * @return current time in milliseconds
     */
    long now();

    /**
     * Returns a time source backed by {@link System#currentTimeMillis()}.
     *
     * @return the system time source
     */
    static TimeSource system() {
        return System::currentTimeMillis;
    }

    /**
     * Adapts a JDK {@link Clock}.
     *
     * @param clock the clock to read
     * @return a time source returning {@code clock.millis()}
     */
    static TimeSource of(Clock clock) {
        Objects.requireNonNull(clock, "Clock must not be null");
        return clock::millis;
    }
}
