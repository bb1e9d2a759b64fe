package de.bsommerfeld.patchfetcher.core.util;

import java.time.Duration;

/**
 * Pauses the calling thread between retry attempts. Tests substitute a
 * recording implementation to keep backoff out of the wall clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
