package de.bsommerfeld.patchfetcher.core.util;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * <p>
 * Attempt {@code n} (1-based) that failed waits
 * {@code initialBackoff * 2^(n-1)}, capped at {@code maxBackoff}, before
 * attempt {@code n + 1}. No wait follows the last attempt.
 *
 * @param maxAttempts    total attempts including the first, at least 1
 * @param initialBackoff wait after the first failure
 * @param maxBackoff     upper bound for any single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
    }

    public static RetryPolicy of(int maxAttempts, long initialBackoffMillis, long maxBackoffMillis) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(initialBackoffMillis),
                Duration.ofMillis(maxBackoffMillis));
    }

    /** Whether another attempt is allowed after {@code failedAttempt} failed. */
    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /** Wait before the attempt following {@code failedAttempt}. */
    public Duration backoffAfter(int failedAttempt) {
        long initial = initialBackoff.toMillis();
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long millis = initial << shift;
        if (millis < initial) {
            millis = Long.MAX_VALUE;
        }
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
