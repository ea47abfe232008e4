package com.qqsuccubus.delivery.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for retries against the broker.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^(attempt-1)) + uniform(0, t/10)}
 * <ul>
 *   <li>{@code base}: Initial delay (retry backoff from settings)</li>
 *   <li>{@code max}: Maximum delay (cap)</li>
 *   <li>jitter: up to 10% of the capped delay, at least 1ms wide</li>
 * </ul>
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    /**
     * Computes the next backoff delay with jitter.
     *
     * @param attempt Retry attempt number (1-based)
     * @param base    Base delay
     * @param max     Maximum delay (cap)
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max) {
        long baseMs = base.toMillis();
        int exponent = Math.max(0, Math.min(attempt - 1, 20)); // Cap exponent to avoid overflow
        long expMs = baseMs * (1L << exponent);

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = ThreadLocalRandom.current().nextLong(Math.max(1, cappedMs / 10));

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Backoff capped at {@link #DEFAULT_MAX}.
     *
     * @param attempt Retry attempt number (1-based)
     * @param base    Base delay
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base) {
        return next(attempt, base, DEFAULT_MAX);
    }
}
