package io.meshpager.runtime;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff shared by the bus reconnect loop and the gateway forwarder.
 *
 * <p>The delay before retry {@code n} (zero-based) is {@code baseDelay * multiplier^n}, clamped to
 * {@code maxDelay}, plus up to {@code maxJitter} of random jitter. {@code maxAttempts == 0} means
 * the caller retries without limit.
 */
public record BackoffPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay, Duration maxJitter) {
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    public BackoffPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (multiplier < 1.0d) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            maxDelay = baseDelay;
        }
        maxJitter = maxJitter == null || maxJitter.isNegative() ? Duration.ZERO : maxJitter;
    }

    /** Bounded attempts, doubling, no ceiling that matters in practice. */
    public static BackoffPolicy bounded(int maxAttempts, Duration baseDelay) {
        return new BackoffPolicy(maxAttempts, baseDelay, 2.0d, Duration.ofDays(1), Duration.ZERO);
    }

    /** Unbounded attempts, doubling, clamped to {@code maxDelay}. */
    public static BackoffPolicy unbounded(Duration baseDelay, Duration maxDelay) {
        return new BackoffPolicy(0, baseDelay, 2.0d, maxDelay, Duration.ZERO);
    }

    public boolean unlimited() {
        return maxAttempts == 0;
    }

    /** Whether another attempt is allowed after {@code attemptsMade} attempts. */
    public boolean hasAttemptsLeft(int attemptsMade) {
        return unlimited() || attemptsMade < maxAttempts;
    }

    public Duration delayFor(int retryIndex) {
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        double raw = baseMs * Math.pow(multiplier, Math.max(0, retryIndex));
        long delayMs = raw >= maxMs ? maxMs : (long) raw;
        long jitterMs = maxJitter.toMillis();
        if (jitterMs > 0L) {
            delayMs = Math.min(maxMs, delayMs + ThreadLocalRandom.current().nextLong(0L, jitterMs + 1L));
        }
        return Duration.ofMillis(delayMs);
    }
}
