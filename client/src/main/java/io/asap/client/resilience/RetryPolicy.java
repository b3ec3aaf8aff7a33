package io.asap.client.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Exponential backoff with optional jitter.
 * <p>
 * {@code backoff(n) = min(maxDelay, baseDelay * 2^n)}; with jitter a uniform random amount in
 * {@code [0, 0.1 * backoff(n)]} is added. A zero base delay always yields zero, and a
 * {@code maxDelay} smaller than {@code baseDelay} clamps every attempt to {@code maxDelay}.
 * A negative base delay is passed through unclamped; the retry loop waits zero in that case.
 *
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound of the exponential part
 * @param jitter whether to add random jitter
 * @param maxAttempts total number of attempts of one call, at least 1
 */
public record RetryPolicy(Duration baseDelay, Duration maxDelay, boolean jitter, int maxAttempts) {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private static final double JITTER_FACTOR = 0.1;

    public RetryPolicy {
        Assert.checkNotNullParam("baseDelay", baseDelay);
        Assert.checkNotNullParam("maxDelay", maxDelay);
        Assert.checkMinimumParam("maxAttempts", 1, maxAttempts);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, true, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param attempt zero-based attempt number
     * @return the delay before the next attempt
     */
    public Duration backoff(int attempt) {
        return backoff(attempt, () -> ThreadLocalRandom.current().nextDouble());
    }

    Duration backoff(int attempt, DoubleSupplier random) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Parameter 'attempt' must be >= 0, got " + attempt);
        }
        double base = baseDelay.toNanos();
        if (base == 0) {
            return Duration.ZERO;
        }
        double delay = Math.min(maxDelay.toNanos(), base * Math.pow(2, attempt));
        if (jitter) {
            delay += random.getAsDouble() * JITTER_FACTOR * delay;
        }
        return Duration.ofNanos((long) delay);
    }

    /**
     * Delay before the next attempt, honoring a server supplied {@code Retry-After}: the hint
     * raises the delay to at least its value, still bounded by {@code maxDelay}.
     *
     * @param attempt zero-based attempt number
     * @param retryAfter the server hint, if any
     * @return the delay to wait, never negative
     */
    public Duration delayFor(int attempt, @Nullable Duration retryAfter) {
        Duration delay = backoff(attempt);
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
        }
        return delay.isNegative() ? Duration.ZERO : delay;
    }
}
