package io.asap.client.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-target failure gate.
 * <p>
 * Transitions:
 * <ul>
 *   <li>{@code CLOSED} to {@code OPEN} on the {@code threshold}-th consecutive failure</li>
 *   <li>{@code OPEN} to {@code HALF_OPEN} on the first {@link #canAttempt()} once {@code timeout}
 *       has elapsed since the last failure; that caller receives the only probe permit</li>
 *   <li>{@code HALF_OPEN} to {@code CLOSED} on success, resetting the failure counter</li>
 *   <li>{@code HALF_OPEN} to {@code OPEN} on failure, restarting the timeout</li>
 * </ul>
 * Instances are thread safe and are meant to be shared through a {@link CircuitBreakerRegistry},
 * so that every client talking to the same target sees the same state.
 */
public class CircuitBreaker {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final int DEFAULT_THRESHOLD = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final int threshold;
    private final Duration timeout;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private @Nullable Instant lastFailureTime;
    private boolean probeInFlight;

    public CircuitBreaker(int threshold, Duration timeout) {
        this("default", threshold, timeout, Clock.systemUTC());
    }

    /**
     * @param name the target the breaker protects, used in log messages
     * @param threshold consecutive failures that open the circuit, at least 1
     * @param timeout how long the circuit stays open before a probe is allowed
     * @param clock time source
     */
    public CircuitBreaker(String name, int threshold, Duration timeout, Clock clock) {
        Assert.checkMinimumParam("threshold", 1, threshold);
        Assert.checkNotNullParam("timeout", timeout);
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Parameter 'timeout' must not be negative");
        }
        this.name = Assert.checkNotNullParam("name", name);
        this.threshold = threshold;
        this.timeout = timeout;
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    /**
     * Checks whether a call may go out.
     * <p>
     * Always {@code true} when closed. When open, returns {@code true} only once the timeout
     * has elapsed, moving the breaker to half-open. In half-open state only the caller that
     * triggered the transition holds the probe permit; everybody else is refused until the
     * probe reports its outcome.
     *
     * @return whether the call may proceed
     */
    public boolean canAttempt() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return true;
                case OPEN:
                    if (lastFailureTime != null
                            && Duration.between(lastFailureTime, clock.instant()).compareTo(timeout) >= 0) {
                        state = CircuitState.HALF_OPEN;
                        probeInFlight = true;
                        LOGGER.info("Circuit breaker for {} is HALF_OPEN, allowing a probe call", name);
                        return true;
                    }
                    return false;
                case HALF_OPEN:
                default:
                    if (!probeInFlight) {
                        probeInFlight = true;
                        return true;
                    }
                    return false;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess() {
        lock.lock();
        try {
            if (state != CircuitState.CLOSED) {
                LOGGER.info("Circuit breaker for {} is CLOSED after a successful call", name);
            }
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }

    public void recordFailure() {
        lock.lock();
        try {
            consecutiveFailures++;
            lastFailureTime = clock.instant();
            probeInFlight = false;
            if (state == CircuitState.HALF_OPEN) {
                state = CircuitState.OPEN;
                LOGGER.warn("Circuit breaker for {} re-opened: probe call failed", name);
            } else if (state == CircuitState.CLOSED && consecutiveFailures >= threshold) {
                state = CircuitState.OPEN;
                LOGGER.warn("Circuit breaker for {} OPEN after {} consecutive failures", name, consecutiveFailures);
            }
        } finally {
            lock.unlock();
        }
    }

    public CircuitState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        return getState() == CircuitState.OPEN;
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public @Nullable Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the breaker to its initial closed state.
     */
    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            lastFailureTime = null;
            probeInFlight = false;
        } finally {
            lock.unlock();
        }
    }
}
