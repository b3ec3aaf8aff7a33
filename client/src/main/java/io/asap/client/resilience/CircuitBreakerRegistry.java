package io.asap.client.resilience;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map from target base URL to the {@link CircuitBreaker} shared by every client calling that target.
 * <p>
 * An application normally creates one registry at its root and hands it to each
 * {@link io.asap.client.ASAPClient}; {@link #defaultRegistry()} is the process-wide instance
 * used when none is given. Entries live until {@link #clear()} is called, which tests must
 * do to isolate breaker state from one another.
 */
public class CircuitBreakerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private static final CircuitBreakerRegistry DEFAULT = new CircuitBreakerRegistry();

    private final Map<String, CircuitBreaker> breakers = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public CircuitBreakerRegistry() {
        this(Clock.systemUTC());
    }

    public CircuitBreakerRegistry(Clock clock) {
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    public static CircuitBreakerRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Returns the breaker for a target, creating it on first use. The threshold and timeout
     * only apply when the breaker is created; an existing breaker is returned unchanged.
     *
     * @param baseUrl the target base URL
     * @param threshold consecutive failures that open the circuit
     * @param timeout how long the circuit stays open
     * @return the shared breaker
     */
    public CircuitBreaker getOrCreate(String baseUrl, int threshold, Duration timeout) {
        String key = normalize(baseUrl);
        lock.lock();
        try {
            CircuitBreaker breaker = breakers.get(key);
            if (breaker == null) {
                breaker = new CircuitBreaker(key, threshold, timeout, clock);
                breakers.put(key, breaker);
                LOGGER.info("Created circuit breaker for {} (threshold={}, timeout={}s)",
                        key, threshold, timeout.toSeconds());
            }
            return breaker;
        } finally {
            lock.unlock();
        }
    }

    public @Nullable CircuitBreaker get(String baseUrl) {
        String key = normalize(baseUrl);
        lock.lock();
        try {
            return breakers.get(key);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return breakers.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            breakers.clear();
        } finally {
            lock.unlock();
        }
    }

    static String normalize(String baseUrl) {
        Assert.checkNotBlankParam("baseUrl", baseUrl);
        String key = baseUrl.trim();
        while (key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }
}
