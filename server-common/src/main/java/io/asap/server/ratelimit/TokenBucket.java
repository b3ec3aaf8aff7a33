package io.asap.server.ratelimit;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.function.LongSupplier;

/**
 * Per-connection token bucket: one token per message, refilled continuously at {@code rate}
 * tokens per second up to {@code capacity}.
 * <p>
 * Instances are not thread safe. Each streaming connection owns its bucket and must serialize
 * calls to it.
 */
public class TokenBucket {

    public static final double DEFAULT_MESSAGES_PER_SECOND = 10.0;

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double rate;
    private final double capacity;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastRefill;

    public TokenBucket(double rate) {
        this(rate, rate);
    }

    public TokenBucket(double rate, double capacity) {
        this(rate, capacity, System::nanoTime);
    }

    /**
     * @param rate tokens added per second, must be positive
     * @param capacity the maximum number of stored tokens; the bucket starts full
     * @param nanoClock monotonic time source in nanoseconds
     */
    public TokenBucket(double rate, double capacity, LongSupplier nanoClock) {
        if (rate <= 0) {
            throw new IllegalArgumentException("rate must be positive, got " + rate);
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.rate = rate;
        this.capacity = capacity;
        this.nanoClock = checkNotNullParam("nanoClock", nanoClock);
        this.tokens = capacity;
        this.lastRefill = nanoClock.getAsLong();
    }

    public boolean consume() {
        return consume(1);
    }

    /**
     * Takes {@code n} tokens if they are available.
     *
     * @param n the number of tokens; {@code n <= 0} always succeeds
     * @return {@code true} if the tokens were deducted, {@code false} if the caller is over its rate
     */
    public boolean consume(double n) {
        if (n <= 0) {
            return true;
        }
        refill();
        if (tokens >= n) {
            tokens -= n;
            return true;
        }
        return false;
    }

    /**
     * @param n the number of tokens wanted
     * @return seconds until {@code n} tokens will be available, 0 if they already are
     */
    public double secondsUntilAvailable(double n) {
        refill();
        if (tokens >= n) {
            return 0;
        }
        return (Math.min(n, capacity) - tokens) / rate;
    }

    public double getRate() {
        return rate;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        double elapsed = (now - lastRefill) / NANOS_PER_SECOND;
        tokens = Math.min(capacity, tokens + elapsed * rate);
        lastRefill = now;
    }
}
