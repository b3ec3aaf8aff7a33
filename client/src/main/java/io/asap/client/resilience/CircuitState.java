package io.asap.client.resilience;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /** Calls flow normally; consecutive failures are counted. */
    CLOSED,
    /** Calls are rejected without network I/O until the timeout elapses. */
    OPEN,
    /** A single probe call is allowed through to test whether the target recovered. */
    HALF_OPEN
}
