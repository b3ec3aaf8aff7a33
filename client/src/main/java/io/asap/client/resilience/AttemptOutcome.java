package io.asap.client.resilience;

import java.time.Duration;

import io.asap.spec.ASAPError;
import org.jspecify.annotations.Nullable;

/**
 * Result of a single attempt, as consumed by {@link RetryExecutor}.
 *
 * @param <T> the success value type
 */
public sealed interface AttemptOutcome<T> {

    record Success<T>(T value) implements AttemptOutcome<T> {
    }

    /**
     * A failure worth another attempt.
     *
     * @param error the failure
     * @param retryAfter minimum delay requested by the peer, if any
     */
    record Retryable<T>(ASAPError error, @Nullable Duration retryAfter) implements AttemptOutcome<T> {
        public Retryable(ASAPError error) {
            this(error, null);
        }
    }

    record Fatal<T>(ASAPError error) implements AttemptOutcome<T> {
    }

    static <T> AttemptOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AttemptOutcome<T> retryable(ASAPError error, @Nullable Duration retryAfter) {
        return new Retryable<>(error, retryAfter);
    }

    static <T> AttemptOutcome<T> fatal(ASAPError error) {
        return new Fatal<>(error);
    }
}
