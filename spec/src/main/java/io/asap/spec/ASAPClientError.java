package io.asap.spec;

import java.time.Duration;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Base class for the failures the client surfaces to its callers.
 * <p>
 * {@link #isRetryable()} tells the retry engine whether another attempt may succeed;
 * {@link #getRetryAfter()} carries a server supplied hint ({@code Retry-After}) for the
 * minimum delay before that attempt.
 */
public abstract class ASAPClientError extends ASAPError {

    private final boolean retryable;
    private final @Nullable Duration retryAfter;

    protected ASAPClientError(String code, String tag, String message, @Nullable Map<String, Object> details,
                              @Nullable Throwable cause, boolean retryable, @Nullable Duration retryAfter) {
        super(code, tag, message, details, cause);
        this.retryable = retryable;
        this.retryAfter = retryAfter;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public @Nullable Duration getRetryAfter() {
        return retryAfter;
    }
}
