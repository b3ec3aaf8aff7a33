package io.asap.client.resilience;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.asap.spec.ASAPConnectionError;
import io.asap.spec.ASAPError;
import io.asap.spec.ASAPRemoteError;
import io.asap.spec.ASAPTimeoutError;
import io.asap.spec.CircuitOpenError;
import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the attempts of one logical call under a {@link RetryPolicy} and a {@link CircuitBreaker}.
 * <p>
 * The breaker is consulted before the first attempt and again before each retry when it has been
 * opened in the meantime (by this or any other client sharing it); a refusal completes the call
 * with {@link CircuitOpenError} without touching the network. Waits between attempts never block
 * a thread. The outcome of the call is reported to the breaker exactly once:
 * <ul>
 *   <li>success, or a fatal {@link ASAPRemoteError} (the peer answered), counts as a success</li>
 *   <li>any other fatal error, running out of attempts, or the call deadline counts as a failure</li>
 *   <li>a circuit-open refusal is not reported</li>
 * </ul>
 */
public class RetryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetryExecutor.class);

    // fires call deadlines; a call that settles first cancels its timer and drops out of the queue
    private static final ScheduledThreadPoolExecutor DEADLINES = createDeadlineScheduler();

    private final RetryPolicy policy;
    private final Executor executor;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, ForkJoinPool.commonPool());
    }

    public RetryExecutor(RetryPolicy policy, Executor executor) {
        this.policy = Assert.checkNotNullParam("policy", policy);
        this.executor = Assert.checkNotNullParam("executor", executor);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    private static ScheduledThreadPoolExecutor createDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "asap-call-deadlines");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Executes a call.
     *
     * @param target the target name, used in errors and logs
     * @param breaker the breaker guarding the target
     * @param attempt starts one attempt; invoked once per attempt
     * @param deadline optional limit for the whole call, retries and waits included
     * @param <T> the result type
     * @return the result; fails with the {@link ASAPError} that ended the call
     */
    public <T> CompletableFuture<T> execute(String target, CircuitBreaker breaker,
                                            Supplier<CompletableFuture<AttemptOutcome<T>>> attempt,
                                            @Nullable Duration deadline) {
        Call<T> call = new Call<>(target, breaker, attempt);
        call.start(deadline);
        return call.result;
    }

    private final class Call<T> {
        private final String target;
        private final CircuitBreaker breaker;
        private final Supplier<CompletableFuture<AttemptOutcome<T>>> attempt;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean();
        private volatile @Nullable CompletableFuture<AttemptOutcome<T>> current;
        private volatile @Nullable ScheduledFuture<?> deadlineTimer;

        Call(String target, CircuitBreaker breaker, Supplier<CompletableFuture<AttemptOutcome<T>>> attempt) {
            this.target = target;
            this.breaker = breaker;
            this.attempt = attempt;
        }

        void start(@Nullable Duration deadline) {
            if (!breaker.canAttempt()) {
                rejectOpenCircuit();
                return;
            }
            if (deadline != null) {
                deadlineTimer = DEADLINES.schedule(() -> executor.execute(() -> deadlineExceeded(deadline)),
                        Math.max(0, deadline.toNanos()), TimeUnit.NANOSECONDS);
            }
            run(0);
        }

        private void run(int attemptNumber) {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<AttemptOutcome<T>> future;
            try {
                future = attempt.get();
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            current = future;
            future.whenComplete((outcome, error) -> {
                if (error != null) {
                    handle(attemptNumber, AttemptOutcome.fatal(toASAPError(error)));
                } else {
                    handle(attemptNumber, outcome);
                }
            });
        }

        private void handle(int attemptNumber, AttemptOutcome<T> outcome) {
            if (outcome instanceof AttemptOutcome.Success<T> success) {
                settle(breaker::recordSuccess, () -> result.complete(success.value()));
            } else if (outcome instanceof AttemptOutcome.Fatal<T> fatal) {
                Runnable report = fatal.error() instanceof ASAPRemoteError ? breaker::recordSuccess : breaker::recordFailure;
                settle(report, () -> result.completeExceptionally(fatal.error()));
            } else if (outcome instanceof AttemptOutcome.Retryable<T> retryable) {
                retry(attemptNumber, retryable);
            }
        }

        private void retry(int attemptNumber, AttemptOutcome.Retryable<T> retryable) {
            int attempts = attemptNumber + 1;
            if (attempts >= policy.maxAttempts()) {
                LOGGER.warn("Call to {} failed after {} attempts: {}", target, attempts, retryable.error().getMessage());
                settle(breaker::recordFailure, () -> result.completeExceptionally(retryable.error()));
                return;
            }
            if (breaker.getState() == CircuitState.OPEN && !breaker.canAttempt()) {
                rejectOpenCircuit();
                return;
            }
            Duration delay = policy.delayFor(attemptNumber, retryable.retryAfter());
            LOGGER.warn("Attempt {}/{} to {} failed: {}. Retrying in {} ms",
                    attempts, policy.maxAttempts(), target, retryable.error().getMessage(), delay.toMillis());
            CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor)
                    .execute(() -> run(attempts));
        }

        private void deadlineExceeded(Duration deadline) {
            settle(breaker::recordFailure, () -> {
                LOGGER.warn("Call to {} exceeded its deadline of {} ms", target, deadline.toMillis());
                CompletableFuture<AttemptOutcome<T>> inFlight = current;
                if (inFlight != null) {
                    inFlight.cancel(true);
                }
                result.completeExceptionally(new ASAPTimeoutError(
                        "Call to " + target + " exceeded its deadline of " + deadline.toMillis() + " ms", deadline));
            });
        }

        private void rejectOpenCircuit() {
            settle(() -> { }, () -> {
                LOGGER.warn("Circuit breaker for {} is OPEN, failing fast", target);
                result.completeExceptionally(new CircuitOpenError(target, breaker.getConsecutiveFailures()));
            });
        }

        private void settle(Runnable report, Runnable complete) {
            if (settled.compareAndSet(false, true)) {
                ScheduledFuture<?> timer = deadlineTimer;
                if (timer != null) {
                    timer.cancel(false);
                }
                report.run();
                complete.run();
            }
        }
    }

    static ASAPError toASAPError(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ASAPError asapError) {
            return asapError;
        }
        return new ASAPConnectionError("Unexpected failure: " + cause, cause);
    }
}
