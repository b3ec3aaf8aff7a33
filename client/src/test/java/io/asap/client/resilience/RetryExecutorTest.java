package io.asap.client.resilience;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.asap.client.MutableClock;
import io.asap.spec.ASAPConnectionError;
import io.asap.spec.ASAPRemoteError;
import io.asap.spec.ASAPTimeoutError;
import io.asap.spec.CircuitOpenError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RetryExecutorTest {

    private static final String TARGET = "http://agent.example.com";

    private final MutableClock clock = new MutableClock();
    private final RetryExecutor executor = new RetryExecutor(new RetryPolicy(Duration.ZERO, Duration.ZERO, false, 3));
    private final AtomicInteger attempts = new AtomicInteger();
    private CircuitBreaker breaker;

    @BeforeEach
    public void setUp() {
        breaker = spy(new CircuitBreaker(TARGET, 5, Duration.ofSeconds(30), clock));
    }

    private static CompletableFuture<AttemptOutcome<String>> connectionFailure() {
        return CompletableFuture.completedFuture(
                AttemptOutcome.retryable(new ASAPConnectionError("refused", null), null));
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        CompletionException error = assertThrows(CompletionException.class, future::join);
        return error.getCause();
    }

    @Test
    public void testSuccessOnFirstAttempt() {
        String result = executor.execute(TARGET, breaker, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture(AttemptOutcome.success("ok"));
        }, null).join();

        assertEquals("ok", result);
        assertEquals(1, attempts.get());
        verify(breaker, times(1)).recordSuccess();
        verify(breaker, times(0)).recordFailure();
    }

    @Test
    public void testRetriesUntilSuccess() {
        String result = executor.execute(TARGET, breaker, () -> attempts.incrementAndGet() < 3
                ? connectionFailure()
                : CompletableFuture.completedFuture(AttemptOutcome.success("ok")), null).join();

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        verify(breaker, times(1)).recordSuccess();
        verify(breaker, times(0)).recordFailure();
    }

    @Test
    public void testExhaustionReportsOneFailure() {
        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> {
            attempts.incrementAndGet();
            return connectionFailure();
        }, null);

        assertInstanceOf(ASAPConnectionError.class, failureOf(future));
        assertEquals(3, attempts.get());
        verify(breaker, times(1)).recordFailure();
        assertEquals(1, breaker.getConsecutiveFailures());
    }

    @Test
    public void testFatalRemoteErrorIsNotRetried() {
        ASAPRemoteError remote = new ASAPRemoteError(-32601, "Method not found", null);

        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture(AttemptOutcome.fatal(remote));
        }, null);

        assertSame(remote, failureOf(future));
        assertEquals(1, attempts.get());
        verify(breaker, times(1)).recordSuccess();
        verify(breaker, times(0)).recordFailure();
    }

    @Test
    public void testFatalConnectionErrorCountsAsFailure() {
        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> CompletableFuture.completedFuture(
                AttemptOutcome.fatal(new ASAPConnectionError(404, "HTTP error 404", false, null))), null);

        assertInstanceOf(ASAPConnectionError.class, failureOf(future));
        verify(breaker, times(1)).recordFailure();
    }

    @Test
    public void testUnexpectedExceptionBecomesConnectionError() {
        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> {
            throw new IllegalStateException("boom");
        }, null);

        Throwable error = failureOf(future);
        assertInstanceOf(ASAPConnectionError.class, error);
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    public void testOpenCircuitFailsFastWithoutAttempt() {
        for (int i = 0; i < 5; i++) {
            breaker.recordFailure();
        }

        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture(AttemptOutcome.success("ok"));
        }, null);

        CircuitOpenError error = assertInstanceOf(CircuitOpenError.class, failureOf(future));
        assertEquals(5, error.getConsecutiveFailures());
        assertEquals(TARGET, error.getBaseUrl());
        assertEquals(0, attempts.get());
        verify(breaker, times(5)).recordFailure();
    }

    @Test
    public void testCircuitOpenedBetweenRetriesStopsTheCall() {
        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> {
            attempts.incrementAndGet();
            // another client sharing the breaker trips it meanwhile
            for (int i = 0; i < 5; i++) {
                breaker.recordFailure();
            }
            return connectionFailure();
        }, null);

        assertInstanceOf(CircuitOpenError.class, failureOf(future));
        assertEquals(1, attempts.get());
        verify(breaker, times(5)).recordFailure();
    }

    @Test
    public void testDeadlineFailsTheCallOnce() {
        CompletableFuture<AttemptOutcome<String>> never = new CompletableFuture<>();

        CompletableFuture<String> future = executor.execute(TARGET, breaker, () -> never, Duration.ofMillis(100));

        ASAPTimeoutError error = assertInstanceOf(ASAPTimeoutError.class, failureOf(future));
        assertEquals(Duration.ofMillis(100), error.getTimeout());
        assertTrue(never.isCancelled());
        verify(breaker, times(1)).recordFailure();
    }

    @Test
    public void testEarlySettlementCancelsDeadlineTimer() {
        int pending = RetryExecutor.pendingDeadlines();

        String result = executor.execute(TARGET, breaker,
                () -> CompletableFuture.completedFuture(AttemptOutcome.success("ok")), Duration.ofHours(1)).join();

        assertEquals("ok", result);
        assertEquals(pending, RetryExecutor.pendingDeadlines());
        verify(breaker, times(1)).recordSuccess();
        verify(breaker, times(0)).recordFailure();
    }

    @Test
    public void testRetryAfterHintDelaysNextAttempt() {
        RetryExecutor slow = new RetryExecutor(new RetryPolicy(Duration.ZERO, Duration.ofSeconds(1), false, 2));
        long start = System.nanoTime();

        String result = slow.execute(TARGET, breaker, () -> attempts.incrementAndGet() == 1
                ? CompletableFuture.completedFuture(AttemptOutcome.retryable(
                        new ASAPConnectionError(503, "busy", true, Duration.ofMillis(300)), Duration.ofMillis(300)))
                : CompletableFuture.completedFuture(AttemptOutcome.success("ok")), null).join();

        assertEquals("ok", result);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 250);
    }
}
