package io.asap.server.executors;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.asap.spec.ThreadPoolExhaustedError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size thread pool that rejects work instead of queuing it.
 * <p>
 * A counting semaphore sized {@code maxThreads} is acquired without blocking on every
 * {@link #submit(Callable)}. When no permit is free the call fails immediately with
 * {@link ThreadPoolExhaustedError} and the {@value #EXHAUSTED_METRIC} counter is incremented,
 * so {@code N + 1} concurrent blocking submissions reject the last one rather than delay it.
 * The permit is released exactly once, whether the task returns or throws, before the
 * returned future completes.
 */
public class BoundedExecutor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BoundedExecutor.class);

    public static final String EXHAUSTED_METRIC = "asap.thread_pool.exhausted";

    private final int maxThreads;
    private final Semaphore permits;
    private final ExecutorService executor;
    private final Counter exhaustedCounter;

    public BoundedExecutor() {
        this(defaultMaxThreads());
    }

    public BoundedExecutor(int maxThreads) {
        this(maxThreads, Metrics.globalRegistry);
    }

    /**
     * @param maxThreads the number of worker threads and of concurrently running tasks
     * @param meterRegistry registry receiving the rejection counter
     * @throws IllegalArgumentException if {@code maxThreads < 1}
     */
    public BoundedExecutor(int maxThreads, MeterRegistry meterRegistry) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be >= 1, got " + maxThreads);
        }
        checkNotNullParam("meterRegistry", meterRegistry);
        this.maxThreads = maxThreads;
        this.permits = new Semaphore(maxThreads);
        this.executor = Executors.newFixedThreadPool(maxThreads, new HandlerThreadFactory());
        this.exhaustedCounter = Counter.builder(EXHAUSTED_METRIC)
                .description("Submissions rejected because every handler thread was busy")
                .tag("max_threads", String.valueOf(maxThreads))
                .register(meterRegistry);
        LOGGER.info("Bounded executor created with {} threads ({} processors)",
                maxThreads, Runtime.getRuntime().availableProcessors());
    }

    /**
     * @return {@code min(32, availableProcessors + 4)}
     */
    public static int defaultMaxThreads() {
        return Math.min(32, Runtime.getRuntime().availableProcessors() + 4);
    }

    /**
     * Runs a task on a free worker thread.
     *
     * @param task the work to run
     * @param <T> the result type
     * @return a future completed with the task's result or exception
     * @throws ThreadPoolExhaustedError if all {@code maxThreads} permits are taken
     * @throws RejectedExecutionException if the executor has been shut down
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        checkNotNullParam("task", task);
        if (!permits.tryAcquire()) {
            int active = getActiveThreads();
            exhaustedCounter.increment();
            LOGGER.warn("Thread pool exhausted: {}/{} threads in use", active, maxThreads);
            throw new ThreadPoolExhaustedError(maxThreads, active);
        }

        AtomicBoolean released = new AtomicBoolean();
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        };

        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    T value = task.call();
                    release.run();
                    result.complete(value);
                } catch (Throwable t) {
                    release.run();
                    result.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            release.run();
            throw e;
        }
        return result;
    }

    public int getMaxThreads() {
        return maxThreads;
    }

    /**
     * @return the number of tasks currently holding a permit
     */
    public int getActiveThreads() {
        return maxThreads - permits.availablePermits();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public void shutdown() {
        shutdown(true);
    }

    /**
     * Stops accepting work.
     *
     * @param wait whether to wait for running tasks to finish
     */
    public void shutdown(boolean wait) {
        executor.shutdown();
        LOGGER.info("Bounded executor shut down (wait={})", wait);
        if (wait) {
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOGGER.warn("Handler threads still running after 30 seconds");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        shutdown(true);
    }

    private static class HandlerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "asap-handler-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
