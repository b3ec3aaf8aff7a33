package io.asap.server.handlers;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import io.asap.server.ServerCallContext;
import io.asap.server.executors.BoundedExecutor;
import io.asap.spec.ASAPError;
import io.asap.spec.Envelope;
import io.asap.spec.HandlerNotFoundError;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes an envelope to the handler registered for its payload type.
 * <p>
 * Async handlers are invoked on the calling thread. Synchronous handlers are submitted to the
 * {@link BoundedExecutor}; when it is saturated the dispatch fails with
 * {@link io.asap.spec.ThreadPoolExhaustedError} instead of waiting. Every failure, including
 * {@link HandlerNotFoundError} and interceptor rejections, is reported through the returned
 * future.
 */
public class Dispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    public static final String REQUESTS_METRIC = "asap.requests";
    public static final String DURATION_METRIC = "asap.request.duration";

    /**
     * Tag value for payload types without a registered handler, so unknown types sent by peers
     * cannot create new meters.
     */
    public static final String UNKNOWN_PAYLOAD_TYPE = "unknown";

    private final HandlerRegistry registry;
    private final BoundedExecutor executor;
    private final List<DispatchInterceptor> interceptors;
    private final MeterRegistry meterRegistry;

    public Dispatcher(HandlerRegistry registry, BoundedExecutor executor) {
        this(registry, executor, List.of(), Metrics.globalRegistry);
    }

    public Dispatcher(HandlerRegistry registry, BoundedExecutor executor, List<DispatchInterceptor> interceptors,
                      MeterRegistry meterRegistry) {
        this.registry = checkNotNullParam("registry", registry);
        this.executor = checkNotNullParam("executor", executor);
        this.interceptors = List.copyOf(checkNotNullParam("interceptors", interceptors));
        this.meterRegistry = checkNotNullParam("meterRegistry", meterRegistry);
    }

    /**
     * Dispatches an envelope.
     *
     * @param envelope the request envelope
     * @param context the request context
     * @return the handler's response envelope
     */
    public CompletableFuture<Envelope> dispatch(Envelope envelope, ServerCallContext context) {
        checkNotNullParam("envelope", envelope);
        checkNotNullParam("context", context);
        Timer.Sample sample = Timer.start(meterRegistry);

        CompletableFuture<Envelope> response;
        try {
            response = invoke(envelope, context);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        return response.whenComplete((result, error) -> record(sample, envelope.payloadType(), error));
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    public BoundedExecutor getExecutor() {
        return executor;
    }

    private CompletableFuture<Envelope> invoke(Envelope envelope, ServerCallContext context) {
        for (DispatchInterceptor interceptor : interceptors) {
            interceptor.beforeDispatch(envelope, context);
        }

        String payloadType = envelope.payloadType();
        RegisteredHandler registered = registry.lookup(payloadType).orElse(null);
        if (registered == null) {
            LOGGER.warn("No handler registered for payload type {} (envelope {})", payloadType, envelope.id());
            throw new HandlerNotFoundError(payloadType);
        }
        LOGGER.debug("Dispatching envelope {} ({}) from {}", envelope.id(), payloadType, envelope.sender());

        CompletableFuture<Envelope> response;
        if (registered instanceof RegisteredHandler.Async async) {
            response = async.handler().handle(envelope, context);
            if (response == null) {
                throw new IllegalStateException("Async handler for " + payloadType + " returned no future");
            }
        } else {
            Handler handler = ((RegisteredHandler.Sync) registered).handler();
            response = executor.submit(() -> handler.handle(envelope, context));
        }

        return response.thenApply(result -> {
            if (result == null) {
                throw new IllegalStateException("Handler for " + payloadType + " returned no envelope");
            }
            Envelope current = result;
            for (DispatchInterceptor interceptor : interceptors) {
                current = interceptor.afterDispatch(envelope, current, context);
            }
            return current;
        });
    }

    private void record(Timer.Sample sample, String payloadType, @Nullable Throwable error) {
        String status = statusOf(error);
        if (!registry.hasHandler(payloadType)) {
            payloadType = UNKNOWN_PAYLOAD_TYPE;
        }
        meterRegistry.counter(REQUESTS_METRIC, "payload_type", payloadType, "status", status).increment();
        sample.stop(meterRegistry.timer(DURATION_METRIC, "payload_type", payloadType, "status", status));
    }

    private static String statusOf(@Nullable Throwable error) {
        if (error == null) {
            return "success";
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof ASAPError asapError ? asapError.getTag() : "error";
    }
}
