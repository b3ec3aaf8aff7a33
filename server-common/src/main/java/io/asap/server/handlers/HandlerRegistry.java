package io.asap.server.handlers;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import io.asap.spec.PayloadType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps payload types to handlers. The last registration for a payload type wins.
 * <p>
 * The registry is normally filled once at startup and read concurrently while serving.
 */
public class HandlerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<String, RegisteredHandler> handlers = new ConcurrentHashMap<>();

    /**
     * @return a registry answering {@code task.request} with {@link EchoHandler}
     */
    public static HandlerRegistry createDefault() {
        HandlerRegistry registry = new HandlerRegistry();
        registry.register(PayloadType.TASK_REQUEST, new EchoHandler());
        return registry;
    }

    public HandlerRegistry register(String payloadType, Handler handler) {
        return put(payloadType, new RegisteredHandler.Sync(handler));
    }

    public HandlerRegistry register(PayloadType payloadType, Handler handler) {
        checkNotNullParam("payloadType", payloadType);
        return register(payloadType.wireName(), handler);
    }

    public HandlerRegistry registerAsync(String payloadType, AsyncHandler handler) {
        return put(payloadType, new RegisteredHandler.Async(handler));
    }

    public HandlerRegistry registerAsync(PayloadType payloadType, AsyncHandler handler) {
        checkNotNullParam("payloadType", payloadType);
        return registerAsync(payloadType.wireName(), handler);
    }

    public boolean hasHandler(String payloadType) {
        return handlers.containsKey(payloadType);
    }

    public Optional<RegisteredHandler> lookup(String payloadType) {
        return Optional.ofNullable(handlers.get(payloadType));
    }

    /**
     * @return the registered payload types, sorted
     */
    public List<String> listHandlers() {
        return handlers.keySet().stream().sorted().collect(Collectors.toList());
    }

    private HandlerRegistry put(String payloadType, RegisteredHandler handler) {
        checkNotNullParam("payloadType", payloadType);
        RegisteredHandler previous = handlers.put(payloadType, handler);
        if (previous != null) {
            LOGGER.debug("Replaced handler for payload type {}", payloadType);
        } else {
            LOGGER.debug("Registered {} handler for payload type {}",
                    handler instanceof RegisteredHandler.Async ? "async" : "sync", payloadType);
        }
        return this;
    }
}
