package io.asap.transport.jsonrpc.handler;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.asap.server.ServerCallContext;
import io.asap.server.handlers.Dispatcher;
import io.asap.spec.ASAPConstants;
import io.asap.spec.ASAPError;
import io.asap.spec.ASAPErrorCodes;
import io.asap.spec.Envelope;
import io.asap.spec.HandlerNotFoundError;
import io.asap.spec.InvalidEnvelopeError;
import io.asap.spec.JSONRPCError;
import io.asap.spec.JSONRPCErrorResponse;
import io.asap.spec.JSONRPCResponse;
import io.asap.spec.RateLimitedError;
import io.asap.spec.SendEnvelopeParams;
import io.asap.spec.ThreadPoolExhaustedError;
import io.asap.transport.jsonrpc.context.JSONRPCContextKeys;
import io.asap.util.Utils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 transport handler for the {@code asap.send} method.
 *
 * <p>Every body handed to {@link #handle(String, ServerCallContext)} produces a well-formed
 * JSON-RPC response, never an exception.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * {
 *   "jsonrpc": "2.0",
 *   "method": "asap.send",
 *   "params": {"envelope": {...}, "idempotency_key": "01HX..."},
 *   "id": "req-1"
 * }
 * }</pre>
 *
 * <h2>Error Handling</h2>
 * <ul>
 *   <li>body is not JSON → {@code -32700}</li>
 *   <li>not a JSON-RPC 2.0 request object → {@code -32600} with {@code validation_errors}</li>
 *   <li>method other than {@code asap.send} → {@code -32601}</li>
 *   <li>missing or invalid envelope → {@code -32602}, tag {@code invalid_envelope}</li>
 *   <li>{@link HandlerNotFoundError} → {@code -32601}, tag {@code handler_not_found}</li>
 *   <li>{@link ThreadPoolExhaustedError} → {@code -32603}, tag {@code thread_pool_exhausted},
 *       sent with HTTP 503 and {@code Retry-After: 1}</li>
 *   <li>{@link RateLimitedError} → {@code -32001}, tag {@code rate_limited}, HTTP 429</li>
 *   <li>any other {@link ASAPError} → {@code -32603} with the error's tag and code in {@code data}</li>
 *   <li>unexpected exceptions → {@code -32603} carrying only the exception message</li>
 * </ul>
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    static final String REJECTED_METRIC = "asap.requests";
    private static final TypeReference<Object> JSON_TYPE_REFERENCE = new TypeReference<>() {};

    private final Dispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    public JSONRPCHandler(Dispatcher dispatcher) {
        this(dispatcher, Metrics.globalRegistry);
    }

    public JSONRPCHandler(Dispatcher dispatcher, MeterRegistry meterRegistry) {
        this.dispatcher = checkNotNullParam("dispatcher", dispatcher);
        this.meterRegistry = checkNotNullParam("meterRegistry", meterRegistry);
    }

    /**
     * Handles one JSON-RPC request body.
     *
     * @param body the raw request body
     * @param context the call context; the method, request id and idempotency key are added to its state
     * @return the response to send, never completed exceptionally
     */
    @SuppressWarnings("unchecked")
    public CompletableFuture<JSONRPCResult> handle(String body, ServerCallContext context) {
        checkNotNullParam("context", context);
        Object json;
        try {
            json = Utils.unmarshalFrom(body == null ? "" : body, JSON_TYPE_REFERENCE);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Rejecting request with unparsable body: {}", e.getOriginalMessage());
            return rejected("parse_error", null,
                    JSONRPCError.fromCode(ASAPErrorCodes.JSON_PARSE_ERROR_CODE, Map.of("error", String.valueOf(e.getOriginalMessage()))));
        }
        if (!(json instanceof Map<?, ?> map)) {
            return rejected("invalid_request", null, JSONRPCError.fromCode(ASAPErrorCodes.INVALID_REQUEST_ERROR_CODE,
                    Map.of("validation_errors", List.of("request must be a JSON object"))));
        }
        return handle((Map<String, Object>) map, context);
    }

    /**
     * Handles one already parsed JSON-RPC request object, e.g. a WebSocket text frame.
     *
     * @param request the request object
     * @param context the call context
     * @return the response to send, never completed exceptionally
     */
    public CompletableFuture<JSONRPCResult> handle(Map<String, Object> request, ServerCallContext context) {
        Object id = requestId(request);
        List<String> validationErrors = validate(request);
        if (!validationErrors.isEmpty()) {
            LOGGER.warn("Rejecting invalid JSON-RPC request {}: {}", id, validationErrors);
            return rejected("invalid_request", id, JSONRPCError.fromCode(ASAPErrorCodes.INVALID_REQUEST_ERROR_CODE,
                    Map.of("validation_errors", validationErrors)));
        }

        String method = (String) request.get("method");
        if (!ASAPConstants.SEND_METHOD.equals(method)) {
            LOGGER.warn("Rejecting request {} for unknown method {}", id, method);
            return rejected("method_not_found", id,
                    JSONRPCError.fromCode(ASAPErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, Map.of("method", method)));
        }

        SendEnvelopeParams params;
        try {
            params = SendEnvelopeParams.fromParams(paramsOf(request));
        } catch (InvalidEnvelopeError e) {
            LOGGER.warn("Rejecting request {} with invalid envelope: {}", id, e.getValidationErrors());
            meterRegistry.counter(REJECTED_METRIC, "payload_type", "unknown", "status", e.getTag()).increment();
            return CompletableFuture.completedFuture(errorResult(id, e));
        }

        Envelope envelope = params.envelope();
        context.getState().put(JSONRPCContextKeys.METHOD_NAME_KEY, method);
        context.getState().put(JSONRPCContextKeys.REQUEST_ID_KEY, id);
        if (params.idempotencyKey() != null) {
            context.getState().put(JSONRPCContextKeys.IDEMPOTENCY_KEY, params.idempotencyKey());
        }
        LOGGER.debug("Received envelope {} ({}) from {} to {}, trace {}", envelope.id(), envelope.payloadType(),
                envelope.sender(), envelope.recipient(), envelope.traceId());

        return dispatcher.dispatch(envelope, context)
                .handle((response, error) -> error == null ? success(id, envelope, response) : errorResult(id, error));
    }

    /**
     * Maps a failure to its JSON-RPC error response.
     *
     * @param id the request id, or {@code null} if unknown
     * @param error the failure
     * @return the response to send
     */
    public JSONRPCResult errorResult(@Nullable Object id, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;

        if (cause instanceof HandlerNotFoundError e) {
            return serialize(200, new JSONRPCErrorResponse(id, JSONRPCError.fromCode(
                    ASAPErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, withMessage(e))), Map.of());
        }
        if (cause instanceof InvalidEnvelopeError e) {
            return serialize(200, new JSONRPCErrorResponse(id, JSONRPCError.fromCode(
                    ASAPErrorCodes.INVALID_PARAMS_ERROR_CODE, withMessage(e))), Map.of());
        }
        if (cause instanceof ThreadPoolExhaustedError e) {
            return serialize(503, new JSONRPCErrorResponse(id, JSONRPCError.fromCode(
                    ASAPErrorCodes.INTERNAL_ERROR_CODE, withMessage(e))), Map.of("Retry-After", "1"));
        }
        if (cause instanceof RateLimitedError e) {
            String retryAfter = String.valueOf((long) Math.max(1, Math.ceil(e.getRetryAfterSeconds())));
            return serialize(429, new JSONRPCErrorResponse(id, new JSONRPCError(ASAPErrorCodes.RATE_LIMITED_ERROR_CODE,
                    "Rate limit exceeded; too many messages per second", e.toErrorData())), Map.of("Retry-After", retryAfter));
        }
        if (cause instanceof ASAPError e) {
            LOGGER.warn("Request {} failed: {}", id, e.getMessage());
            return serialize(200, new JSONRPCErrorResponse(id, JSONRPCError.fromCode(
                    ASAPErrorCodes.INTERNAL_ERROR_CODE, withMessage(e))), Map.of());
        }

        LOGGER.error("Unexpected error handling request {}", id, cause);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", String.valueOf(cause.getMessage()));
        return serialize(200, new JSONRPCErrorResponse(id, JSONRPCError.fromCode(ASAPErrorCodes.INTERNAL_ERROR_CODE, data)),
                Map.of());
    }

    private JSONRPCResult success(Object id, Envelope request, Envelope response) {
        LOGGER.debug("Processed envelope {} ({}), response {}", request.id(), request.payloadType(), response.id());
        return serialize(200, JSONRPCResponse.of(id, response), Map.of());
    }

    private CompletableFuture<JSONRPCResult> rejected(String status, @Nullable Object id, JSONRPCError error) {
        meterRegistry.counter(REJECTED_METRIC, "payload_type", "unknown", "status", status).increment();
        return CompletableFuture.completedFuture(serialize(200, new JSONRPCErrorResponse(id, error), Map.of()));
    }

    private JSONRPCResult serialize(int status, Object response, Map<String, String> headers) {
        try {
            return new JSONRPCResult(status, Utils.toJsonString(response), headers);
        } catch (JsonProcessingException e) {
            LOGGER.error("Unable to serialize JSON-RPC response", e);
            return new JSONRPCResult(200, "{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32603,\"message\":\"Internal error\"},\"id\":null}");
        }
    }

    private static Map<String, Object> withMessage(ASAPError error) {
        Map<String, Object> data = error.toErrorData();
        data.put("error", error.getMessage());
        return data;
    }

    private static @Nullable Object requestId(Map<String, Object> request) {
        Object id = request.get("id");
        return id instanceof String || id instanceof Number ? id : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> paramsOf(Map<String, Object> request) {
        Object params = request.get("params");
        return params instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static List<String> validate(Map<String, Object> request) {
        List<String> errors = new ArrayList<>();
        if (!ASAPConstants.JSONRPC_VERSION.equals(request.get("jsonrpc"))) {
            errors.add("jsonrpc must be \"2.0\"");
        }
        if (!(request.get("method") instanceof String method) || method.isBlank()) {
            errors.add("method must be a non-empty string");
        }
        Object id = request.get("id");
        if (!(id instanceof String) && !(id instanceof Number)) {
            errors.add("id must be a string or a number");
        }
        Object params = request.get("params");
        if (params != null && !(params instanceof Map)) {
            errors.add("params must be an object");
        }
        return errors;
    }
}
