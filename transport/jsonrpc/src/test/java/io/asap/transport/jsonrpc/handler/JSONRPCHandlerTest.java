package io.asap.transport.jsonrpc.handler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.fasterxml.jackson.core.type.TypeReference;
import io.asap.server.ServerCallContext;
import io.asap.server.executors.BoundedExecutor;
import io.asap.server.handlers.Dispatcher;
import io.asap.server.handlers.HandlerRegistry;
import io.asap.spec.ASAPError;
import io.asap.spec.Envelope;
import io.asap.spec.JSONRPCRequest;
import io.asap.spec.PayloadType;
import io.asap.spec.RateLimitedError;
import io.asap.spec.SendEnvelopeParams;
import io.asap.spec.ThreadPoolExhaustedError;
import io.asap.transport.jsonrpc.context.JSONRPCContextKeys;
import io.asap.util.Utils;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JSONRPCHandlerTest {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

    private SimpleMeterRegistry meterRegistry;
    private BoundedExecutor executor;
    private JSONRPCHandler handler;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = new BoundedExecutor(2, meterRegistry);
        Dispatcher dispatcher = new Dispatcher(HandlerRegistry.createDefault(), executor, List.of(), meterRegistry);
        handler = new JSONRPCHandler(dispatcher, meterRegistry);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdown(false);
    }

    private static Envelope taskRequest() {
        return Envelope.builder()
                .sender("urn:asap:agent:caller")
                .recipient("urn:asap:agent:echo-agent")
                .payloadType(PayloadType.TASK_REQUEST)
                .payload(Map.of("conversation_id", "conv-1", "skill_id", "echo", "input", Map.of("message", "hi")))
                .build();
    }

    private static String sendBody(Object id, Map<String, Object> envelope) throws Exception {
        return Utils.toJsonString(Map.of("jsonrpc", "2.0", "method", "asap.send",
                "params", Map.of("envelope", envelope, "idempotency_key", "key-1"), "id", id));
    }

    private static Map<String, Object> json(JSONRPCResult result) throws Exception {
        return Utils.unmarshalFrom(result.body(), MAP_TYPE_REFERENCE);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> error(Map<String, Object> response) {
        return (Map<String, Object>) response.get("error");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> errorData(Map<String, Object> response) {
        return (Map<String, Object>) error(response).get("data");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testSendReturnsResponseEnvelope() throws Exception {
        Envelope request = taskRequest();
        ServerCallContext context = new ServerCallContext();
        String body = Utils.toJsonString(JSONRPCRequest.send("req-1", new SendEnvelopeParams(request, "key-1")));

        JSONRPCResult result = handler.handle(body, context).join();

        assertEquals(200, result.statusCode());
        Map<String, Object> response = json(result);
        assertEquals("2.0", response.get("jsonrpc"));
        assertEquals("req-1", response.get("id"));
        Envelope envelope = Envelope.fromMap((Map<String, Object>) ((Map<String, Object>) response.get("result")).get("envelope"));
        assertEquals("task.response", envelope.payloadType());
        assertEquals(request.id(), envelope.correlationId());
        assertEquals("key-1", context.get(JSONRPCContextKeys.IDEMPOTENCY_KEY));
        assertEquals("asap.send", context.get(JSONRPCContextKeys.METHOD_NAME_KEY));
    }

    @Test
    public void testNumericIdIsEchoed() throws Exception {
        JSONRPCResult result = handler.handle(sendBody(7, taskRequest().toMap()), new ServerCallContext()).join();

        assertEquals(7, json(result).get("id"));
    }

    @Test
    public void testParseError() throws Exception {
        JSONRPCResult result = handler.handle("{not json", new ServerCallContext()).join();

        assertEquals(200, result.statusCode());
        Map<String, Object> response = json(result);
        assertEquals(-32700, error(response).get("code"));
        assertEquals("Parse error", error(response).get("message"));
        assertTrue(response.containsKey("id"));
        assertNull(response.get("id"));
        assertEquals(1.0, meterRegistry.counter(JSONRPCHandler.REJECTED_METRIC,
                "payload_type", "unknown", "status", "parse_error").count());
    }

    @Test
    public void testNonObjectBodyIsInvalidRequest() throws Exception {
        JSONRPCResult result = handler.handle("[1, 2]", new ServerCallContext()).join();

        assertEquals(-32600, error(json(result)).get("code"));
    }

    @Test
    public void testWrongVersionIsInvalidRequest() throws Exception {
        String body = "{\"jsonrpc\": \"1.0\", \"method\": \"asap.send\", \"params\": {}, \"id\": \"req-9\"}";

        Map<String, Object> response = json(handler.handle(body, new ServerCallContext()).join());

        assertEquals(-32600, error(response).get("code"));
        assertEquals("req-9", response.get("id"));
        assertEquals(List.of("jsonrpc must be \"2.0\""), errorData(response).get("validation_errors"));
    }

    @Test
    public void testMissingIdAndNonObjectParams() throws Exception {
        String body = "{\"jsonrpc\": \"2.0\", \"method\": \"asap.send\", \"params\": [1]}";

        Map<String, Object> response = json(handler.handle(body, new ServerCallContext()).join());

        assertEquals(-32600, error(response).get("code"));
        assertEquals(List.of("id must be a string or a number", "params must be an object"),
                errorData(response).get("validation_errors"));
    }

    @Test
    public void testUnknownMethod() throws Exception {
        String body = "{\"jsonrpc\": \"2.0\", \"method\": \"asap.receive\", \"params\": {}, \"id\": \"req-2\"}";

        Map<String, Object> response = json(handler.handle(body, new ServerCallContext()).join());

        assertEquals(-32601, error(response).get("code"));
        assertEquals("asap.receive", errorData(response).get("method"));
        assertEquals("req-2", response.get("id"));
    }

    @Test
    public void testMissingEnvelope() throws Exception {
        String body = "{\"jsonrpc\": \"2.0\", \"method\": \"asap.send\", \"params\": {}, \"id\": \"req-3\"}";

        Map<String, Object> response = json(handler.handle(body, new ServerCallContext()).join());

        assertEquals(-32602, error(response).get("code"));
        assertEquals("invalid_envelope", errorData(response).get("tag"));
        assertEquals(List.of("Missing 'envelope' in params"), errorData(response).get("validation_errors"));
    }

    @Test
    public void testInvalidEnvelope() throws Exception {
        Map<String, Object> envelope = new java.util.HashMap<>(taskRequest().toMap());
        envelope.put("sender", "not-a-urn");

        Map<String, Object> response = json(handler.handle(sendBody("req-4", envelope), new ServerCallContext()).join());

        assertEquals(-32602, error(response).get("code"));
        assertEquals("invalid_envelope", errorData(response).get("tag"));
        assertFalse(((List<?>) errorData(response).get("validation_errors")).isEmpty());
    }

    @Test
    public void testHandlerNotFound() throws Exception {
        Map<String, Object> envelope = new java.util.HashMap<>(taskRequest().toMap());
        envelope.put("payload_type", "custom.unknown");

        Map<String, Object> response = json(handler.handle(sendBody("req-5", envelope), new ServerCallContext()).join());

        assertEquals(-32601, error(response).get("code"));
        assertEquals("handler_not_found", errorData(response).get("tag"));
        assertEquals("custom.unknown", errorData(response).get("payload_type"));
    }

    @Test
    public void testThreadPoolExhaustedIsServiceUnavailable() throws Exception {
        Dispatcher dispatcher = mock(Dispatcher.class);
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ThreadPoolExhaustedError(4, 4)));
        JSONRPCHandler busy = new JSONRPCHandler(dispatcher, meterRegistry);

        JSONRPCResult result = busy.handle(sendBody("req-6", taskRequest().toMap()), new ServerCallContext()).join();

        assertEquals(503, result.statusCode());
        assertEquals("1", result.headers().get("Retry-After"));
        Map<String, Object> response = json(result);
        assertEquals(-32603, error(response).get("code"));
        assertEquals("thread_pool_exhausted", errorData(response).get("tag"));
        assertEquals(4, errorData(response).get("max_threads"));
        assertEquals("req-6", response.get("id"));
    }

    @Test
    public void testOtherASAPErrorKeepsItsCode() throws Exception {
        Dispatcher dispatcher = mock(Dispatcher.class);
        when(dispatcher.dispatch(any(), any())).thenReturn(CompletableFuture.failedFuture(
                new ASAPError("asap:auth/unauthorized", "unauthorized", "Missing credentials", null)));
        JSONRPCHandler rejecting = new JSONRPCHandler(dispatcher, meterRegistry);

        Map<String, Object> response = json(rejecting.handle(sendBody("req-7", taskRequest().toMap()),
                new ServerCallContext()).join());

        assertEquals(-32603, error(response).get("code"));
        assertEquals("unauthorized", errorData(response).get("tag"));
        assertEquals("asap:auth/unauthorized", errorData(response).get("code"));
    }

    @Test
    public void testUnexpectedErrorCarriesOnlyMessage() throws Exception {
        Dispatcher dispatcher = mock(Dispatcher.class);
        when(dispatcher.dispatch(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("database down")));
        JSONRPCHandler failing = new JSONRPCHandler(dispatcher, meterRegistry);

        JSONRPCResult result = failing.handle(sendBody("req-8", taskRequest().toMap()), new ServerCallContext()).join();

        assertEquals(200, result.statusCode());
        Map<String, Object> response = json(result);
        assertEquals(-32603, error(response).get("code"));
        assertEquals("Internal error", error(response).get("message"));
        assertEquals(Map.of("error", "database down"), errorData(response));
    }

    @Test
    public void testRateLimitedResult() throws Exception {
        JSONRPCResult result = handler.errorResult("req-10", new RateLimitedError(0.3));

        assertEquals(429, result.statusCode());
        assertEquals("1", result.headers().get("Retry-After"));
        Map<String, Object> response = json(result);
        assertEquals(-32001, error(response).get("code"));
        assertEquals("rate_limited", errorData(response).get("tag"));
    }
}
