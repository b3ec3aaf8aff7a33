package io.asap.spec;

import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.asap.util.Utils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JSONRPCTest {

    private final Envelope envelope = Envelope.builder()
            .sender("urn:asap:agent:a")
            .recipient("urn:asap:agent:b")
            .payloadType(PayloadType.TASK_REQUEST)
            .payload(Map.of("input", "x"))
            .build();

    @Test
    public void testStandardMessages() {
        assertEquals("Parse error", JSONRPCError.fromCode(ASAPErrorCodes.JSON_PARSE_ERROR_CODE, null).message());
        assertEquals("Invalid request", JSONRPCError.standardMessage(-32600));
        assertEquals("Method not found", JSONRPCError.standardMessage(-32601));
        assertEquals("Invalid params", JSONRPCError.standardMessage(-32602));
        assertEquals("Internal error", JSONRPCError.standardMessage(-32603));
        assertEquals("Unknown error", JSONRPCError.standardMessage(42));
    }

    @Test
    public void testSendRequestSerialization() throws Exception {
        JSONRPCRequest request = JSONRPCRequest.send("req-1", new SendEnvelopeParams(envelope, "key-1"));

        Map<String, Object> json = Utils.unmarshalFrom(Utils.toJsonString(request), new TypeReference<>() {});

        assertEquals("2.0", json.get("jsonrpc"));
        assertEquals("asap.send", json.get("method"));
        assertEquals("req-1", json.get("id"));
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) json.get("params");
        assertEquals("key-1", params.get("idempotency_key"));

        SendEnvelopeParams parsed = SendEnvelopeParams.fromParams(params);
        assertEquals(envelope, parsed.envelope());
        assertEquals("key-1", parsed.idempotencyKey());
    }

    @Test
    public void testRequestRejectsWrongVersion() {
        assertThrows(IllegalArgumentException.class, () -> new JSONRPCRequest("1.0", "asap.send", Map.of(), "1"));
        assertThrows(IllegalArgumentException.class, () -> new JSONRPCRequest("2.0", "asap.send", Map.of(), new Object()));
    }

    @Test
    public void testErrorResponseWritesNullId() throws Exception {
        JSONRPCErrorResponse response = new JSONRPCErrorResponse(null,
                JSONRPCError.fromCode(ASAPErrorCodes.JSON_PARSE_ERROR_CODE, null));

        String json = Utils.toJsonString(response);

        assertTrue(json.contains("\"id\":null"), json);
        assertFalse(json.contains("\"data\""), json);
    }

    @Test
    public void testMissingEnvelopeInParams() {
        InvalidEnvelopeError error = assertThrows(InvalidEnvelopeError.class,
                () -> SendEnvelopeParams.fromParams(Map.of("idempotency_key", "k")));
        assertEquals("Missing 'envelope' in params", error.getValidationErrors().get(0));
    }

    @Test
    public void testErrorTag() {
        JSONRPCError error = JSONRPCError.fromCode(ASAPErrorCodes.INTERNAL_ERROR_CODE,
                new ThreadPoolExhaustedError(4, 4).toErrorData());

        assertEquals(ASAPErrorTags.THREAD_POOL_EXHAUSTED, error.tag());
        assertEquals(4, error.data().get("max_threads"));
        assertNull(JSONRPCError.fromCode(-32600, null).tag());
    }

    @Test
    public void testRemoteErrorRetryability() {
        assertTrue(new ASAPRemoteError(-32603, "Internal error", null).isRetryable());
        assertTrue(new ASAPRemoteError(-32603, "Internal error",
                Map.of("tag", ASAPErrorTags.THREAD_POOL_EXHAUSTED)).isRetryable());
        assertFalse(new ASAPRemoteError(-32601, "Method not found",
                Map.of("tag", ASAPErrorTags.HANDLER_NOT_FOUND)).isRetryable());
        assertFalse(new ASAPRemoteError(-32602, "Invalid params", null).isRetryable());
        assertFalse(new CircuitOpenError("http://a", 3).isRetryable());
    }
}
