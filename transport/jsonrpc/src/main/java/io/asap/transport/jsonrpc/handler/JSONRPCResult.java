package io.asap.transport.jsonrpc.handler;

import static io.asap.util.Assert.checkNotNullParam;

import java.util.Map;

/**
 * A serialized JSON-RPC response together with the HTTP status and extra headers it should be
 * sent with.
 *
 * @param statusCode the HTTP status, 200 unless the request was rejected for load
 * @param body the JSON-RPC response body
 * @param headers additional response headers, e.g. {@code Retry-After}
 */
public record JSONRPCResult(int statusCode, String body, Map<String, String> headers) {

    public JSONRPCResult {
        checkNotNullParam("body", body);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public JSONRPCResult(int statusCode, String body) {
        this(statusCode, body, Map.of());
    }
}
