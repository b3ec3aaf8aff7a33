package io.asap.transport.jsonrpc.context;

/**
 * Keys under which the JSON-RPC transport records request data in
 * {@link io.asap.server.ServerCallContext#getState()}.
 *
 * <pre>{@code
 * public Envelope handle(Envelope envelope, ServerCallContext context) {
 *     String idempotencyKey = context.get(JSONRPCContextKeys.IDEMPOTENCY_KEY);
 *     ...
 * }
 * }</pre>
 */
public final class JSONRPCContextKeys {

    /**
     * Context key for the JSON-RPC method being called.
     */
    public static final String METHOD_NAME_KEY = "method";

    /**
     * Context key for the JSON-RPC request id.
     */
    public static final String REQUEST_ID_KEY = "jsonrpc_id";

    /**
     * Context key for the caller's idempotency key, when the request carried one.
     */
    public static final String IDEMPOTENCY_KEY = "idempotency_key";

    private JSONRPCContextKeys() {
        // Utility class
    }
}
