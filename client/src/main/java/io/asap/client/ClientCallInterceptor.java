package io.asap.client;

import java.util.Map;

import io.asap.spec.Envelope;

/**
 * Hook invoked before each outbound attempt. Authentication collaborators use it to attach
 * credentials without the client inspecting them.
 */
public interface ClientCallInterceptor {

    /**
     * @param methodName the JSON-RPC method
     * @param envelope the envelope being sent
     * @param headers the request headers so far
     * @return the headers to send; may be the given map
     */
    Map<String, String> intercept(String methodName, Envelope envelope, Map<String, String> headers);
}
