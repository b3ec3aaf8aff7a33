package io.asap.server;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import io.asap.spec.Manifest;
import org.jspecify.annotations.Nullable;

/**
 * Per-request context handed to handlers and dispatch interceptors.
 * <p>
 * The transport fills the state with what it knows about the request, e.g. the request
 * headers under {@link #HEADERS_KEY}. Interceptors may add entries for handlers to read,
 * such as an authenticated principal.
 */
public class ServerCallContext {

    public static final String HEADERS_KEY = "headers";
    public static final String TRANSPORT_KEY = "transport";

    private final @Nullable Manifest manifest;
    private final Map<String, Object> state;

    public ServerCallContext() {
        this(null, new HashMap<>());
    }

    public ServerCallContext(@Nullable Manifest manifest, Map<String, Object> state) {
        this.manifest = manifest;
        this.state = state;
    }

    /**
     * @return the manifest of the serving agent, if the server was configured with one
     */
    public @Nullable Manifest getManifest() {
        return manifest;
    }

    public Map<String, Object> getState() {
        return state;
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable T get(String key) {
        return (T) state.get(key);
    }

    /**
     * @return the request headers recorded by the transport, or an empty map
     */
    @SuppressWarnings("unchecked")
    public Map<String, String> getHeaders() {
        Object headers = state.get(HEADERS_KEY);
        return headers instanceof Map<?, ?> map ? (Map<String, String>) map : Collections.emptyMap();
    }
}
