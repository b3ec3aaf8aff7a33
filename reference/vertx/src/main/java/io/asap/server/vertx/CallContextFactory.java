package io.asap.server.vertx;

import io.asap.server.ServerCallContext;
import io.vertx.ext.web.RoutingContext;

/**
 * Builds the {@link ServerCallContext} of an HTTP request or WebSocket upgrade.
 *
 * <p>When none is configured, {@link ASAPServer} records the request headers under
 * {@link ServerCallContext#HEADERS_KEY} and the transport name under
 * {@link ServerCallContext#TRANSPORT_KEY}. Applications provide their own factory to add data
 * their interceptors and handlers need:
 *
 * <pre>{@code
 * CallContextFactory factory = rc -> {
 *     Map<String, Object> state = new HashMap<>();
 *     state.put("organization", rc.request().getHeader("X-Organization-ID"));
 *     return new ServerCallContext(manifest, state);
 * };
 * }</pre>
 */
@FunctionalInterface
public interface CallContextFactory {

    /**
     * @param rc the Vert.x routing context of the request
     * @return a new context for the request
     */
    ServerCallContext build(RoutingContext rc);
}
