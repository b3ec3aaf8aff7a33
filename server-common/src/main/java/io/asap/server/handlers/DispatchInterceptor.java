package io.asap.server.handlers;

import io.asap.server.ServerCallContext;
import io.asap.spec.Envelope;

/**
 * Hook around every dispatch, used by authentication and signature collaborators.
 * <p>
 * Throwing an {@link io.asap.spec.ASAPError} from {@link #beforeDispatch} rejects the request;
 * the transport turns it into a JSON-RPC error.
 */
public interface DispatchInterceptor {

    /**
     * Called before the handler runs.
     *
     * @param envelope the request envelope
     * @param context the request context; interceptors may add state for handlers
     */
    default void beforeDispatch(Envelope envelope, ServerCallContext context) {
    }

    /**
     * Called with the response before it is returned to the transport.
     *
     * @param request the request envelope
     * @param response the handler's response
     * @param context the request context
     * @return the response to send
     */
    default Envelope afterDispatch(Envelope request, Envelope response, ServerCallContext context) {
        return response;
    }
}
