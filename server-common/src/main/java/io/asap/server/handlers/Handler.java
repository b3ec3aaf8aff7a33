package io.asap.server.handlers;

import io.asap.server.ServerCallContext;
import io.asap.spec.Envelope;

/**
 * A synchronous handler. The dispatcher runs it on a {@link io.asap.server.executors.BoundedExecutor}
 * thread, so it may block.
 */
@FunctionalInterface
public interface Handler {

    /**
     * @param envelope the request envelope
     * @param context the request context
     * @return the response envelope
     * @throws Exception any failure; {@link io.asap.spec.ASAPError}s keep their kind on the wire
     */
    Envelope handle(Envelope envelope, ServerCallContext context) throws Exception;
}
