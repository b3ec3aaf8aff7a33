package io.asap.server.handlers;

import java.util.concurrent.CompletableFuture;

import io.asap.server.ServerCallContext;
import io.asap.spec.Envelope;

/**
 * A non-blocking handler. It is invoked on the calling thread, typically the server's event
 * loop, and must not block it.
 */
@FunctionalInterface
public interface AsyncHandler {

    CompletableFuture<Envelope> handle(Envelope envelope, ServerCallContext context);
}
