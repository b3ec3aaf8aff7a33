package io.asap.server.handlers;

import static io.asap.util.Assert.checkNotNullParam;

/**
 * A handler as stored in the {@link HandlerRegistry}, tagged with how it must be invoked.
 */
public sealed interface RegisteredHandler permits RegisteredHandler.Sync, RegisteredHandler.Async {

    record Sync(Handler handler) implements RegisteredHandler {
        public Sync {
            checkNotNullParam("handler", handler);
        }
    }

    record Async(AsyncHandler handler) implements RegisteredHandler {
        public Async {
            checkNotNullParam("handler", handler);
        }
    }
}
