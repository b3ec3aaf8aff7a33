/**
 * Vert.x Web binding of the ASAP server: the JSON-RPC endpoint, manifest discovery and the
 * WebSocket endpoint.
 */
@NullMarked
package io.asap.server.vertx;

import org.jspecify.annotations.NullMarked;
