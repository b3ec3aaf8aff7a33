/**
 * JSON-RPC 2.0 binding of the ASAP server: turns request bodies into dispatches and every
 * outcome into a well-formed JSON-RPC response.
 */
@NullMarked
package io.asap.transport.jsonrpc.handler;

import org.jspecify.annotations.NullMarked;
