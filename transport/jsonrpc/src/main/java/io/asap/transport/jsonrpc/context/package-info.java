@NullMarked
package io.asap.transport.jsonrpc.context;

import org.jspecify.annotations.NullMarked;
