@NullMarked
package io.asap.server.handlers;

import org.jspecify.annotations.NullMarked;
