@NullMarked
package io.asap.server.ratelimit;

import org.jspecify.annotations.NullMarked;
