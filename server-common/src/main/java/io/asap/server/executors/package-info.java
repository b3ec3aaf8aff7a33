@NullMarked
package io.asap.server.executors;

import org.jspecify.annotations.NullMarked;
