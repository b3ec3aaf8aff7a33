@NullMarked
package io.asap.server;

import org.jspecify.annotations.NullMarked;
