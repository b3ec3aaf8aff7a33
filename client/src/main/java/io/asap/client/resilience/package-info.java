@NullMarked
package io.asap.client.resilience;

import org.jspecify.annotations.NullMarked;
