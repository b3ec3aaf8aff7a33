@NullMarked
package io.asap.client.discovery;

import org.jspecify.annotations.NullMarked;
