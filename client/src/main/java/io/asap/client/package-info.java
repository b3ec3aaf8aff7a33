@NullMarked
package io.asap.client;

import org.jspecify.annotations.NullMarked;
