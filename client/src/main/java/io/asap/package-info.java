@NullMarked
package io.asap;

import org.jspecify.annotations.NullMarked;
