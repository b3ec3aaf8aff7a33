@NullMarked
package io.asap.client.http.jdk;

import org.jspecify.annotations.NullMarked;
