/**
 * Pluggable HTTP client abstraction used by the ASAP client.
 *
 * <ul>
 *   <li>{@link io.asap.client.http.HttpClient} - asynchronous client with a request builder API</li>
 *   <li>{@link io.asap.client.http.HttpClientBuilder} - factory; the default is backed by the JDK client</li>
 *   <li>{@link io.asap.client.http.ManifestResolver} - fetches manifests from the well-known discovery path</li>
 * </ul>
 */
@NullMarked
package io.asap.client.http;

import org.jspecify.annotations.NullMarked;
