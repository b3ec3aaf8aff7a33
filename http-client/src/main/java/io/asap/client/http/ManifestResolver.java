package io.asap.client.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.asap.spec.ASAPConnectionError;
import io.asap.spec.ASAPConstants;
import io.asap.spec.Manifest;
import io.asap.spec.ManifestValidationError;
import org.jspecify.annotations.Nullable;

/**
 * Fetches the manifest of an agent from its well-known discovery path.
 */
public class ManifestResolver {
    private final HttpClient httpClient;
    private final @Nullable Map<String, String> authHeaders;
    private final String manifestPath;
    private @Nullable Duration timeout;

    /**
     * @param baseUrl the base URL of the agent; a path component is kept as prefix of the discovery path
     * @throws IllegalArgumentException if the URL is invalid
     */
    public ManifestResolver(String baseUrl) {
        this(HttpClient.createHttpClient(baseUrl), pathOf(baseUrl), null);
    }

    ManifestResolver(HttpClient httpClient) {
        this(httpClient, null, null);
    }

    /**
     * @param httpClient the http client to use
     * @param manifestPath optional path to the manifest relative to the agent host,
     *                     defaults to {@value ASAPConstants#MANIFEST_PATH}
     * @param authHeaders the HTTP authentication headers to use. May be {@code null}
     */
    public ManifestResolver(HttpClient httpClient, @Nullable String manifestPath,
                            @Nullable Map<String, String> authHeaders) {
        this.httpClient = httpClient;
        if (manifestPath == null || manifestPath.isEmpty()) {
            this.manifestPath = ASAPConstants.MANIFEST_PATH;
        } else if (manifestPath.endsWith(ASAPConstants.MANIFEST_PATH)) {
            this.manifestPath = manifestPath;
        } else {
            this.manifestPath = manifestPath + ASAPConstants.MANIFEST_PATH;
        }
        this.authHeaders = authHeaders;
    }

    public ManifestResolver timeout(@Nullable Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public String getManifestPath() {
        return manifestPath;
    }

    /**
     * Fetches the manifest.
     *
     * @return the manifest and the caching directives of the response. The future fails with
     *         {@link ASAPConnectionError} on a transport failure or an error status, and with
     *         {@link ManifestValidationError} if the body is not a valid manifest.
     */
    public CompletableFuture<ResolvedManifest> resolve() {
        HttpClient.GetRequestBuilder builder = httpClient.get(manifestPath)
                .addHeader("Accept", "application/json")
                .timeout(timeout);
        if (authHeaders != null) {
            builder.addHeaders(authHeaders);
        }

        return builder.send()
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new ASAPConnectionError("Failed to obtain manifest from " + manifestPath, cause);
                    }
                    if (!response.success()) {
                        throw new ASAPConnectionError(response.statusCode(),
                                "Failed to obtain manifest: " + response.statusCode(), false, null);
                    }
                    return ResolvedManifest.of(Manifest.fromJson(response.body()), response);
                });
    }

    /**
     * Blocking variant of {@link #resolve()}.
     *
     * @return the manifest
     * @throws ASAPConnectionError if an HTTP error occurs fetching the manifest
     * @throws ManifestValidationError if the response body is not a valid manifest
     */
    public Manifest getManifest() {
        try {
            return resolve().get().manifest();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ASAPConnectionError("Interrupted while obtaining manifest", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ASAPConnectionError("Failed to obtain manifest", e.getCause());
        }
    }

    private static String pathOf(String baseUrl) {
        try {
            String path = new URI(baseUrl).getPath();
            if (path == null) {
                return "";
            }
            return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid agent URL: " + baseUrl, e);
        }
    }
}
