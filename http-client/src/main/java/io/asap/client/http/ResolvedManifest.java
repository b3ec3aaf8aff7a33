package io.asap.client.http;

import java.time.Duration;
import java.util.Locale;

import io.asap.spec.Manifest;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A manifest fetched from an agent together with the caching directives of the response.
 *
 * @param manifest the manifest
 * @param etag the {@code ETag} of the response, if any
 * @param maxAge the {@code Cache-Control: max-age} of the response, if any
 * @param cacheable {@code false} when the response carries {@code no-store} or {@code no-cache}
 */
public record ResolvedManifest(Manifest manifest, @Nullable String etag, @Nullable Duration maxAge, boolean cacheable) {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResolvedManifest.class);

    /**
     * Parses the caching directives of a manifest response.
     *
     * @param manifest the manifest read from the body
     * @param response the response
     * @return the resolved manifest
     */
    static ResolvedManifest of(Manifest manifest, HttpResponse response) {
        Duration maxAge = null;
        boolean cacheable = true;
        String cacheControl = response.header("Cache-Control").orElse("");
        for (String directive : cacheControl.split(",")) {
            String d = directive.trim().toLowerCase(Locale.ROOT);
            if (d.equals("no-store") || d.equals("no-cache")) {
                cacheable = false;
            } else if (d.startsWith("max-age=")) {
                try {
                    maxAge = Duration.ofSeconds(Long.parseLong(d.substring("max-age=".length()).trim()));
                } catch (NumberFormatException e) {
                    LOGGER.debug("Ignoring malformed Cache-Control directive '{}'", directive);
                }
            }
        }
        return new ResolvedManifest(manifest, response.header("ETag").orElse(null), maxAge, cacheable);
    }
}
