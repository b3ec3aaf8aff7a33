package io.asap.client.discovery;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import io.asap.client.http.HttpClient;
import io.asap.client.http.HttpClientBuilder;
import io.asap.client.http.ManifestResolver;
import io.asap.client.http.ResolvedManifest;
import io.asap.spec.ASAPConstants;
import io.asap.spec.Manifest;
import io.asap.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves agent manifests through a {@link ManifestCache}.
 * <p>
 * The {@code max-age} of the discovery response is used as the entry's time to live when
 * present; responses marked {@code no-store} or {@code no-cache} are not cached.
 */
public class ManifestDiscovery {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestDiscovery.class);

    private final ManifestCache cache;
    private final HttpClientBuilder httpClientBuilder;
    // one HTTP client per agent, keyed by discovery URL
    private final Map<String, HttpClient> httpClients = new ConcurrentHashMap<>();

    public ManifestDiscovery(ManifestCache cache) {
        this(cache, HttpClientBuilder.DEFAULT_FACTORY);
    }

    public ManifestDiscovery(ManifestCache cache, HttpClientBuilder httpClientBuilder) {
        this.cache = Assert.checkNotNullParam("cache", cache);
        this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
    }

    /**
     * @param baseUrl the agent base URL
     * @return the manifest, from the cache when a valid entry exists
     */
    public CompletableFuture<Manifest> discover(String baseUrl) {
        return discover(baseUrl, null);
    }

    public CompletableFuture<Manifest> discover(String baseUrl, @Nullable Map<String, String> authHeaders) {
        String url = discoveryUrl(baseUrl);
        Manifest cached = cache.get(url);
        if (cached != null) {
            LOGGER.debug("Manifest for {} served from cache", url);
            return CompletableFuture.completedFuture(cached);
        }

        HttpClient httpClient = httpClients.computeIfAbsent(url, key -> httpClientBuilder.create(baseUrl));
        ManifestResolver resolver = new ManifestResolver(httpClient, URI.create(url).getRawPath(), authHeaders);
        return resolver.resolve().thenApply(resolved -> store(url, resolved));
    }

    public ManifestCache getCache() {
        return cache;
    }

    private Manifest store(String url, ResolvedManifest resolved) {
        if (resolved.cacheable()) {
            cache.set(url, resolved.manifest(), resolved.maxAge(), resolved.etag());
        } else {
            LOGGER.debug("Manifest for {} is not cacheable", url);
        }
        return resolved.manifest();
    }

    /**
     * @param baseUrl the agent base URL
     * @return the well-known manifest URL of the agent, used as cache key
     */
    public static String discoveryUrl(String baseUrl) {
        Assert.checkNotBlankParam("baseUrl", baseUrl);
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base.endsWith(ASAPConstants.MANIFEST_PATH) ? base : base + ASAPConstants.MANIFEST_PATH;
    }
}
