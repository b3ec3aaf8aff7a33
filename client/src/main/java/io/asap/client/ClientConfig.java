package io.asap.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import io.asap.client.discovery.ManifestCache;
import io.asap.client.http.HttpClientBuilder;
import io.asap.client.resilience.CircuitBreaker;
import io.asap.client.resilience.CircuitBreakerRegistry;
import io.asap.client.resilience.RetryPolicy;
import io.asap.util.Assert;

/**
 * Immutable configuration of an {@link ASAPClient}.
 * <p>
 * The breaker registry and the manifest cache are shared collaborators: give every client of an
 * application the same instances so breaker state and discovered manifests are shared too.
 */
public final class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClientBuilder httpClientBuilder;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final int circuitBreakerThreshold;
    private final Duration circuitBreakerTimeout;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ManifestCache manifestCache;
    private final List<ClientCallInterceptor> interceptors;

    private ClientConfig(Builder builder) {
        this.httpClientBuilder = builder.httpClientBuilder;
        this.timeout = builder.timeout;
        this.retryPolicy = new RetryPolicy(builder.baseDelay, builder.maxDelay, builder.jitter, builder.maxRetries);
        this.circuitBreakerThreshold = builder.circuitBreakerThreshold;
        this.circuitBreakerTimeout = builder.circuitBreakerTimeout;
        this.circuitBreakerRegistry = builder.circuitBreakerRegistry;
        this.manifestCache = builder.manifestCache;
        this.interceptors = List.copyOf(builder.interceptors);
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    /**
     * @return time allowed for each attempt, until the response headers arrive
     */
    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public Duration getCircuitBreakerTimeout() {
        return circuitBreakerTimeout;
    }

    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }

    public ManifestCache getManifestCache() {
        return manifestCache;
    }

    public List<ClientCallInterceptor> getInterceptors() {
        return interceptors;
    }

    public static class Builder {
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
        private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
        private boolean jitter = true;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
        private int circuitBreakerThreshold = CircuitBreaker.DEFAULT_THRESHOLD;
        private Duration circuitBreakerTimeout = CircuitBreaker.DEFAULT_TIMEOUT;
        private CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.defaultRegistry();
        private ManifestCache manifestCache = ManifestCache.defaultCache();
        private final List<ClientCallInterceptor> interceptors = new ArrayList<>();

        private Builder() {
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Assert.checkNotNullParam("timeout", timeout);
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Assert.checkNotNullParam("baseDelay", baseDelay);
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Assert.checkNotNullParam("maxDelay", maxDelay);
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * @param maxRetries total number of attempts per call, including the first one
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = Assert.checkMinimumParam("maxRetries", 1, maxRetries);
            return this;
        }

        public Builder circuitBreakerThreshold(int threshold) {
            this.circuitBreakerThreshold = Assert.checkMinimumParam("threshold", 1, threshold);
            return this;
        }

        public Builder circuitBreakerTimeout(Duration timeout) {
            this.circuitBreakerTimeout = Assert.checkNotNullParam("timeout", timeout);
            return this;
        }

        public Builder circuitBreakerRegistry(CircuitBreakerRegistry registry) {
            this.circuitBreakerRegistry = Assert.checkNotNullParam("registry", registry);
            return this;
        }

        public Builder manifestCache(ManifestCache manifestCache) {
            this.manifestCache = Assert.checkNotNullParam("manifestCache", manifestCache);
            return this;
        }

        public Builder addInterceptor(ClientCallInterceptor interceptor) {
            this.interceptors.add(Assert.checkNotNullParam("interceptor", interceptor));
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
