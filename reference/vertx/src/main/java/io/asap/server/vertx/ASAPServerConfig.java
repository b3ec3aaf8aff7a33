package io.asap.server.vertx;

import java.time.Duration;
import java.util.Properties;

import io.asap.server.executors.BoundedExecutor;
import io.asap.server.ratelimit.TokenBucket;
import io.asap.spec.ASAPConstants;
import io.asap.util.Assert;

/**
 * Immutable settings of an {@link ASAPServer}.
 * <p>
 * {@link #fromProperties(Properties)} reads the same settings from {@code asap.server.*} keys:
 * <pre>
 * asap.server.host=0.0.0.0
 * asap.server.port=8000
 * asap.server.max-threads=16
 * asap.server.manifest-max-age=300
 * asap.server.websocket-rate=10
 * asap.server.max-request-size=10485760
 * </pre>
 */
public final class ASAPServerConfig {

    public static final String PROPERTY_PREFIX = "asap.server.";

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8000;
    public static final Duration DEFAULT_MANIFEST_MAX_AGE = Duration.ofSeconds(300);

    private final String host;
    private final int port;
    private final int maxThreads;
    private final Duration manifestMaxAge;
    private final double webSocketMessageRate;
    private final long maxRequestSize;

    private ASAPServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.maxThreads = builder.maxThreads;
        this.manifestMaxAge = builder.manifestMaxAge;
        this.webSocketMessageRate = builder.webSocketMessageRate;
        this.maxRequestSize = builder.maxRequestSize;
    }

    public static ASAPServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from {@code asap.server.*} properties. Missing keys keep their defaults.
     *
     * @param properties the properties, e.g. {@link System#getProperties()}
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ASAPServerConfig fromProperties(Properties properties) {
        Assert.checkNotNullParam("properties", properties);
        Builder builder = builder();
        String host = properties.getProperty(PROPERTY_PREFIX + "host");
        if (host != null) {
            builder.host(host.trim());
        }
        String port = properties.getProperty(PROPERTY_PREFIX + "port");
        if (port != null) {
            builder.port(parseInt("port", port));
        }
        String maxThreads = properties.getProperty(PROPERTY_PREFIX + "max-threads");
        if (maxThreads != null) {
            builder.maxThreads(parseInt("max-threads", maxThreads));
        }
        String maxAge = properties.getProperty(PROPERTY_PREFIX + "manifest-max-age");
        if (maxAge != null) {
            builder.manifestMaxAge(Duration.ofSeconds(parseInt("manifest-max-age", maxAge)));
        }
        String rate = properties.getProperty(PROPERTY_PREFIX + "websocket-rate");
        if (rate != null) {
            try {
                builder.webSocketMessageRate(Double.parseDouble(rate.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + "websocket-rate: " + rate, e);
            }
        }
        String maxRequestSize = properties.getProperty(PROPERTY_PREFIX + "max-request-size");
        if (maxRequestSize != null) {
            builder.maxRequestSize(parseInt("max-request-size", maxRequestSize));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    public String getHost() {
        return host;
    }

    /**
     * @return the listening port; 0 picks an ephemeral port
     */
    public int getPort() {
        return port;
    }

    public int getMaxThreads() {
        return maxThreads;
    }

    public Duration getManifestMaxAge() {
        return manifestMaxAge;
    }

    /**
     * @return messages per second allowed on each WebSocket connection; 0 disables the limit
     */
    public double getWebSocketMessageRate() {
        return webSocketMessageRate;
    }

    public long getMaxRequestSize() {
        return maxRequestSize;
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private int maxThreads = BoundedExecutor.defaultMaxThreads();
        private Duration manifestMaxAge = DEFAULT_MANIFEST_MAX_AGE;
        private double webSocketMessageRate = TokenBucket.DEFAULT_MESSAGES_PER_SECOND;
        private long maxRequestSize = ASAPConstants.MAX_REQUEST_SIZE;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = Assert.checkNotBlankParam("host", host);
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535, got " + port);
            }
            this.port = port;
            return this;
        }

        public Builder maxThreads(int maxThreads) {
            this.maxThreads = Assert.checkMinimumParam("maxThreads", 1, maxThreads);
            return this;
        }

        public Builder manifestMaxAge(Duration manifestMaxAge) {
            Assert.checkNotNullParam("manifestMaxAge", manifestMaxAge);
            if (manifestMaxAge.isNegative()) {
                throw new IllegalArgumentException("manifestMaxAge must not be negative");
            }
            this.manifestMaxAge = manifestMaxAge;
            return this;
        }

        public Builder webSocketMessageRate(double webSocketMessageRate) {
            if (webSocketMessageRate < 0) {
                throw new IllegalArgumentException("webSocketMessageRate must not be negative");
            }
            this.webSocketMessageRate = webSocketMessageRate;
            return this;
        }

        public Builder maxRequestSize(long maxRequestSize) {
            if (maxRequestSize < 1) {
                throw new IllegalArgumentException("maxRequestSize must be positive");
            }
            this.maxRequestSize = maxRequestSize;
            return this;
        }

        public ASAPServerConfig build() {
            return new ASAPServerConfig(this);
        }
    }
}
