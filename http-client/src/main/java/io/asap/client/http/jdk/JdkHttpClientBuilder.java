package io.asap.client.http.jdk;

import java.time.Duration;

import io.asap.client.http.HttpClient;
import io.asap.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration connectTimeout;

    public JdkHttpClientBuilder() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public JdkHttpClientBuilder(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout);
    }
}
