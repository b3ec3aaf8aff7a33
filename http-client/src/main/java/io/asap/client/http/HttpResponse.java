package io.asap.client.http;

import java.util.Optional;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    String body();

    /**
     * @param name the header name, case insensitive
     * @return the first value of the header
     */
    Optional<String> header(String name);
}
