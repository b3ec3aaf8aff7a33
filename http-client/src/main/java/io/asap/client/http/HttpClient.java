package io.asap.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Asynchronous HTTP client bound to the scheme and authority of one agent.
 * Request paths are absolute paths on that authority.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        /**
         * Sends the request. The future fails with the transport exception (for example
         * {@link java.net.ConnectException} or {@link java.net.http.HttpTimeoutException})
         * when no response is received; any HTTP status completes it normally.
         *
         * @return the response
         */
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        /**
         * Sets the time allowed for this request, from sending until the response headers arrive.
         *
         * @param timeout the request timeout, {@code null} for none
         * @return this builder
         */
        T timeout(@Nullable Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
