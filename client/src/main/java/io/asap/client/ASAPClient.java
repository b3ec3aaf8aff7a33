package io.asap.client;

import static io.asap.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.asap.client.discovery.ManifestDiscovery;
import io.asap.client.http.HttpClient;
import io.asap.client.http.HttpResponse;
import io.asap.client.resilience.AttemptOutcome;
import io.asap.client.resilience.CircuitBreaker;
import io.asap.client.resilience.RetryExecutor;
import io.asap.spec.ASAPConnectionError;
import io.asap.spec.ASAPConstants;
import io.asap.spec.ASAPErrorCodes;
import io.asap.spec.ASAPRemoteError;
import io.asap.spec.ASAPTimeoutError;
import io.asap.spec.Envelope;
import io.asap.spec.InvalidEnvelopeError;
import io.asap.spec.JSONRPCRequest;
import io.asap.spec.Manifest;
import io.asap.spec.SendEnvelopeParams;
import io.asap.util.Ids;
import io.asap.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends envelopes to one remote agent over HTTP with retries and circuit breaking.
 * <p>
 * Each {@link #send} is one logical call: a single JSON-RPC request id and idempotency key are
 * reused for every attempt. Failures are classified per attempt:
 * <ul>
 *   <li>HTTP 429, 502, 503 and 504 are retried, honoring {@code Retry-After}; any other error
 *       status fails the call with {@link ASAPConnectionError}</li>
 *   <li>connection failures ({@link ASAPConnectionError}) and request timeouts
 *       ({@link ASAPTimeoutError}) are retried</li>
 *   <li>a JSON-RPC error becomes an {@link ASAPRemoteError}, retried only for internal errors and
 *       server admission rejections</li>
 *   <li>a body that is not JSON, or a result without an envelope, fails the call</li>
 * </ul>
 * The breaker for the base URL comes from the configured registry, so every client pointed at the
 * same agent shares it. The returned futures never complete with a malformed envelope; every
 * failure is an {@link io.asap.spec.ASAPError}.
 */
public class ASAPClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ASAPClient.class);

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() {};

    private final String baseUrl;
    private final String agentPath;
    private final ClientConfig config;
    private final HttpClient httpClient;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;
    private final ManifestDiscovery discovery;
    private final AtomicLong requestCounter = new AtomicLong();

    public ASAPClient(String baseUrl) {
        this(baseUrl, ClientConfig.defaults());
    }

    public ASAPClient(String baseUrl, ClientConfig config) {
        checkNotNullParam("baseUrl", baseUrl);
        this.config = checkNotNullParam("config", config);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        String path = URI.create(this.baseUrl).getRawPath();
        this.agentPath = path == null ? "" : path;

        this.httpClient = config.getHttpClientBuilder().create(this.baseUrl);
        this.circuitBreaker = config.getCircuitBreakerRegistry()
                .getOrCreate(this.baseUrl, config.getCircuitBreakerThreshold(), config.getCircuitBreakerTimeout());
        this.retryExecutor = new RetryExecutor(config.getRetryPolicy());
        this.discovery = new ManifestDiscovery(config.getManifestCache(), config.getHttpClientBuilder());
    }

    public CompletableFuture<Envelope> send(Envelope envelope) {
        return send(envelope, null);
    }

    /**
     * Sends an envelope and waits for the response envelope.
     *
     * @param envelope the request envelope
     * @param deadline optional limit for the whole call; when exceeded the call fails with
     *                 {@link ASAPTimeoutError} and counts as one breaker failure
     * @return the response envelope
     */
    public CompletableFuture<Envelope> send(Envelope envelope, @Nullable Duration deadline) {
        checkNotNullParam("envelope", envelope);
        String requestId = "req-" + requestCounter.incrementAndGet();
        String idempotencyKey = Ids.generate();

        String body;
        try {
            body = Utils.toJsonString(JSONRPCRequest.send(requestId, new SendEnvelopeParams(envelope, idempotencyKey)));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new InvalidEnvelopeError(List.of("Unable to serialize envelope: " + e.getOriginalMessage()), e));
        }

        LOGGER.debug("Sending envelope {} ({}) to {} as {}", envelope.id(), envelope.payloadType(), baseUrl, requestId);
        return retryExecutor.execute(baseUrl, circuitBreaker, () -> attempt(envelope, body, idempotencyKey), deadline);
    }

    /**
     * Discovers the manifest of the remote agent, through the configured manifest cache.
     *
     * @return the manifest
     */
    public CompletableFuture<Manifest> getManifest() {
        return discovery.discover(baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public ClientConfig getConfig() {
        return config;
    }

    private CompletableFuture<AttemptOutcome<Envelope>> attempt(Envelope envelope, String body, String idempotencyKey) {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        headers.put(ASAPConstants.IDEMPOTENCY_KEY_HEADER, idempotencyKey);
        for (ClientCallInterceptor interceptor : config.getInterceptors()) {
            headers = interceptor.intercept(ASAPConstants.SEND_METHOD, envelope, headers);
        }

        return httpClient.post(agentPath + ASAPConstants.ASAP_PATH)
                .addHeaders(headers)
                .timeout(config.getTimeout())
                .send(body)
                .handle((response, error) -> error != null ? classifyFailure(error) : classifyResponse(response));
    }

    AttemptOutcome<Envelope> classifyFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof HttpConnectTimeoutException || cause instanceof ConnectException) {
            return AttemptOutcome.retryable(new ASAPConnectionError("Connection to " + baseUrl + " failed: " + cause, cause), null);
        }
        if (cause instanceof HttpTimeoutException) {
            return AttemptOutcome.retryable(new ASAPTimeoutError("Request to " + baseUrl + " timed out after "
                    + config.getTimeout().toMillis() + " ms", config.getTimeout(), cause), null);
        }
        if (cause instanceof IOException) {
            return AttemptOutcome.retryable(new ASAPConnectionError("Request to " + baseUrl + " failed: " + cause, cause), null);
        }
        return AttemptOutcome.fatal(new ASAPConnectionError("Unexpected error calling " + baseUrl + ": " + cause, cause));
    }

    @SuppressWarnings("unchecked")
    AttemptOutcome<Envelope> classifyResponse(HttpResponse response) {
        int status = response.statusCode();
        Duration retryAfter = parseRetryAfter(response);

        if (RETRYABLE_STATUSES.contains(status)) {
            ASAPRemoteError remote = readRemoteError(response.body(), retryAfter);
            if (remote != null) {
                return AttemptOutcome.retryable(remote, retryAfter);
            }
            return AttemptOutcome.retryable(
                    new ASAPConnectionError(status, "HTTP error " + status + " from " + baseUrl, true, retryAfter), retryAfter);
        }
        if (!response.success()) {
            return AttemptOutcome.fatal(new ASAPConnectionError(status, "HTTP error " + status + " from " + baseUrl, false, null));
        }

        Map<String, Object> json;
        try {
            json = Utils.unmarshalFrom(response.body(), MAP_TYPE_REFERENCE);
        } catch (JsonProcessingException e) {
            return AttemptOutcome.fatal(new ASAPRemoteError(ASAPErrorCodes.JSON_PARSE_ERROR_CODE,
                    "Invalid JSON response: " + e.getOriginalMessage(), null, null, e));
        }
        if (json == null) {
            return AttemptOutcome.fatal(new ASAPRemoteError(ASAPErrorCodes.JSON_PARSE_ERROR_CODE,
                    "Invalid JSON response: empty body", null));
        }

        if (json.get("error") instanceof Map<?, ?> error) {
            ASAPRemoteError remote = toRemoteError((Map<String, Object>) error, retryAfter);
            return remote.isRetryable() ? AttemptOutcome.retryable(remote, retryAfter) : AttemptOutcome.fatal(remote);
        }

        if (!(json.get("result") instanceof Map<?, ?> result) || !(result.get("envelope") instanceof Map<?, ?> envelope)) {
            return AttemptOutcome.fatal(new ASAPRemoteError(ASAPErrorCodes.INTERNAL_ERROR_CODE,
                    "Invalid response: missing envelope", null));
        }
        try {
            Envelope responseEnvelope = Envelope.fromMap((Map<String, Object>) envelope);
            LOGGER.debug("Received envelope {} ({}) from {}", responseEnvelope.id(), responseEnvelope.payloadType(), baseUrl);
            return AttemptOutcome.success(responseEnvelope);
        } catch (InvalidEnvelopeError e) {
            return AttemptOutcome.fatal(new ASAPRemoteError(ASAPErrorCodes.INTERNAL_ERROR_CODE,
                    "Invalid response envelope: " + e.getMessage(), e.toErrorData(), null, e));
        }
    }

    @SuppressWarnings("unchecked")
    private @Nullable ASAPRemoteError readRemoteError(String body, @Nullable Duration retryAfter) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            Map<String, Object> json = Utils.unmarshalFrom(body, MAP_TYPE_REFERENCE);
            if (json != null && json.get("error") instanceof Map<?, ?> error) {
                return toRemoteError((Map<String, Object>) error, retryAfter);
            }
        } catch (JsonProcessingException e) {
            LOGGER.debug("Error response from {} is not JSON-RPC: {}", baseUrl, e.getOriginalMessage());
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static ASAPRemoteError toRemoteError(Map<String, Object> error, @Nullable Duration retryAfter) {
        int code = error.get("code") instanceof Number n ? n.intValue() : ASAPErrorCodes.INTERNAL_ERROR_CODE;
        String message = error.get("message") instanceof String s ? s : "Unknown error";
        Map<String, Object> data = error.get("data") instanceof Map<?, ?> d ? (Map<String, Object>) d : null;
        return new ASAPRemoteError(code, message, data, retryAfter, null);
    }

    private static @Nullable Duration parseRetryAfter(HttpResponse response) {
        return response.header("Retry-After")
                .map(String::trim)
                .filter(value -> value.matches("\\d+"))
                .map(value -> Duration.ofSeconds(Long.parseLong(value)))
                .orElse(null);
    }
}
