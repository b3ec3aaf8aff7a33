package io.asap.spec;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Network endpoints of an agent.
 *
 * @param asap the HTTP endpoint accepting {@code asap.send} requests
 * @param events the optional WebSocket endpoint for streaming
 */
public record Endpoint(
        @JsonProperty("asap") String asap,
        @JsonProperty("events") @Nullable String events) {

    public Endpoint(String asap) {
        this(asap, null);
    }
}
