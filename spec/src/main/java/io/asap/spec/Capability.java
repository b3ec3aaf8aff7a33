package io.asap.spec;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.asap.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * What an agent supports: protocol version, skills, and optional features.
 *
 * @param asapVersion the protocol version spoken by the agent
 * @param skills advertised skills
 * @param statePersistence whether the agent can snapshot and restore task state
 * @param streaming whether the agent accepts the WebSocket transport
 * @param mcpTools names of the MCP tools the agent exposes
 */
public record Capability(
        @JsonProperty("asap_version") String asapVersion,
        @JsonProperty("skills") List<Skill> skills,
        @JsonProperty("state_persistence") boolean statePersistence,
        @JsonProperty("streaming") boolean streaming,
        @JsonProperty("mcp_tools") List<String> mcpTools) {

    public Capability {
        asapVersion = Utils.defaultIfNull(asapVersion, ASAPConstants.PROTOCOL_VERSION);
        skills = skills == null ? List.of() : List.copyOf(skills);
        mcpTools = mcpTools == null ? List.of() : List.copyOf(mcpTools);
    }

    public Capability(@Nullable List<Skill> skills) {
        this(ASAPConstants.PROTOCOL_VERSION, skills, false, false, null);
    }
}
