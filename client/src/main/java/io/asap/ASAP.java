package io.asap;

import java.util.LinkedHashMap;
import java.util.Map;

import io.asap.client.http.ManifestResolver;
import io.asap.spec.Envelope;
import io.asap.spec.Manifest;
import io.asap.spec.PayloadType;
import io.asap.util.Ids;
import org.jspecify.annotations.Nullable;

/**
 * Constants and utility methods related to the ASAP protocol.
 */
public class ASAP {

    private ASAP() {
    }

    /**
     * Create a {@code task.request} envelope.
     *
     * @param sender the sending agent URN
     * @param recipient the receiving agent URN
     * @param skillId the skill to invoke
     * @param input the task input
     * @return the envelope
     */
    public static Envelope createTaskRequest(String sender, String recipient, String skillId, Map<String, Object> input) {
        return createTaskRequest(sender, recipient, skillId, input, null);
    }

    /**
     * Create a {@code task.request} envelope belonging to a trace.
     *
     * @param sender the sending agent URN
     * @param recipient the receiving agent URN
     * @param skillId the skill to invoke
     * @param input the task input
     * @param traceId the trace the request belongs to, may be {@code null}
     * @return the envelope
     */
    public static Envelope createTaskRequest(String sender, String recipient, String skillId,
                                             Map<String, Object> input, @Nullable String traceId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("conversation_id", Ids.generate());
        payload.put("skill_id", skillId);
        payload.put("input", input);
        return Envelope.builder()
                .sender(sender)
                .recipient(recipient)
                .payloadType(PayloadType.TASK_REQUEST)
                .payload(payload)
                .traceId(traceId)
                .build();
    }

    /**
     * Create the {@code task.response} answering a request.
     *
     * @param request the request being answered
     * @param status the task status, e.g. {@code completed}
     * @param result the task result
     * @return the response envelope, correlated to the request
     */
    public static Envelope createTaskResponse(Envelope request, String status, Map<String, Object> result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", "task_" + Ids.generate());
        payload.put("status", status);
        payload.put("result", result);
        return request.reply(PayloadType.TASK_RESPONSE.wireName(), payload);
    }

    /**
     * Get the manifest of an agent.
     *
     * @param agentUrl the base URL of the agent
     * @return the manifest
     * @throws io.asap.spec.ASAPConnectionError if an HTTP error occurs fetching the manifest
     * @throws io.asap.spec.ManifestValidationError if the response is not a valid manifest
     */
    public static Manifest getManifest(String agentUrl) {
        return new ManifestResolver(agentUrl).getManifest();
    }
}
