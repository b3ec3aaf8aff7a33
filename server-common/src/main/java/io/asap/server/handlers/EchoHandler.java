package io.asap.server.handlers;

import java.util.LinkedHashMap;
import java.util.Map;

import io.asap.server.ServerCallContext;
import io.asap.spec.Envelope;
import io.asap.spec.InvalidEnvelopeError;
import io.asap.spec.Manifest;
import io.asap.spec.PayloadType;
import io.asap.util.Ids;

/**
 * Answers a {@code task.request} with a completed {@code task.response} whose result echoes
 * the request input.
 */
public class EchoHandler implements Handler {

    @Override
    public Envelope handle(Envelope envelope, ServerCallContext context) {
        if (!(envelope.payload().get("input") instanceof Map<?, ?> input)) {
            throw new InvalidEnvelopeError("task.request payload requires an 'input' object");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", "task_" + Ids.generate());
        payload.put("status", "completed");
        payload.put("result", Map.of("echoed", input));

        Manifest manifest = context.getManifest();
        return Envelope.builder()
                .asapVersion(envelope.asapVersion())
                .sender(manifest != null ? manifest.id() : envelope.recipient())
                .recipient(envelope.sender())
                .payloadType(PayloadType.TASK_RESPONSE)
                .payload(payload)
                .correlationId(envelope.id())
                .traceId(envelope.traceId())
                .build();
    }
}
