package dev.miniocpp.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Decoded frame. {@code action} is only present on {@link MessageType#CALL} frames.
 */
public record Envelope(
    MessageType type,
    String id,
    String action,
    JsonNode payload
) {

    public Envelope {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
        if (type == MessageType.CALL && action == null) {
            throw new IllegalArgumentException("Call envelope requires an action");
        }
    }

    public static Envelope call(String id, String action, JsonNode payload) {
        return new Envelope(MessageType.CALL, id, action, payload);
    }

    public static Envelope result(String id, JsonNode payload) {
        return new Envelope(MessageType.CALL_RESULT, id, null, payload);
    }

    public static Envelope error(String id, JsonNode payload) {
        return new Envelope(MessageType.CALL_ERROR, id, null, payload);
    }
}
