package dev.miniocpp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Codec for the JSON-array frames exchanged over a text WebSocket:
 * {@code [2, id, action, payload]}, {@code [3, id, payload]} and {@code [4, id, payload]}.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encodeCall(String id, String action, JsonNode payload) {
        ArrayNode frame = mapper.createArrayNode();
        frame.add(MessageType.CALL.tag());
        frame.add(id);
        frame.add(action);
        frame.add(payloadOrEmpty(payload));
        return write(frame);
    }

    public String encodeResult(String id, JsonNode payload) {
        return encodeReply(MessageType.CALL_RESULT, id, payload);
    }

    public String encodeError(String id, JsonNode payload) {
        return encodeReply(MessageType.CALL_ERROR, id, payload);
    }

    public String encode(Envelope envelope) {
        return switch (envelope.type()) {
            case CALL -> encodeCall(envelope.id(), envelope.action(), envelope.payload());
            case CALL_RESULT -> encodeResult(envelope.id(), envelope.payload());
            case CALL_ERROR -> encodeError(envelope.id(), envelope.payload());
        };
    }

    /**
     * Build the payload carried by CallError frames produced by this system.
     */
    public ObjectNode errorPayload(ErrorCode code, String description) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("errorCode", code.wireName());
        payload.put("errorDescription", description == null ? "" : description);
        return payload;
    }

    /**
     * Decode a text frame. Malformed input is reported through the result, never thrown.
     */
    public DecodeResult decode(String text) {
        if (text == null) {
            return DecodeResult.malformed("empty frame");
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            return DecodeResult.malformed("not JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            return DecodeResult.malformed("frame is not an array");
        }
        if (root.size() == 0 || !root.get(0).canConvertToInt() || !root.get(0).isIntegralNumber()) {
            return DecodeResult.malformed("missing message type tag");
        }
        MessageType type = MessageType.fromTag(root.get(0).intValue()).orElse(null);
        if (type == null) {
            return DecodeResult.malformed("unknown message type tag " + root.get(0));
        }
        if (root.size() < type.minimumLength()) {
            return DecodeResult.malformed(type + " frame has " + root.size() + " elements, expected at least "
                + type.minimumLength());
        }
        JsonNode id = root.get(1);
        if (!id.isTextual()) {
            return DecodeResult.malformed("message id is not a string");
        }
        return switch (type) {
            case CALL -> decodeCall(id.textValue(), root);
            case CALL_RESULT -> DecodeResult.decoded(Envelope.result(id.textValue(), root.get(2)));
            case CALL_ERROR -> DecodeResult.decoded(Envelope.error(id.textValue(), errorPayload(root)));
        };
    }

    private DecodeResult decodeCall(String id, JsonNode root) {
        JsonNode action = root.get(2);
        if (!action.isTextual() || action.textValue().isEmpty()) {
            return DecodeResult.malformed("call action is not a string");
        }
        return DecodeResult.decoded(Envelope.call(id, action.textValue(), root.get(3)));
    }

    // OCPP 1.6 peers send [4, id, errorCode, errorDescription, errorDetails]; fold that into one payload.
    private JsonNode errorPayload(JsonNode root) {
        if (root.size() >= 5 && root.get(2).isTextual()) {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("errorCode", root.get(2).textValue());
            payload.put("errorDescription", root.get(3).asText(""));
            payload.set("errorDetails", root.get(4));
            return payload;
        }
        return root.get(2);
    }

    private String encodeReply(MessageType type, String id, JsonNode payload) {
        ArrayNode frame = mapper.createArrayNode();
        frame.add(type.tag());
        frame.add(id);
        frame.add(payloadOrEmpty(payload));
        return write(frame);
    }

    private JsonNode payloadOrEmpty(JsonNode payload) {
        return payload == null || payload.isMissingNode() ? mapper.createObjectNode() : payload;
    }

    private String write(ArrayNode frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise frame", e);
        }
    }
}
