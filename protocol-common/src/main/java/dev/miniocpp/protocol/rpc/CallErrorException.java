package dev.miniocpp.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Action;

/**
 * The peer answered a call with a CallError frame.
 */
public class CallErrorException extends CallFailedException {

    private final Action action;
    private final JsonNode payload;

    public CallErrorException(Action action, JsonNode payload) {
        super(action + " failed: " + payload.path("errorCode").asText("unknown") + " "
            + payload.path("errorDescription").asText(""));
        this.action = action;
        this.payload = payload;
    }

    public Action action() {
        return action;
    }

    public JsonNode payload() {
        return payload;
    }

    public String errorCode() {
        return payload.path("errorCode").asText("GenericError");
    }

    public String errorDescription() {
        return payload.path("errorDescription").asText("");
    }
}
