package dev.miniocpp.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.session.ConnectionSession;

/**
 * Role-specific logic answering inbound calls.
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * @return reply payload, or {@code null} when no reply should be sent
     * @throws CallRejectedException to answer with a CallError
     */
    JsonNode handle(Action action, ConnectionSession session, JsonNode payload) throws CallRejectedException;
}
