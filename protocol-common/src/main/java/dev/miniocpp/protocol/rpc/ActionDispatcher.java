package dev.miniocpp.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.Envelope;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.ErrorCode;
import dev.miniocpp.protocol.MessageType;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.session.ConnectionSession;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes inbound calls to the handler of one role and turns its outcome into the reply envelope.
 */
public final class ActionDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionDispatcher.class);

    private final Role role;
    private final ActionHandler handler;
    private final EnvelopeCodec codec;

    public ActionDispatcher(Role role, ActionHandler handler, EnvelopeCodec codec) {
        this.role = Objects.requireNonNull(role, "role");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Role role() {
        return role;
    }

    public Optional<Envelope> dispatch(ConnectionSession session, Envelope call) {
        if (call.type() != MessageType.CALL) {
            throw new IllegalArgumentException("Only calls can be dispatched, got " + call.type());
        }
        Optional<Action> action = Action.fromWireName(call.action());
        if (action.isEmpty()) {
            LOGGER.warn("Unknown action {} in call {} on {}", call.action(), call.id(), session.connectionId());
            return Optional.of(error(call, ErrorCode.NOT_IMPLEMENTED, "Unknown action " + call.action()));
        }
        if (!role.accepts(action.get())) {
            LOGGER.warn("{} is not handled by the {} role (call {} on {})", action.get(), role, call.id(),
                session.connectionId());
            return Optional.of(error(call, ErrorCode.NOT_SUPPORTED, action.get() + " is not supported here"));
        }
        try {
            JsonNode reply = handler.handle(action.get(), session, call.payload());
            if (reply == null) {
                LOGGER.debug("{} call {} produced no reply", action.get(), call.id());
                return Optional.empty();
            }
            return Optional.of(Envelope.result(call.id(), reply));
        } catch (CallRejectedException e) {
            LOGGER.warn("Rejected {} call {} on {}: {}", action.get(), call.id(), session.connectionId(),
                e.getMessage());
            return Optional.of(error(call, e.errorCode(), e.getMessage()));
        } catch (RuntimeException e) {
            LOGGER.error("Error handling {} call {} on {}", action.get(), call.id(), session.connectionId(), e);
            return Optional.of(error(call, ErrorCode.INTERNAL_ERROR, "Internal error"));
        }
    }

    private Envelope error(Envelope call, ErrorCode code, String description) {
        return Envelope.error(call.id(), codec.errorPayload(code, description));
    }
}
