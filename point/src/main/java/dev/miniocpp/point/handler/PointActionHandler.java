package dev.miniocpp.point.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.ErrorCode;
import dev.miniocpp.protocol.rpc.ActionHandler;
import dev.miniocpp.protocol.rpc.CallRejectedException;
import dev.miniocpp.protocol.session.ChangeStatus;
import dev.miniocpp.protocol.session.ConfigEntry;
import dev.miniocpp.protocol.session.ConfigurationRead;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.validation.SchemaValidator;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers the configuration calls the central system sends to a charge point.
 */
public class PointActionHandler implements ActionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PointActionHandler.class);

    private final SchemaValidator schemaValidator;
    private final ObjectMapper mapper;

    public PointActionHandler(SchemaValidator schemaValidator, ObjectMapper mapper) {
        this.schemaValidator = schemaValidator;
        this.mapper = mapper;
    }

    @Override
    public JsonNode handle(Action action, ConnectionSession session, JsonNode payload) throws CallRejectedException {
        return switch (action) {
            case GET_CONFIGURATION -> getConfiguration(session, payload);
            case CHANGE_CONFIGURATION -> changeConfiguration(session, payload);
            case BOOT_NOTIFICATION, HEARTBEAT ->
                throw new CallRejectedException(ErrorCode.NOT_SUPPORTED, action + " is sent by the charge point");
        };
    }

    private JsonNode getConfiguration(ConnectionSession session, JsonNode payload) throws CallRejectedException {
        validate(Action.GET_CONFIGURATION, payload);
        List<String> keys = new ArrayList<>();
        payload.path("key").forEach(key -> keys.add(key.asText()));
        ConfigurationRead read = session.configuration().read(keys);

        ObjectNode reply = mapper.createObjectNode();
        ArrayNode known = reply.putArray("configurationKey");
        for (ConfigEntry entry : read.known()) {
            ObjectNode item = known.addObject();
            item.put("key", entry.key());
            item.put("readonly", entry.readonly());
            if (entry.value() instanceof Integer number) {
                item.put("value", number);
            } else {
                item.put("value", entry.value().toString());
            }
        }
        ArrayNode unknown = reply.putArray("unknownKey");
        read.unknown().forEach(unknown::add);
        LOGGER.info("GetConfiguration: {} known, {} unknown", read.known().size(), read.unknown().size());
        return reply;
    }

    private JsonNode changeConfiguration(ConnectionSession session, JsonNode payload) throws CallRejectedException {
        validate(Action.CHANGE_CONFIGURATION, payload);
        String key = payload.path("key").asText();
        JsonNode value = payload.path("value");
        ChangeStatus status = session.configuration().change(key, value.isTextual() ? value.textValue() : value.asText());
        LOGGER.info("ChangeConfiguration {}={}: {}", key, value, status.wireName());
        ObjectNode reply = mapper.createObjectNode();
        reply.put("status", status.wireName());
        return reply;
    }

    private void validate(Action action, JsonNode payload) throws CallRejectedException {
        if (!schemaValidator.validate(action.wireName(), payload)) {
            throw new CallRejectedException(ErrorCode.FORMATION_VIOLATION, "Invalid " + action + " payload");
        }
    }
}
