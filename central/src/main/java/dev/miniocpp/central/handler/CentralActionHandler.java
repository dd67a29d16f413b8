package dev.miniocpp.central.handler;

import java.time.Clock;
import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.miniocpp.central.registry.PeerRegistry;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.ErrorCode;
import dev.miniocpp.protocol.rpc.ActionHandler;
import dev.miniocpp.protocol.rpc.CallRejectedException;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.validation.SchemaValidator;

/**
 * Answers the calls a charge point sends to the central system: the identifying boot notification and the
 * periodic heartbeat.
 */
@Component
@RequiredArgsConstructor
public class CentralActionHandler implements ActionHandler {

	private static final Logger logger = LoggerFactory.getLogger(CentralActionHandler.class);

	static final String SERIAL_NUMBER = "chargePointSerialNumber";

	private final SchemaValidator schemaValidator;

	private final PeerRegistry peerRegistry;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	@Override
	public JsonNode handle(Action action, ConnectionSession session, JsonNode payload) throws CallRejectedException {
		return switch (action) {
			case BOOT_NOTIFICATION -> bootNotification(session, payload);
			case HEARTBEAT -> heartbeat(session, payload);
			case GET_CONFIGURATION, CHANGE_CONFIGURATION ->
				throw new CallRejectedException(ErrorCode.NOT_SUPPORTED, action + " is sent by the central system");
		};
	}

	/**
	 * Validate the boot notification, register the charge point under its serial number and hand out the
	 * heartbeat interval. Invalid notifications are rejected and leave the registry untouched.
	 * @param session session the notification arrived on
	 * @param payload boot notification payload
	 * @return reply carrying status, current time and interval
	 * @throws CallRejectedException when the payload fails schema validation
	 */
	private JsonNode bootNotification(ConnectionSession session, JsonNode payload) throws CallRejectedException {
		if (!this.schemaValidator.validate(Action.BOOT_NOTIFICATION.wireName(), payload)) {
			throw new CallRejectedException(ErrorCode.FORMATION_VIOLATION, "Invalid BootNotification payload");
		}
		String identity = payload.path(SERIAL_NUMBER).asText();
		logger.info("BootNotification from {} ({} {}) on connection {}", identity,
				payload.path("chargePointVendor").asText(), payload.path("chargePointModel").asText(),
				session.connectionId());
		session.identity(identity);
		this.peerRegistry.upsert(identity, session);

		ObjectNode reply = this.objectMapper.createObjectNode();
		reply.put("status", "Accepted");
		reply.put("currentTime", now());
		reply.put("interval", session.configuration().intValue(ConfigurationKeys.HEARTBEAT_INTERVAL));
		return reply;
	}

	private JsonNode heartbeat(ConnectionSession session, JsonNode payload) throws CallRejectedException {
		if (!this.schemaValidator.validate(Action.HEARTBEAT.wireName(), payload)) {
			throw new CallRejectedException(ErrorCode.FORMATION_VIOLATION, "Invalid Heartbeat payload");
		}
		logger.debug("Heartbeat from {}", session.identity() != null ? session.identity() : session.connectionId());
		ObjectNode reply = this.objectMapper.createObjectNode();
		reply.put("currentTime", now());
		return reply;
	}

	private String now() {
		return Instant.now(this.clock).toString();
	}

}
