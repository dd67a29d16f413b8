package dev.miniocpp.central.service;

import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;

import dev.miniocpp.central.registry.PeerRegistry;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.rpc.CallFailedException;
import dev.miniocpp.protocol.session.ConnectionSession;

/**
 * Issues configuration calls to a specific charge point over its live connection and waits for the correlated
 * reply.
 */
@Service
@RequiredArgsConstructor
public class PointCommandService {

	private static final Logger logger = LoggerFactory.getLogger(PointCommandService.class);

	private final PeerRegistry peerRegistry;

	private final ObjectMapper objectMapper;

	public Set<String> connectedPoints() {
		return this.peerRegistry.identities();
	}

	/**
	 * Read configuration keys from a charge point.
	 * @param identity charge point identity
	 * @param keys keys to read; empty to read all
	 * @return GetConfiguration result payload
	 * @throws PointNotConnectedException when no session is registered for {@code identity}
	 * @throws CallFailedException when the call errors, times out or the connection closes
	 */
	public JsonNode getConfiguration(String identity, List<String> keys) throws CallFailedException {
		ConnectionSession session = sessionFor(identity);
		ObjectNode payload = this.objectMapper.createObjectNode();
		if (keys != null && !keys.isEmpty()) {
			ArrayNode requested = payload.putArray("key");
			keys.forEach(requested::add);
		}
		logger.info("GetConfiguration {} from {}", keys, identity);
		return session.call(Action.GET_CONFIGURATION, payload);
	}

	/**
	 * Change one configuration key on a charge point.
	 * @param identity charge point identity
	 * @param key configuration key
	 * @param value new value as text
	 * @return ChangeConfiguration result payload
	 * @throws PointNotConnectedException when no session is registered for {@code identity}
	 * @throws CallFailedException when the call errors, times out or the connection closes
	 */
	public JsonNode changeConfiguration(String identity, String key, String value) throws CallFailedException {
		ConnectionSession session = sessionFor(identity);
		ObjectNode payload = this.objectMapper.createObjectNode();
		payload.put("key", key);
		payload.put("value", value);
		logger.info("ChangeConfiguration {}={} on {}", key, value, identity);
		return session.call(Action.CHANGE_CONFIGURATION, payload);
	}

	private ConnectionSession sessionFor(String identity) {
		return this.peerRegistry.lookup(identity).orElseThrow(() -> new PointNotConnectedException(identity));
	}

}
