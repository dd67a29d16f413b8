package dev.miniocpp.central;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.miniocpp.central.registry.PeerRegistry;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.ErrorCode;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.rpc.CallErrorException;
import dev.miniocpp.protocol.rpc.CallRejectedException;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConfigurationStore;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.transport.WebSocketFrameChannel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CentralSystemIntegrationTest {

	@LocalServerPort
	private int port;

	@Autowired
	private PeerRegistry peerRegistry;

	@Autowired
	private TestRestTemplate restTemplate;

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final EnvelopeCodec codec = new EnvelopeCodec(this.objectMapper);

	private ConnectionSession point;

	private WebSocketSession socket;

	@AfterEach
	void disconnect() {
		if (this.point != null) {
			this.point.close();
		}
	}

	private void connect() throws Exception {
		ConfigurationStore configuration = ConfigurationStore.builder()
			.integer(ConfigurationKeys.HEARTBEAT_INTERVAL, 30, false)
			.build();
		ActionDispatcher dispatcher = new ActionDispatcher(Role.POINT, (action, session, payload) -> switch (action) {
			case GET_CONFIGURATION -> {
				ObjectNode reply = this.objectMapper.createObjectNode();
				reply.putArray("configurationKey")
					.addObject()
					.put("key", ConfigurationKeys.HEARTBEAT_INTERVAL)
					.put("readonly", false)
					.put("value", session.configuration().intValue(ConfigurationKeys.HEARTBEAT_INTERVAL));
				reply.putArray("unknownKey");
				yield reply;
			}
			case CHANGE_CONFIGURATION -> this.objectMapper.createObjectNode()
				.put("status", session.configuration()
					.change(payload.path("key").asText(), payload.path("value").asText())
					.wireName());
			default -> throw new CallRejectedException(ErrorCode.NOT_SUPPORTED, action.wireName());
		}, this.codec);

		CompletableFuture<ConnectionSession> opened = new CompletableFuture<>();
		TextWebSocketHandler handler = new TextWebSocketHandler() {

			@Override
			public void afterConnectionEstablished(WebSocketSession session) {
				opened.complete(new ConnectionSession(new WebSocketFrameChannel(session), dispatcher, configuration,
						CentralSystemIntegrationTest.this.codec, Duration.ofSeconds(5)));
			}

			@Override
			protected void handleTextMessage(WebSocketSession session, TextMessage message) {
				opened.join().onFrame(message.getPayload());
			}

		};
		WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
		headers.setSecWebSocketProtocol(WebSocketFrameChannel.SUBPROTOCOL);
		this.socket = new StandardWebSocketClient()
			.execute(handler, headers, URI.create("ws://localhost:" + this.port + "/ocpp/test"))
			.get(5, TimeUnit.SECONDS);
		this.point = opened.get(5, TimeUnit.SECONDS);
	}

	private ObjectNode bootPayload(String serialNumber) {
		return this.objectMapper.createObjectNode()
			.put("chargePointModel", "BestModel")
			.put("chargePointVendor", "BestVendor")
			.put("chargePointSerialNumber", serialNumber);
	}

	private void awaitUnregistered(String identity) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (this.peerRegistry.lookup(identity).isPresent() && System.nanoTime() < deadline) {
			Thread.sleep(20);
		}
	}

	@Test
	void bootHeartbeatAndConfigurationRoundTrip() throws Exception {
		connect();
		assertThat(this.socket.getAcceptedProtocol()).isEqualTo("ocpp1.6");

		JsonNode boot = this.point.call(Action.BOOT_NOTIFICATION, bootPayload("CP-IT-1"));
		assertThat(boot.path("status").asText()).isEqualTo("Accepted");
		assertThat(boot.path("interval").asInt()).isEqualTo(300);
		assertThat(this.peerRegistry.lookup("CP-IT-1")).isPresent();

		JsonNode heartbeat = this.point.call(Action.HEARTBEAT, this.objectMapper.createObjectNode());
		assertThat(heartbeat.path("currentTime").asText()).isNotEmpty();

		ResponseEntity<JsonNode> read = this.restTemplate.getForEntity(
				"/api/points/{identity}/configuration?key={key}", JsonNode.class, "CP-IT-1", "HeartbeatInterval");
		assertThat(read.getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(read.getBody().path("configurationKey").get(0).path("value").asInt()).isEqualTo(30);

		ObjectNode change = this.objectMapper.createObjectNode().put("key", "HeartbeatInterval").put("value", "60");
		ResponseEntity<JsonNode> changed = this.restTemplate.postForEntity("/api/points/{identity}/configuration",
				change, JsonNode.class, "CP-IT-1");
		assertThat(changed.getStatusCode()).isEqualTo(HttpStatus.OK);
		assertThat(changed.getBody().path("status").asText()).isEqualTo("Accepted");
		assertThat(this.point.configuration().intValue(ConfigurationKeys.HEARTBEAT_INTERVAL)).isEqualTo(60);

		this.point.close();
		awaitUnregistered("CP-IT-1");
		assertThat(this.peerRegistry.lookup("CP-IT-1")).isEmpty();
	}

	@Test
	void invalidBootNotificationIsAnsweredWithCallError() throws Exception {
		connect();
		ObjectNode invalid = this.objectMapper.createObjectNode().put("chargePointModel", "BestModel");

		assertThatThrownBy(() -> this.point.call(Action.BOOT_NOTIFICATION, invalid))
			.isInstanceOf(CallErrorException.class)
			.satisfies(e -> assertThat(((CallErrorException) e).errorCode()).isEqualTo("FormationViolation"));
		assertThat(this.point.isOpen()).isTrue();
	}

	@Test
	void unknownPointIsNotFound() {
		ResponseEntity<JsonNode> response = this.restTemplate.getForEntity("/api/points/{identity}/configuration",
				JsonNode.class, "CP-missing");

		assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
	}

}
