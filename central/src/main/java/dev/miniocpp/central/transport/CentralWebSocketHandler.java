package dev.miniocpp.central.transport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.SubProtocolCapable;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.miniocpp.central.config.CentralSystemProperties;
import dev.miniocpp.central.registry.PeerRegistry;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConfigurationStore;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.transport.WebSocketFrameChannel;

/**
 * Accepts charge point WebSocket connections. Each connection hosts one {@link ConnectionSession}; inbound text
 * messages are fed to it and closing the socket closes the session and removes its registry entries.
 */
@Component
public class CentralWebSocketHandler extends TextWebSocketHandler implements SubProtocolCapable {

	private static final Logger logger = LoggerFactory.getLogger(CentralWebSocketHandler.class);

	private final ActionDispatcher dispatcher;

	private final PeerRegistry peerRegistry;

	private final EnvelopeCodec envelopeCodec;

	private final CentralSystemProperties properties;

	private final Map<String, ConnectionSession> sessionsByWebSocketId = new ConcurrentHashMap<>();

	public CentralWebSocketHandler(ActionDispatcher dispatcher, PeerRegistry peerRegistry,
			EnvelopeCodec envelopeCodec, CentralSystemProperties properties) {
		this.dispatcher = dispatcher;
		this.peerRegistry = peerRegistry;
		this.envelopeCodec = envelopeCodec;
		this.properties = properties;
	}

	@Override
	public List<String> getSubProtocols() {
		return List.of(WebSocketFrameChannel.SUBPROTOCOL);
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession socketSession) {
		logger.info("WebSocket connection established: {} from {}", socketSession.getId(),
				socketSession.getRemoteAddress());
		ConfigurationStore configuration = ConfigurationStore.builder()
			.integer(ConfigurationKeys.HEARTBEAT_INTERVAL, this.properties.getHeartbeatInterval(), false)
			.build();
		ConnectionSession session = new ConnectionSession(new WebSocketFrameChannel(socketSession), this.dispatcher,
				configuration, this.envelopeCodec, this.properties.getCallTimeout());
		session.onClose(this.peerRegistry::removeSession);
		this.sessionsByWebSocketId.put(socketSession.getId(), session);
	}

	@Override
	protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
		ConnectionSession session = this.sessionsByWebSocketId.get(socketSession.getId());
		if (session == null) {
			logger.warn("Message on unknown WebSocket {}, ignoring", socketSession.getId());
			return;
		}
		session.onFrame(message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", socketSession.getId(), exception);
		closeSession(socketSession);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", socketSession.getId(), status);
		closeSession(socketSession);
	}

	/**
	 * Number of open charge point connections, registered or not.
	 * @return open connection count
	 */
	public int connectionCount() {
		return this.sessionsByWebSocketId.size();
	}

	private void closeSession(WebSocketSession socketSession) {
		ConnectionSession session = this.sessionsByWebSocketId.remove(socketSession.getId());
		if (session != null) {
			session.close();
		}
	}

}
