package dev.miniocpp.point;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.miniocpp.point.handler.PointActionHandler;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.rpc.CallFailedException;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConfigurationStore;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.session.FrameChannel;
import dev.miniocpp.protocol.session.LivenessScheduler;
import dev.miniocpp.protocol.transport.WebSocketFrameChannel;
import dev.miniocpp.protocol.validation.SchemaValidator;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * A charge point: connects to the central system, announces itself, keeps the connection alive with heartbeats
 * and answers configuration calls until the connection closes.
 */
public class ChargePoint implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChargePoint.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final PointSettings settings;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ConfigurationStore configuration;
    private final ActionDispatcher dispatcher;
    private final ScheduledExecutorService livenessExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ocpp-liveness");
        t.setDaemon(true);
        return t;
    });
    private final LivenessScheduler liveness;
    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile ConnectionSession session;

    public ChargePoint(PointSettings settings, SchemaValidator schemaValidator) {
        this.settings = settings;
        this.configuration = ConfigurationStore.builder()
            .integer(ConfigurationKeys.HEARTBEAT_INTERVAL, 30, false)
            .string(ConfigurationKeys.CHARGE_POINT_MODEL, settings.model(), true)
            .string(ConfigurationKeys.CHARGE_POINT_VENDOR, settings.vendor(), true)
            .string(ConfigurationKeys.CHARGE_POINT_SERIAL_NUMBER, settings.serialNumber(), true)
            .build();
        this.dispatcher = new ActionDispatcher(Role.POINT, new PointActionHandler(schemaValidator, codec.mapper()),
            codec);
        this.liveness = new LivenessScheduler(livenessExecutor, this::heartbeatInterval, this::heartbeat);
    }

    public ConfigurationStore configuration() {
        return configuration;
    }

    public ConnectionSession session() {
        return session;
    }

    public void run() throws IOException, InterruptedException {
        connect();
        bootNotification();
        startHeartbeats();
        LOGGER.info("Charge point {} running, heartbeat every {}s", settings.serialNumber(),
            configuration.intValue(ConfigurationKeys.HEARTBEAT_INTERVAL));
        closed.await();
    }

    public void connect() throws IOException {
        StandardWebSocketClient client = new StandardWebSocketClient();
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.setSecWebSocketProtocol(WebSocketFrameChannel.SUBPROTOCOL);
        try {
            client.execute(new SocketHandler(), headers, settings.uri())
                .get(CONNECT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Unable to connect to " + settings.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while connecting to " + settings.uri(), e);
        }
        LOGGER.info("Connected to {}", settings.uri());
    }

    /**
     * Bind the charge point to an open channel. Called once the WebSocket handshake completes.
     */
    ConnectionSession attach(FrameChannel channel) {
        ConnectionSession attached = new ConnectionSession(channel, dispatcher, configuration, codec,
            settings.callTimeout());
        attached.identity(settings.serialNumber());
        attached.onClose(s -> {
            liveness.stop();
            closed.countDown();
        });
        this.session = attached;
        return attached;
    }

    /**
     * Announce this charge point and adopt the heartbeat interval the central system assigns.
     */
    public JsonNode bootNotification() throws CallFailedException {
        ObjectNode payload = codec.mapper().createObjectNode();
        payload.put("chargePointModel", settings.model());
        payload.put("chargePointVendor", settings.vendor());
        payload.put("chargePointSerialNumber", settings.serialNumber());
        JsonNode reply = requireSession().call(Action.BOOT_NOTIFICATION, payload);
        String status = reply.path("status").asText();
        if (!"Accepted".equals(status)) {
            throw new CallFailedException("BootNotification was not accepted: " + status);
        }
        int interval = reply.path("interval").asInt(0);
        if (interval > 0) {
            configuration.set(ConfigurationKeys.HEARTBEAT_INTERVAL, interval);
        }
        LOGGER.info("BootNotification accepted at {}, heartbeat interval {}s", reply.path("currentTime").asText(),
            configuration.intValue(ConfigurationKeys.HEARTBEAT_INTERVAL));
        return reply;
    }

    void startHeartbeats() {
        liveness.start();
    }

    boolean heartbeatsRunning() {
        return liveness.isRunning();
    }

    void heartbeat() {
        try {
            JsonNode reply = requireSession().call(Action.HEARTBEAT, codec.mapper().createObjectNode());
            LOGGER.debug("Heartbeat acknowledged, central time {}", reply.path("currentTime").asText());
        } catch (CallFailedException e) {
            LOGGER.warn("Heartbeat failed: {}", e.getMessage());
        }
    }

    Duration heartbeatInterval() {
        return Duration.ofSeconds(Math.max(1, configuration.intValue(ConfigurationKeys.HEARTBEAT_INTERVAL)));
    }

    private ConnectionSession requireSession() throws CallFailedException {
        ConnectionSession current = session;
        if (current == null) {
            throw new CallFailedException("Charge point " + settings.serialNumber() + " is not connected");
        }
        return current;
    }

    @Override
    public void close() {
        liveness.stop();
        ConnectionSession current = session;
        if (current != null) {
            current.close();
        }
        livenessExecutor.shutdownNow();
        closed.countDown();
    }

    private final class SocketHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession socketSession) {
            LOGGER.info("WebSocket {} established, subprotocol {}", socketSession.getId(),
                socketSession.getAcceptedProtocol());
            attach(new WebSocketFrameChannel(socketSession));
        }

        @Override
        protected void handleTextMessage(WebSocketSession socketSession, TextMessage message) {
            ConnectionSession current = session;
            if (current != null) {
                current.onFrame(message.getPayload());
            }
        }

        @Override
        public void handleTransportError(WebSocketSession socketSession, Throwable exception) {
            LOGGER.error("Transport error on {}", socketSession.getId(), exception);
            closeSession();
        }

        @Override
        public void afterConnectionClosed(WebSocketSession socketSession, CloseStatus status) {
            LOGGER.info("Connection to {} closed: {}", settings.uri(), status);
            closeSession();
        }

        private void closeSession() {
            ConnectionSession current = session;
            if (current != null) {
                current.close();
            }
        }
    }
}
