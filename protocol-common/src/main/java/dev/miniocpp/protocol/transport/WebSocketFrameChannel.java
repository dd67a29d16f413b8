package dev.miniocpp.protocol.transport;

import dev.miniocpp.protocol.session.FrameChannel;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * {@link FrameChannel} over a Spring {@link WebSocketSession}, one text message per frame.
 */
public final class WebSocketFrameChannel implements FrameChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketFrameChannel.class);

    public static final String SUBPROTOCOL = "ocpp1.6";

    private final WebSocketSession session;

    public WebSocketFrameChannel(WebSocketSession session) {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        session.sendMessage(new TextMessage(frame));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            LOGGER.warn("Failed to close WebSocket session {}", session.getId(), e);
        }
    }
}
