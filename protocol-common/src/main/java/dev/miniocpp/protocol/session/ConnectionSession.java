package dev.miniocpp.protocol.session;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.DecodeResult;
import dev.miniocpp.protocol.Envelope;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.Wire;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.rpc.CallErrorException;
import dev.miniocpp.protocol.rpc.CallFailedException;
import dev.miniocpp.protocol.rpc.CallOutcome;
import dev.miniocpp.protocol.rpc.ConnectionClosedException;
import dev.miniocpp.protocol.rpc.CorrelationTable;
import dev.miniocpp.protocol.rpc.PendingCall;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live connection to a peer. Inbound frames enter through {@link #onFrame(String)}; calls are answered on a
 * per-session request thread so the listener never blocks, and every outbound frame goes through one locked
 * send path.
 */
public class ConnectionSession implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionSession.class);

    private final FrameChannel channel;
    private final ActionDispatcher dispatcher;
    private final ConfigurationStore configuration;
    private final EnvelopeCodec codec;
    private final Duration callTimeout;
    private final CorrelationTable correlations;
    private final ExecutorService requestExecutor;
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<Consumer<ConnectionSession>> closeListeners = new CopyOnWriteArrayList<>();

    private volatile String identity;

    public ConnectionSession(FrameChannel channel, ActionDispatcher dispatcher, ConfigurationStore configuration,
                             EnvelopeCodec codec, Duration callTimeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.correlations = new CorrelationTable(channel.id());
        this.requestExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ocpp-request-" + channel.id());
            t.setDaemon(true);
            return t;
        });
        LOGGER.info("Opened {} session on connection {}", dispatcher.role(), channel.id());
    }

    public String connectionId() {
        return channel.id();
    }

    public Role role() {
        return dispatcher.role();
    }

    public ConfigurationStore configuration() {
        return configuration;
    }

    public CorrelationTable correlations() {
        return correlations;
    }

    /**
     * Identity the peer announced in its handshake, or {@code null} before the handshake.
     */
    public String identity() {
        return identity;
    }

    public void identity(String identity) {
        this.identity = identity;
    }

    public boolean isOpen() {
        return !closed.get() && channel.isOpen();
    }

    public void onClose(Consumer<ConnectionSession> listener) {
        closeListeners.add(listener);
    }

    public JsonNode call(Action action, JsonNode payload) throws CallFailedException {
        return call(action, payload, callTimeout);
    }

    /**
     * Send a call and block until its reply arrives, the deadline passes, or the connection closes.
     *
     * @return the CallResult payload
     * @throws CallErrorException when the peer answers with a CallError
     */
    public JsonNode call(Action action, JsonNode payload, Duration timeout) throws CallFailedException {
        if (!role().initiates(action)) {
            throw new IllegalArgumentException(role() + " does not issue " + action + " calls");
        }
        if (closed.get()) {
            throw new ConnectionClosedException(channel.id());
        }
        String id = UUID.randomUUID().toString();
        PendingCall pending = correlations.register(id, action);
        try {
            send(Envelope.call(id, action.wireName(), payload));
        } catch (IOException e) {
            correlations.discard(id);
            throw new CallFailedException("Failed to send " + action + " call " + id, e);
        }
        CallOutcome outcome = pending.await(timeout);
        if (outcome.error()) {
            throw new CallErrorException(action, outcome.payload());
        }
        return outcome.payload();
    }

    /**
     * Listener entry point for one inbound text frame.
     */
    public void onFrame(String frame) {
        Wire.rx(channel.id(), frame);
        DecodeResult decoded = codec.decode(frame);
        if (decoded.isMalformed()) {
            LOGGER.warn("Dropping malformed frame on {}: {}", channel.id(), decoded.error());
            return;
        }
        Envelope envelope = decoded.envelope();
        switch (envelope.type()) {
            case CALL -> handleCall(envelope);
            case CALL_RESULT -> correlations.resolve(envelope.id(), envelope.payload(), false);
            case CALL_ERROR -> correlations.resolve(envelope.id(), envelope.payload(), true);
        }
    }

    private void handleCall(Envelope call) {
        try {
            requestExecutor.execute(() -> dispatcher.dispatch(this, call).ifPresent(this::reply));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Session {} is closing, dropping {} call {}", channel.id(), call.action(), call.id());
        }
    }

    private void reply(Envelope reply) {
        try {
            send(reply);
        } catch (IOException e) {
            LOGGER.warn("Unable to send reply {} on {}", reply.id(), channel.id(), e);
        }
    }

    void send(Envelope envelope) throws IOException {
        String frame = codec.encode(envelope);
        sendLock.lock();
        try {
            if (closed.get() || !channel.isOpen()) {
                throw new ConnectionClosedException(channel.id());
            }
            Wire.tx(channel.id(), envelope, frame);
            channel.send(frame);
        } finally {
            sendLock.unlock();
        }
    }

    /**
     * Tear the session down. Runs once: pending calls fail, the channel closes and close listeners fire.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        correlations.failAll(new ConnectionClosedException(channel.id()));
        requestExecutor.shutdownNow();
        try {
            if (!requestExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                LOGGER.warn("Request thread of {} did not stop in time", channel.id());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sendLock.lock();
        try {
            channel.close();
        } finally {
            sendLock.unlock();
        }
        for (Consumer<ConnectionSession> listener : closeListeners) {
            try {
                listener.accept(this);
            } catch (RuntimeException e) {
                LOGGER.warn("Close listener failed for {}", channel.id(), e);
            }
        }
        LOGGER.info("Session {} ({}) closed", channel.id(), identity == null ? "unidentified" : identity);
    }
}
