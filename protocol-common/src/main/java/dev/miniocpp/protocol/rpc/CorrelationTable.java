package dev.miniocpp.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Action;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-connection map from call id to the call waiting for its reply. Each id resolves exactly once.
 */
public final class CorrelationTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationTable.class);

    private final String connectionId;
    private final Clock clock;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();

    public CorrelationTable(String connectionId) {
        this(connectionId, Clock.systemUTC());
    }

    public CorrelationTable(String connectionId, Clock clock) {
        this.connectionId = connectionId;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PendingCall register(String id, Action action) {
        PendingCall call = new PendingCall(this, id, action, clock.instant());
        if (pending.putIfAbsent(id, call) != null) {
            throw new IllegalStateException("Call id " + id + " is already outstanding on " + connectionId);
        }
        return call;
    }

    /**
     * Wake the call registered under {@code id}. Unknown or already resolved ids are logged and dropped.
     *
     * @return {@code true} when a waiting call was resolved
     */
    public boolean resolve(String id, JsonNode payload, boolean error) {
        PendingCall call = pending.remove(id);
        if (call == null) {
            LOGGER.warn("No pending call for id {} on {}, dropping {}", id, connectionId, error ? "error" : "result");
            return false;
        }
        LOGGER.debug("Resolved {} call {} on {}", call.action(), id, connectionId);
        return call.complete(new CallOutcome(payload, error));
    }

    /**
     * Remove a call without resolving it, e.g. when its send failed or its deadline passed.
     */
    boolean withdraw(PendingCall call) {
        return pending.remove(call.id(), call);
    }

    public boolean discard(String id) {
        return pending.remove(id) != null;
    }

    /**
     * Fail every outstanding call, typically because the connection closed.
     */
    public void failAll(CallFailedException cause) {
        List<PendingCall> calls = new ArrayList<>(pending.values());
        for (PendingCall call : calls) {
            if (pending.remove(call.id(), call)) {
                call.fail(cause);
            }
        }
        if (!calls.isEmpty()) {
            LOGGER.info("Failed {} pending call(s) on {}: {}", calls.size(), connectionId, cause.getMessage());
        }
    }

    public int size() {
        return pending.size();
    }

    public boolean isPending(String id) {
        return pending.containsKey(id);
    }
}
