package dev.miniocpp.protocol.rpc;

import dev.miniocpp.protocol.Action;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An outstanding call waiting for its CallResult or CallError. Completed at most once, by
 * {@link CorrelationTable}.
 */
public final class PendingCall {

    private final CorrelationTable owner;
    private final String id;
    private final Action action;
    private final Instant createdAt;
    private final CompletableFuture<CallOutcome> waiter = new CompletableFuture<>();

    PendingCall(CorrelationTable owner, String id, Action action, Instant createdAt) {
        this.owner = owner;
        this.id = id;
        this.action = action;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public Action action() {
        return action;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isDone() {
        return waiter.isDone();
    }

    boolean complete(CallOutcome outcome) {
        return waiter.complete(outcome);
    }

    boolean fail(CallFailedException cause) {
        return waiter.completeExceptionally(cause);
    }

    /**
     * Block until the call is resolved. On expiry the call is withdrawn from its table so a late reply is
     * treated as unmatched.
     */
    public CallOutcome await(Duration timeout) throws CallFailedException {
        try {
            try {
                return waiter.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (owner.withdraw(this)) {
                    throw new CallTimeoutException(action, id, timeout);
                }
                // Already taken out of the table by a resolver that is completing the waiter.
                return waiter.get();
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CallFailedException failure) {
                throw failure;
            }
            throw new CallFailedException(action + " call " + id + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            owner.withdraw(this);
            throw new CallFailedException("Interrupted while awaiting " + action + " call " + id, e);
        }
    }
}
