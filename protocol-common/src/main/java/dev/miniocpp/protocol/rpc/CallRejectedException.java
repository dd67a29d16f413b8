package dev.miniocpp.protocol.rpc;

import dev.miniocpp.protocol.ErrorCode;
import java.util.Objects;

/**
 * Thrown by an {@link ActionHandler} to answer an inbound call with a CallError.
 */
public class CallRejectedException extends Exception {

    private final ErrorCode errorCode;

    public CallRejectedException(ErrorCode errorCode, String description) {
        super(description);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
