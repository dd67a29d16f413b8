package dev.miniocpp.protocol.rpc;

import java.io.IOException;

/**
 * An outbound call did not produce a result payload.
 */
public class CallFailedException extends IOException {

    public CallFailedException(String message) {
        super(message);
    }

    public CallFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
