package dev.miniocpp.protocol.rpc;

import dev.miniocpp.protocol.Action;
import java.time.Duration;

public class CallTimeoutException extends CallFailedException {

    public CallTimeoutException(Action action, String id, Duration timeout) {
        super("No reply to " + action + " call " + id + " within " + timeout);
    }
}
