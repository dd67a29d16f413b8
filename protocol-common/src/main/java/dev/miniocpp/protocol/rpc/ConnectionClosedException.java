package dev.miniocpp.protocol.rpc;

public class ConnectionClosedException extends CallFailedException {

    public ConnectionClosedException(String connectionId) {
        super("Connection " + connectionId + " closed");
    }
}
