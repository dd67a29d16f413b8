package dev.miniocpp.protocol.session;

import java.io.IOException;

/**
 * A message-oriented, full-duplex connection carrying text frames. Implementations need not be safe for
 * concurrent sends; {@link ConnectionSession} serializes them.
 */
public interface FrameChannel {

    String id();

    boolean isOpen();

    void send(String frame) throws IOException;

    void close();
}
