package dev.miniocpp.protocol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that central and point logs line up.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_BODY = 200;

    private Wire() {
    }

    public static void rx(String connectionId, String frame) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} frame={}", connectionId, truncate(frame, MAX_BODY));
        }
    }

    public static void tx(String connectionId, Envelope envelope, String frame) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} type={} id={} action={} frame={}",
                connectionId,
                envelope.type(),
                envelope.id(),
                envelope.action(),
                truncate(frame, MAX_BODY));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
