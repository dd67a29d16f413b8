package dev.miniocpp.protocol;

import java.util.Objects;

/**
 * Outcome of decoding one frame: either an {@link Envelope} or the reason the frame was malformed.
 */
public final class DecodeResult {

    private final Envelope envelope;
    private final String error;

    private DecodeResult(Envelope envelope, String error) {
        this.envelope = envelope;
        this.error = error;
    }

    static DecodeResult decoded(Envelope envelope) {
        return new DecodeResult(Objects.requireNonNull(envelope, "envelope"), null);
    }

    static DecodeResult malformed(String error) {
        return new DecodeResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isMalformed() {
        return envelope == null;
    }

    public Envelope envelope() {
        if (envelope == null) {
            throw new IllegalStateException("Malformed frame has no envelope: " + error);
        }
        return envelope;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return isMalformed() ? "MalformedFrame[" + error + "]" : envelope.toString();
    }
}
