package dev.miniocpp.protocol;

import java.util.Optional;

/**
 * Leading tag of every frame on the wire.
 */
public enum MessageType {

    CALL(2),
    CALL_RESULT(3),
    CALL_ERROR(4);

    private final int tag;

    MessageType(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    /**
     * Minimum number of array elements a frame of this type carries.
     */
    public int minimumLength() {
        return this == CALL ? 4 : 3;
    }

    public static Optional<MessageType> fromTag(int tag) {
        for (MessageType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
