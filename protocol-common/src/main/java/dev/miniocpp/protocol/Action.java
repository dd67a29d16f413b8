package dev.miniocpp.protocol;

import java.util.Optional;

/**
 * The closed set of actions this protocol knows about.
 */
public enum Action {

    BOOT_NOTIFICATION("BootNotification"),
    HEARTBEAT("Heartbeat"),
    GET_CONFIGURATION("GetConfiguration"),
    CHANGE_CONFIGURATION("ChangeConfiguration");

    private final String wireName;

    Action(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Action> fromWireName(String name) {
        for (Action action : values()) {
            if (action.wireName.equals(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
