package dev.miniocpp.protocol;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which side of the connection a session plays, and therefore which actions it answers and which it issues.
 */
public enum Role {

    CENTRAL(EnumSet.of(Action.BOOT_NOTIFICATION, Action.HEARTBEAT),
        EnumSet.of(Action.GET_CONFIGURATION, Action.CHANGE_CONFIGURATION)),
    POINT(EnumSet.of(Action.GET_CONFIGURATION, Action.CHANGE_CONFIGURATION),
        EnumSet.of(Action.BOOT_NOTIFICATION, Action.HEARTBEAT));

    private final Set<Action> inbound;
    private final Set<Action> outbound;

    Role(Set<Action> inbound, Set<Action> outbound) {
        this.inbound = Collections.unmodifiableSet(inbound);
        this.outbound = Collections.unmodifiableSet(outbound);
    }

    public boolean accepts(Action action) {
        return inbound.contains(action);
    }

    public boolean initiates(Action action) {
        return outbound.contains(action);
    }

    public Set<Action> inbound() {
        return inbound;
    }

    public Set<Action> outbound() {
        return outbound;
    }
}
