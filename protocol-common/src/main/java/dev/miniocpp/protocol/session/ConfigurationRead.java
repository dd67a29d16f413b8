package dev.miniocpp.protocol.session;

import java.util.List;

/**
 * Result of reading a set of keys: entries that exist, in request order, and the names that do not.
 */
public record ConfigurationRead(List<ConfigEntry> known, List<String> unknown) {

    public ConfigurationRead {
        known = List.copyOf(known);
        unknown = List.copyOf(unknown);
    }
}
