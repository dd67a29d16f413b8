package dev.miniocpp.protocol.session;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value configuration of one session. The set of keys is fixed when the store is built; calls may update
 * values but never add keys. All access is synchronized on the store.
 */
public final class ConfigurationStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationStore.class);

    private final Map<String, ConfigEntry> entries;

    private ConfigurationStore(Map<String, ConfigEntry> entries) {
        this.entries = entries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConfigurationStore empty() {
        return builder().build();
    }

    public synchronized Optional<ConfigEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized List<ConfigEntry> entries() {
        return List.copyOf(entries.values());
    }

    /**
     * Partition {@code keys} into known entries and unknown names. An empty request reads every entry.
     */
    public synchronized ConfigurationRead read(Collection<String> keys) {
        if (keys.isEmpty()) {
            return new ConfigurationRead(new ArrayList<>(entries.values()), List.of());
        }
        List<ConfigEntry> known = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String key : new LinkedHashSet<>(keys)) {
            ConfigEntry entry = entries.get(key);
            if (entry != null) {
                known.add(entry);
            } else {
                unknown.add(key);
            }
        }
        return new ConfigurationRead(known, unknown);
    }

    /**
     * Apply a change requested by the peer. The raw value is coerced to the entry's declared type.
     */
    public synchronized ChangeStatus change(String key, String rawValue) {
        ConfigEntry entry = entries.get(key);
        if (entry == null) {
            LOGGER.warn("Rejecting change of unknown key {}", key);
            return ChangeStatus.REJECTED;
        }
        if (entry.readonly()) {
            LOGGER.warn("Rejecting change of readonly key {}", key);
            return ChangeStatus.REJECTED;
        }
        Optional<Object> coerced = coerce(entry.type(), rawValue);
        if (coerced.isEmpty()) {
            LOGGER.warn("Rejecting value '{}' for {} key {}", rawValue, entry.type(), key);
            return ChangeStatus.REJECTED;
        }
        entries.put(key, entry.withValue(coerced.get()));
        LOGGER.info("Configuration {} changed from {} to {}", key, entry.value(), coerced.get());
        return ChangeStatus.ACCEPTED;
    }

    /**
     * Local update that bypasses the readonly flag, e.g. applying the interval assigned at boot.
     */
    public synchronized void set(String key, Object value) {
        ConfigEntry entry = entries.get(key);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown configuration key " + key);
        }
        entries.put(key, entry.withValue(value));
    }

    public synchronized int intValue(String key) {
        ConfigEntry entry = entries.get(key);
        if (entry == null || entry.type() != ConfigEntry.Type.INTEGER) {
            throw new IllegalArgumentException("No integer configuration key " + key);
        }
        return (Integer) entry.value();
    }

    private static Optional<Object> coerce(ConfigEntry.Type type, String rawValue) {
        if (rawValue == null) {
            return Optional.empty();
        }
        return switch (type) {
            case STRING -> Optional.of(rawValue);
            case INTEGER -> {
                try {
                    yield Optional.of(Integer.parseInt(rawValue.trim()));
                } catch (NumberFormatException e) {
                    yield Optional.empty();
                }
            }
        };
    }

    public static final class Builder {

        private final Map<String, ConfigEntry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder integer(String key, int value, boolean readonly) {
            return entry(ConfigEntry.integer(key, value, readonly));
        }

        public Builder string(String key, String value, boolean readonly) {
            return entry(ConfigEntry.string(key, value, readonly));
        }

        public Builder entry(ConfigEntry entry) {
            if (entries.putIfAbsent(entry.key(), entry) != null) {
                throw new IllegalArgumentException("Duplicate configuration key " + entry.key());
            }
            return this;
        }

        public ConfigurationStore build() {
            return new ConfigurationStore(new LinkedHashMap<>(entries));
        }
    }
}
