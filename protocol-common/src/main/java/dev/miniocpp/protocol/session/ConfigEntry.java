package dev.miniocpp.protocol.session;

import java.util.Objects;

/**
 * One configuration key with its current value.
 * @param key configuration key
 * @param type declared value type, fixed for the lifetime of the key
 * @param value current value, an {@link Integer} or a {@link String} according to {@code type}
 * @param readonly {@code true} when the peer may read but not change the key
 */
public record ConfigEntry(String key, Type type, Object value, boolean readonly) {

    public enum Type {
        INTEGER, STRING
    }

    public ConfigEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        if (type == Type.INTEGER && !(value instanceof Integer)) {
            throw new IllegalArgumentException("Key " + key + " expects an integer value, got " + value);
        }
        if (type == Type.STRING && !(value instanceof String)) {
            throw new IllegalArgumentException("Key " + key + " expects a string value, got " + value);
        }
    }

    public static ConfigEntry integer(String key, int value, boolean readonly) {
        return new ConfigEntry(key, Type.INTEGER, value, readonly);
    }

    public static ConfigEntry string(String key, String value, boolean readonly) {
        return new ConfigEntry(key, Type.STRING, value, readonly);
    }

    ConfigEntry withValue(Object newValue) {
        return new ConfigEntry(key, type, newValue, readonly);
    }
}
