package dev.miniocpp.point;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of one charge point process, parsed from {@code --name value} command-line arguments.
 */
public record PointSettings(
    URI uri,
    String model,
    String vendor,
    String serialNumber,
    Duration callTimeout,
    Path schemaDir
) {

    static final List<String> REQUIRED = List.of("uri", "model", "vendor", "serial_number");

    public PointSettings {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(serialNumber, "serialNumber");
        Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public static PointSettings parse(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("Missing value for --" + name);
            }
            options.put(name, value);
        }
        for (String required : REQUIRED) {
            String value = options.get(required);
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("--" + required + " is required");
            }
        }
        Duration callTimeout = Duration.ofSeconds(30);
        if (options.containsKey("call_timeout")) {
            try {
                callTimeout = Duration.ofSeconds(Long.parseLong(options.get("call_timeout")));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--call_timeout must be a number of seconds");
            }
            if (callTimeout.isNegative() || callTimeout.isZero()) {
                throw new IllegalArgumentException("--call_timeout must be a positive number of seconds");
            }
        }
        Path schemaDir = options.containsKey("schema_dir") ? Paths.get(options.get("schema_dir")) : null;
        return new PointSettings(URI.create(options.get("uri")), options.get("model"), options.get("vendor"),
            options.get("serial_number"), callTimeout, schemaDir);
    }
}
