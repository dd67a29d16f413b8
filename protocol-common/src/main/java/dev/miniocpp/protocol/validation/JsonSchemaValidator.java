package dev.miniocpp.protocol.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaValidator} backed by JSON Schema (draft 2020-12) documents named {@code <Action>.json}. Documents
 * are looked up in the configured directory first, then under {@code schemas/} on the classpath. Loaded documents
 * are cached.
 */
public class JsonSchemaValidator implements SchemaValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonSchemaValidator.class);

    private static final String CLASSPATH_ROOT = "schemas/";

    private final Path schemaDirectory;
    private final boolean failOpen;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<String, JsonSchema> schemas = new ConcurrentHashMap<>();

    /**
     * @param schemaDirectory directory holding schema documents, or {@code null} to use the bundled ones only
     * @param failOpen whether a payload passes when no schema exists for its action
     */
    public JsonSchemaValidator(Path schemaDirectory, boolean failOpen) {
        this.schemaDirectory = schemaDirectory == null ? null : schemaDirectory.toAbsolutePath().normalize();
        this.failOpen = failOpen;
    }

    @Override
    public boolean validate(String actionName, JsonNode payload) {
        // Only loaded schemas are cached; a missing one is looked up again on the next call.
        Optional<JsonSchema> schema = Optional.ofNullable(schemas.get(actionName)).or(() -> load(actionName));
        schema.ifPresent(loaded -> schemas.putIfAbsent(actionName, loaded));
        if (schema.isEmpty()) {
            LOGGER.error("No schema found for {}, {} payload", actionName, failOpen ? "accepting" : "rejecting");
            return failOpen;
        }
        Set<ValidationMessage> errors = schema.get().validate(payload);
        if (!errors.isEmpty()) {
            LOGGER.warn("Validation error for {}: {}", actionName,
                errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; ")));
            return false;
        }
        LOGGER.debug("Validation successful: {}", actionName);
        return true;
    }

    private Optional<JsonSchema> load(String actionName) {
        String fileName = actionName + ".json";
        if (schemaDirectory != null) {
            Path candidate = schemaDirectory.resolve(fileName).normalize();
            if (candidate.startsWith(schemaDirectory) && Files.isRegularFile(candidate)) {
                try (InputStream in = Files.newInputStream(candidate)) {
                    return Optional.of(factory.getSchema(in));
                } catch (IOException e) {
                    LOGGER.error("Unable to read schema file {}", candidate, e);
                    return Optional.empty();
                }
            }
        }
        InputStream bundled = JsonSchemaValidator.class.getClassLoader().getResourceAsStream(CLASSPATH_ROOT + fileName);
        if (bundled == null) {
            return Optional.empty();
        }
        try (InputStream in = bundled) {
            return Optional.of(factory.getSchema(in));
        } catch (IOException e) {
            LOGGER.error("Unable to read bundled schema {}", fileName, e);
            return Optional.empty();
        }
    }
}
