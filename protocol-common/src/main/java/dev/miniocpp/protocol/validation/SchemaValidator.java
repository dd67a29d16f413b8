package dev.miniocpp.protocol.validation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a call payload against the schema registered for its action.
 */
@FunctionalInterface
public interface SchemaValidator {

    boolean validate(String actionName, JsonNode payload);

    static SchemaValidator acceptAll() {
        return (actionName, payload) -> true;
    }
}
