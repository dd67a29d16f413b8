package dev.miniocpp.protocol.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload that resolved a pending call, flagged when it arrived in a CallError frame.
 */
public record CallOutcome(JsonNode payload, boolean error) {
}
