package dev.miniocpp.central.admin;

/**
 * Body of a configuration change request.
 * @param key configuration key to change
 * @param value new value; numbers are accepted and sent as text
 */
public record ChangeConfigurationRequest(String key, String value) {

}
