package dev.miniocpp.protocol.session;

public final class ConfigurationKeys {

    public static final String HEARTBEAT_INTERVAL = "HeartbeatInterval";
    public static final String CHARGE_POINT_MODEL = "ChargePointModel";
    public static final String CHARGE_POINT_VENDOR = "ChargePointVendor";
    public static final String CHARGE_POINT_SERIAL_NUMBER = "ChargePointSerialNumber";

    private ConfigurationKeys() {
    }
}
