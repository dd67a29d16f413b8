package dev.miniocpp.point;

import dev.miniocpp.protocol.validation.JsonSchemaValidator;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        PointSettings settings;
        try {
            settings = PointSettings.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        try (ChargePoint chargePoint = new ChargePoint(settings, new JsonSchemaValidator(settings.schemaDir(), false))) {
            Runtime.getRuntime().addShutdownHook(new Thread(chargePoint::close, "charge-point-shutdown"));
            chargePoint.run();
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar point.jar --uri <ws-uri> --model <model> --vendor <vendor>"
            + " --serial_number <serial> [--call_timeout <seconds>] [--schema_dir <dir>]\n"
            + "Example:\n"
            + "  --uri ws://localhost:9000/ocpp --model BestModel --vendor BestVendor --serial_number 12345");
    }
}
