package dev.miniocpp.point;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import dev.miniocpp.protocol.Envelope;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.validation.JsonSchemaValidator;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChargePointTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final RecordingFrameChannel channel = new RecordingFrameChannel("test-socket");
    private ChargePoint chargePoint;
    private ConnectionSession session;

    @BeforeEach
    void attach() {
        PointSettings settings = new PointSettings(URI.create("ws://localhost:9000/ocpp"), "BestModel", "BestVendor",
            "12345", Duration.ofSeconds(2), null);
        chargePoint = new ChargePoint(settings, new JsonSchemaValidator(null, false));
        session = chargePoint.attach(channel);
    }

    @AfterEach
    void close() {
        chargePoint.close();
    }

    private CompletableFuture<JsonNode> bootAsync() {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return chargePoint.bootNotification();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
    }

    @Test
    void acceptedBootAdoptsTheAssignedInterval() throws Exception {
        CompletableFuture<JsonNode> boot = bootAsync();

        Envelope sent = codec.decode(channel.next()).envelope();
        assertThat(sent.action()).isEqualTo("BootNotification");
        assertThat(sent.payload().path("chargePointSerialNumber").asText()).isEqualTo("12345");
        assertThat(sent.payload().path("chargePointModel").asText()).isEqualTo("BestModel");
        assertThat(sent.payload().path("chargePointVendor").asText()).isEqualTo("BestVendor");

        session.onFrame("[3,\"" + sent.id() + "\",{\"status\":\"Accepted\",\"currentTime\":\"2024-05-01T10:00:00Z\","
            + "\"interval\":45}]");

        assertThat(boot.get(2, TimeUnit.SECONDS).path("status").asText()).isEqualTo("Accepted");
        assertThat(chargePoint.configuration().intValue(ConfigurationKeys.HEARTBEAT_INTERVAL)).isEqualTo(45);
        assertThat(chargePoint.heartbeatInterval()).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void bootThatIsNotAcceptedFails() throws Exception {
        CompletableFuture<JsonNode> boot = bootAsync();

        Envelope sent = codec.decode(channel.next()).envelope();
        session.onFrame("[3,\"" + sent.id() + "\",{\"status\":\"Rejected\",\"currentTime\":\"2024-05-01T10:00:00Z\","
            + "\"interval\":45}]");

        assertThatThrownBy(() -> boot.get(2, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasMessageContaining("Rejected");
        assertThat(chargePoint.configuration().intValue(ConfigurationKeys.HEARTBEAT_INTERVAL)).isEqualTo(30);
    }

    @Test
    void answersGetConfigurationFromItsStore() throws Exception {
        session.onFrame("[2,\"c-1\",\"GetConfiguration\",{\"key\":[\"ChargePointSerialNumber\"]}]");

        JsonNode reply = codec.mapper().readTree(channel.next());
        JsonNode entry = reply.get(2).path("configurationKey").get(0);
        assertThat(entry.path("key").asText()).isEqualTo("ChargePointSerialNumber");
        assertThat(entry.path("value").asText()).isEqualTo("12345");
        assertThat(entry.path("readonly").asBoolean()).isTrue();
    }

    @Test
    void heartbeatFailureIsNotFatal() {
        session.close();

        chargePoint.heartbeat();

        assertThat(session.isOpen()).isFalse();
    }

    @Test
    void closingTheSessionStopsHeartbeats() throws Exception {
        chargePoint.configuration().set(ConfigurationKeys.HEARTBEAT_INTERVAL, 1);
        chargePoint.startHeartbeats();

        Envelope first = codec.decode(channel.next()).envelope();
        assertThat(first.action()).isEqualTo("Heartbeat");
        session.onFrame("[3,\"" + first.id() + "\",{\"currentTime\":\"2024-05-01T10:00:00Z\"}]");
        assertThat(chargePoint.heartbeatsRunning()).isTrue();

        session.close();

        assertThat(chargePoint.heartbeatsRunning()).isFalse();
        assertThat(channel.poll(1500)).isNull();
    }

    @Test
    void heartbeatIntervalIsAtLeastOneSecond() {
        chargePoint.configuration().set(ConfigurationKeys.HEARTBEAT_INTERVAL, 0);

        assertThat(chargePoint.heartbeatInterval()).isEqualTo(Duration.ofSeconds(1));
    }
}
