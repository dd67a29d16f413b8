package dev.miniocpp.point.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.miniocpp.point.RecordingFrameChannel;
import dev.miniocpp.protocol.Action;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.ErrorCode;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.rpc.CallRejectedException;
import dev.miniocpp.protocol.session.ConfigurationKeys;
import dev.miniocpp.protocol.session.ConfigurationStore;
import dev.miniocpp.protocol.session.ConnectionSession;
import dev.miniocpp.protocol.validation.JsonSchemaValidator;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PointActionHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PointActionHandler handler = new PointActionHandler(new JsonSchemaValidator(null, false), mapper);
    private ConfigurationStore store;
    private ConnectionSession session;

    @BeforeEach
    void openSession() {
        store = ConfigurationStore.builder()
            .integer(ConfigurationKeys.HEARTBEAT_INTERVAL, 30, false)
            .build();
        EnvelopeCodec codec = new EnvelopeCodec(mapper);
        session = new ConnectionSession(new RecordingFrameChannel("handler-test"), new ActionDispatcher(Role.POINT, handler, codec),
            store, codec, Duration.ofSeconds(1));
    }

    @AfterEach
    void closeSession() {
        session.close();
    }

    @Test
    void getConfigurationSplitsKnownAndUnknownKeys() throws Exception {
        JsonNode reply = handler.handle(Action.GET_CONFIGURATION, session,
            mapper.readTree("{\"key\":[\"HeartbeatInterval\",\"Nonexistent\"]}"));

        assertThat(reply).isEqualTo(mapper.readTree("{\"configurationKey\":[{\"key\":\"HeartbeatInterval\","
            + "\"readonly\":false,\"value\":30}],\"unknownKey\":[\"Nonexistent\"]}"));
    }

    @Test
    void getConfigurationWithoutKeysReturnsEverything() throws Exception {
        JsonNode reply = handler.handle(Action.GET_CONFIGURATION, session, mapper.createObjectNode());

        assertThat(reply.path("configurationKey")).hasSize(1);
        assertThat(reply.path("unknownKey")).isEmpty();
    }

    @Test
    void changeConfigurationUpdatesIntegerKey() throws Exception {
        JsonNode reply = handler.handle(Action.CHANGE_CONFIGURATION, session,
            mapper.readTree("{\"key\":\"HeartbeatInterval\",\"value\":\"60\"}"));

        assertThat(reply.path("status").asText()).isEqualTo("Accepted");
        assertThat(store.get("HeartbeatInterval")).get().satisfies(entry -> assertThat(entry.value()).isEqualTo(60));
    }

    @Test
    void changeConfigurationOfUnknownKeyIsRejected() throws Exception {
        JsonNode reply = handler.handle(Action.CHANGE_CONFIGURATION, session,
            mapper.readTree("{\"key\":\"NoSuchKey\",\"value\":\"60\"}"));

        assertThat(reply.path("status").asText()).isEqualTo("Rejected");
        assertThat(store.entries()).hasSize(1);
        assertThat(store.intValue("HeartbeatInterval")).isEqualTo(30);
    }

    @Test
    void invalidChangeLeavesStoreUntouched() {
        assertThatThrownBy(() -> handler.handle(Action.CHANGE_CONFIGURATION, session,
            mapper.readTree("{\"value\":\"60\"}")))
            .isInstanceOf(CallRejectedException.class)
            .satisfies(e -> assertThat(((CallRejectedException) e).errorCode())
                .isEqualTo(ErrorCode.FORMATION_VIOLATION));
        assertThat(store.intValue("HeartbeatInterval")).isEqualTo(30);
    }

    @Test
    void centralActionsAreNotSupported() {
        assertThatThrownBy(() -> handler.handle(Action.HEARTBEAT, session, mapper.createObjectNode()))
            .isInstanceOf(CallRejectedException.class)
            .satisfies(e -> assertThat(((CallRejectedException) e).errorCode()).isEqualTo(ErrorCode.NOT_SUPPORTED));
    }
}
