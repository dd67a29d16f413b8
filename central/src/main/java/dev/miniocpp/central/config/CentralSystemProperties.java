package dev.miniocpp.central.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Configuration properties of the central system: where charge points connect, the heartbeat interval handed
 * out at boot, how long outbound calls may wait for a reply and where request schemas live.
 */
@ConfigurationProperties(prefix = "central")
public class CentralSystemProperties {

	/**
	 * WebSocket endpoint path charge points connect to. Sub-paths (for example {@code /ocpp/CP-1}) are accepted
	 * as well.
	 */
	private String endpoint = "/ocpp";

	/**
	 * Heartbeat interval in seconds assigned to charge points in the boot reply.
	 */
	private int heartbeatInterval = 300;

	/**
	 * Maximum time an outbound call waits for its result before failing with a timeout.
	 */
	private Duration callTimeout = Duration.ofSeconds(30);

	/**
	 * Optional directory holding {@code <Action>.json} schema documents. When {@code null}, the schemas bundled
	 * with the protocol module are used.
	 */
	@Nullable
	private String schemaDir;

	/**
	 * Whether payloads of actions without a schema document are accepted.
	 */
	private boolean failOpenOnMissingSchema = false;

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public int getHeartbeatInterval() {
		return heartbeatInterval;
	}

	public void setHeartbeatInterval(int heartbeatInterval) {
		if (heartbeatInterval <= 0) {
			throw new IllegalArgumentException("central.heartbeat-interval must be positive");
		}
		this.heartbeatInterval = heartbeatInterval;
	}

	public Duration getCallTimeout() {
		return callTimeout;
	}

	public void setCallTimeout(Duration callTimeout) {
		this.callTimeout = Objects.requireNonNullElse(callTimeout, Duration.ofSeconds(30));
	}

	@Nullable
	public String getSchemaDir() {
		return schemaDir;
	}

	public void setSchemaDir(@Nullable String schemaDir) {
		this.schemaDir = schemaDir;
	}

	public boolean isFailOpenOnMissingSchema() {
		return failOpenOnMissingSchema;
	}

	public void setFailOpenOnMissingSchema(boolean failOpenOnMissingSchema) {
		this.failOpenOnMissingSchema = failOpenOnMissingSchema;
	}

	/**
	 * Resolve the configured schema directory.
	 * @return normalized schema directory, or {@code null} when only bundled schemas are used
	 */
	@Nullable
	public Path resolveSchemaDir() {
		if (!StringUtils.hasText(this.schemaDir)) {
			return null;
		}
		return Paths.get(this.schemaDir).toAbsolutePath().normalize();
	}

}
