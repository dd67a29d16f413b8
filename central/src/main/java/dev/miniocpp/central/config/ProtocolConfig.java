package dev.miniocpp.central.config;

import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.miniocpp.central.handler.CentralActionHandler;
import dev.miniocpp.protocol.EnvelopeCodec;
import dev.miniocpp.protocol.Role;
import dev.miniocpp.protocol.rpc.ActionDispatcher;
import dev.miniocpp.protocol.validation.JsonSchemaValidator;
import dev.miniocpp.protocol.validation.SchemaValidator;

/**
 * Spring configuration assembling the protocol core for the central role: codec, schema validation and the
 * dispatcher that routes inbound calls to {@link CentralActionHandler}.
 */
@Configuration
@EnableConfigurationProperties(CentralSystemProperties.class)
public class ProtocolConfig {

	private static final Logger logger = LoggerFactory.getLogger(ProtocolConfig.class);

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
		return new EnvelopeCodec(objectMapper);
	}

	/**
	 * Build the schema validator, preferring the configured schema directory over the bundled schemas.
	 * @param properties central system properties
	 * @return validator used by the inbound handlers
	 */
	@Bean
	public SchemaValidator schemaValidator(CentralSystemProperties properties) {
		logger.info("Validating payloads against schemas in {} (fail open on missing schema: {})",
				properties.resolveSchemaDir() != null ? properties.resolveSchemaDir() : "classpath:schemas",
				properties.isFailOpenOnMissingSchema());
		return new JsonSchemaValidator(properties.resolveSchemaDir(), properties.isFailOpenOnMissingSchema());
	}

	@Bean
	public ActionDispatcher centralDispatcher(CentralActionHandler actionHandler, EnvelopeCodec envelopeCodec) {
		return new ActionDispatcher(Role.CENTRAL, actionHandler, envelopeCodec);
	}

}
