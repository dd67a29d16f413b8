package dev.miniocpp.central.admin;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;

import dev.miniocpp.central.service.PointCommandService;
import dev.miniocpp.protocol.rpc.CallFailedException;

/**
 * Administrative HTTP facade for reading and changing the configuration of connected charge points.
 */
@RestController
@RequestMapping("/api/points")
@RequiredArgsConstructor
public class ConfigurationController {

	private final PointCommandService pointCommandService;

	@GetMapping
	public Map<String, Object> connectedPoints() {
		return Map.of("points", this.pointCommandService.connectedPoints());
	}

	@GetMapping("/{identity}/configuration")
	public JsonNode getConfiguration(@PathVariable("identity") String identity,
			@RequestParam(name = "key", required = false) List<String> keys) throws CallFailedException {
		return this.pointCommandService.getConfiguration(identity, keys == null ? List.of() : keys);
	}

	@PostMapping("/{identity}/configuration")
	public JsonNode changeConfiguration(@PathVariable("identity") String identity,
			@RequestBody ChangeConfigurationRequest request) throws CallFailedException {
		if (!StringUtils.hasText(request.key())) {
			throw new IllegalArgumentException("key is required");
		}
		if (request.value() == null) {
			throw new IllegalArgumentException("value is required");
		}
		return this.pointCommandService.changeConfiguration(identity, request.key(), request.value());
	}

}
