package dev.miniocpp.central.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import dev.miniocpp.central.transport.CentralWebSocketHandler;

/**
 * Registers the charge point WebSocket handler with the servlet container.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

	private final CentralWebSocketHandler webSocketHandler;

	private final CentralSystemProperties properties;

	public WebSocketConfig(CentralWebSocketHandler webSocketHandler, CentralSystemProperties properties) {
		this.webSocketHandler = webSocketHandler;
		this.properties = properties;
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(this.webSocketHandler, this.properties.getEndpoint(), this.properties.getEndpoint() + "/*")
			.setAllowedOrigins("*");
	}

}
