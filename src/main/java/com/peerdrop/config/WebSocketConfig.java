package com.peerdrop.config;

import com.peerdrop.handler.SignalingWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import jakarta.annotation.PostConstruct;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

	private final SignalingWebSocketHandler signalingWebSocketHandler;
	private final PeerDropProperties properties;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		// Plain WebSocket with JSON text frames, no STOMP or SockJS
		registry.addHandler(signalingWebSocketHandler, properties.getWebsocket().getPath())
				.setAllowedOriginPatterns(properties.getWebsocket().getAllowedOriginPatterns());
	}

	/**
	 * Container-level limits for the signaling endpoint. Control frames are small; the file itself
	 * never travels over the socket.
	 * <p>
	 * Needs a running servlet container, so web tests use a real port rather than a mock environment.
	 */
	@Bean
	public ServletServerContainerFactoryBean createWebSocketContainer() {
		PeerDropProperties.WebSocket ws = properties.getWebsocket();
		ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
		container.setMaxTextMessageBufferSize((int) ws.getMaxTextMessageSize().toBytes());
		container.setMaxBinaryMessageBufferSize((int) ws.getMaxTextMessageSize().toBytes());
		container.setMaxSessionIdleTimeout(ws.getIdleTimeout().toMillis());
		container.setAsyncSendTimeout(ws.getSendTimeLimit().toMillis());
		return container;
	}

	@PostConstruct
	public void logWebSocketConfig() {
		PeerDropProperties.WebSocket ws = properties.getWebsocket();
		log.info("=== WebSocket Configuration Summary ===");
		log.info("Endpoint: {} (origins={})", ws.getPath(), String.join(",", ws.getAllowedOriginPatterns()));
		log.info("Limits: maxTextMessageSize={}, sendBufferSizeLimit={}, sendTimeLimit={}, idleTimeout={}",
				ws.getMaxTextMessageSize(), ws.getSendBufferSizeLimit(), ws.getSendTimeLimit(), ws.getIdleTimeout());
		log.info("========================================");
	}

}
