package com.peerdrop.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerdrop.channel.PeerChannel;
import com.peerdrop.channel.WebSocketPeerChannel;
import com.peerdrop.config.PeerDropProperties;
import com.peerdrop.dto.SignalMessage;
import com.peerdrop.service.PairingCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Control channel endpoint. Each WebSocket session becomes a {@link PeerChannel}; its JSON frames
 * are handed to the {@link PairingCoordinator}, and its closure (normal, error, or found by the
 * sweep) runs the room teardown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SignalingWebSocketHandler extends TextWebSocketHandler {

	private final PairingCoordinator pairingCoordinator;
	private final ObjectMapper objectMapper;
	private final PeerDropProperties properties;

	private final Map<String, PeerChannel> channels = new ConcurrentHashMap<>();

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		PeerDropProperties.WebSocket ws = properties.getWebsocket();
		PeerChannel channel = new WebSocketPeerChannel(session, objectMapper,
				(int) ws.getSendTimeLimit().toMillis(), (int) ws.getSendBufferSizeLimit().toBytes());
		channels.put(session.getId(), channel);
		pairingCoordinator.channelOpened(channel);
		log.info("WebSocket connection established: {}", session.getId());
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		PeerChannel channel = channels.get(session.getId());
		if (channel == null) {
			log.warn("Message on untracked session {}", session.getId());
			return;
		}

		SignalMessage signal;
		try {
			signal = objectMapper.readValue(message.getPayload(), SignalMessage.class);
		} catch (JsonProcessingException e) {
			log.warn("Ignoring malformed message on session {}: {}", session.getId(), e.getOriginalMessage());
			return;
		}
		if (signal == null || signal.getType() == null) {
			log.debug("Ignoring message without type on session {}", session.getId());
			return;
		}

		try {
			pairingCoordinator.handleMessage(channel, signal);
		} catch (Exception e) {
			log.error("Error processing {} on session {}: {}", signal.getType(), session.getId(), e.getMessage(), e);
		}
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		log.warn("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
		teardown(session.getId());
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		log.info("WebSocket connection closed: {} ({})", session.getId(), status);
		teardown(session.getId());
	}

	/**
	 * Tear down sessions that closed without a close callback reaching us.
	 */
	@Scheduled(fixedRateString = "${peerdrop.websocket.sweep-interval-ms:30000}")
	public void sweepClosedSessions() {
		channels.values().stream()
				.filter(channel -> !channel.isOpen())
				.map(PeerChannel::getId)
				.forEach(id -> {
					log.warn("Session {} is closed but still tracked, tearing down", id);
					teardown(id);
				});
	}

	public int getTrackedSessionCount() {
		return channels.size();
	}

	private void teardown(String sessionId) {
		PeerChannel channel = channels.remove(sessionId);
		if (channel != null) {
			pairingCoordinator.channelClosed(channel);
		}
	}
}
