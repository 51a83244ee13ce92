package com.peerdrop.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.peerdrop.dto.SignalMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link PeerChannel} backed by a Spring {@link WebSocketSession}.
 * Sends are serialized through {@link ConcurrentWebSocketSessionDecorator}, so the relay's
 * request threads and the session's own thread can push at the same time.
 */
@Slf4j
public class WebSocketPeerChannel implements PeerChannel {

	private final WebSocketSession session;
	private final ObjectMapper objectMapper;

	public WebSocketPeerChannel(WebSocketSession session, ObjectMapper objectMapper,
			int sendTimeLimitMs, int bufferSizeLimit) {
		this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
		this.objectMapper = objectMapper;
	}

	@Override
	public String getId() {
		return session.getId();
	}

	@Override
	public void send(SignalMessage message) throws IOException {
		if (!session.isOpen()) {
			throw new ChannelClosedException(getId());
		}
		String json = objectMapper.writeValueAsString(message);
		session.sendMessage(new TextMessage(json));
		log.debug("Sent {} to session {}", message.getType(), getId());
	}

	@Override
	public boolean isOpen() {
		return session.isOpen();
	}

	@Override
	public String toString() {
		return "WebSocketPeerChannel[" + getId() + "]";
	}
}
