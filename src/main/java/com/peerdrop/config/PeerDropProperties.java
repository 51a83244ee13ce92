package com.peerdrop.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings bound from {@code peerdrop.*} in application.properties.
 */
@Data
@ConfigurationProperties(prefix = "peerdrop")
public class PeerDropProperties {

	private Code code = new Code();
	private WebSocket websocket = new WebSocket();

	@Data
	public static class Code {

		/** Number of characters in a room code. */
		private int length = 5;

		/** Characters a room code is drawn from. */
		private String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

		/** Collisions tolerated before an allocation is refused. */
		private int maxAttempts = 100;
	}

	@Data
	public static class WebSocket {

		private String path = "/ws";

		private String[] allowedOriginPatterns = {"*"};

		private Duration sendTimeLimit = Duration.ofSeconds(15);

		private DataSize sendBufferSizeLimit = DataSize.ofKilobytes(64);

		private DataSize maxTextMessageSize = DataSize.ofKilobytes(64);

		/** Idle connections are closed by the container after this long. */
		private Duration idleTimeout = Duration.ofMinutes(30);
	}

}
