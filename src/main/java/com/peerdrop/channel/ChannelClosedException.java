package com.peerdrop.channel;

import java.io.IOException;

/**
 * Thrown when a message is pushed to a channel whose connection has already closed.
 */
public class ChannelClosedException extends IOException {

	public ChannelClosedException(String channelId) {
		super("Channel " + channelId + " is closed");
	}

}
