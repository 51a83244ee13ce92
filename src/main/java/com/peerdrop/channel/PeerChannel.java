package com.peerdrop.channel;

import com.peerdrop.dto.SignalMessage;

import java.io.IOException;

/**
 * Outbound side of one peer's control connection.
 * Rooms hold these as non-owning references; the transport owns the connection.
 */
public interface PeerChannel {

	String getId();

	/**
	 * Push a signal message to the peer.
	 *
	 * @throws ChannelClosedException if the connection is already gone
	 * @throws IOException if the write fails
	 */
	void send(SignalMessage message) throws IOException;

	boolean isOpen();

}
