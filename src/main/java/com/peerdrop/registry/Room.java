package com.peerdrop.registry;

import com.peerdrop.channel.PeerChannel;
import com.peerdrop.model.Payload;
import com.peerdrop.model.PeerRole;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One pairing between a sender and a receiver. Only touched under the registry lock.
 */
@Getter
class Room {

	private final String code;
	private final PeerChannel senderChannel;
	private final Instant createdAt = Instant.now();

	@Setter
	private PeerChannel receiverChannel;

	@Setter
	private Payload payload;

	Room(String code, PeerChannel senderChannel) {
		this.code = code;
		this.senderChannel = senderChannel;
	}

	PeerChannel getChannel(PeerRole role) {
		return role == PeerRole.SENDER ? senderChannel : receiverChannel;
	}

	boolean hasReceiver() {
		return receiverChannel != null;
	}
}
