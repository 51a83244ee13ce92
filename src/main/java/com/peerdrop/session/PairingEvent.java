package com.peerdrop.session;

import com.peerdrop.model.PeerRole;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Input to {@link PairingStateMachine}. Fields other than {@code type} are set only where the
 * type needs them.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PairingEvent {

	public enum Type {
		ROOM_CREATED,
		REGISTRATION_REJECTED,
		JOIN_ACCEPTED,
		JOIN_REJECTED,
		RECEIVER_JOINED,
		PAYLOAD_READY,
		PAYLOAD_DELIVERED,
		PEER_DISCONNECTED,
		CHANNEL_CLOSED
	}

	Type type;
	String code;
	String message;
	String filename;
	long filesize;
	PeerRole peerRole;

	public static PairingEvent roomCreated(String code) {
		return new PairingEvent(Type.ROOM_CREATED, code, null, null, 0, null);
	}

	public static PairingEvent registrationRejected(String message) {
		return new PairingEvent(Type.REGISTRATION_REJECTED, null, message, null, 0, null);
	}

	public static PairingEvent joinAccepted(String code) {
		return new PairingEvent(Type.JOIN_ACCEPTED, code, null, null, 0, null);
	}

	public static PairingEvent joinRejected(String message) {
		return new PairingEvent(Type.JOIN_REJECTED, null, message, null, 0, null);
	}

	public static PairingEvent receiverJoined() {
		return new PairingEvent(Type.RECEIVER_JOINED, null, null, null, 0, null);
	}

	public static PairingEvent payloadReady(String filename, long filesize) {
		return new PairingEvent(Type.PAYLOAD_READY, null, null, filename, filesize, null);
	}

	public static PairingEvent payloadDelivered() {
		return new PairingEvent(Type.PAYLOAD_DELIVERED, null, null, null, 0, null);
	}

	/**
	 * @param peerRole role of the peer that went away
	 */
	public static PairingEvent peerDisconnected(PeerRole peerRole) {
		return new PairingEvent(Type.PEER_DISCONNECTED, null, null, null, 0, peerRole);
	}

	public static PairingEvent channelClosed() {
		return new PairingEvent(Type.CHANNEL_CLOSED, null, null, null, 0, null);
	}
}
