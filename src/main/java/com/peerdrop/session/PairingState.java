package com.peerdrop.session;

import com.peerdrop.model.PeerRole;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Immutable pairing state of one channel. {@code role} and {@code code} are null until the
 * channel is bound to a room.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PairingState {

	private static final PairingState CONNECTED = new PairingState(null, null, PairingPhase.CONNECTED);
	private static final PairingState CLOSED = new PairingState(null, null, PairingPhase.CLOSED);

	PeerRole role;
	String code;
	PairingPhase phase;

	public static PairingState connected() {
		return CONNECTED;
	}

	public static PairingState closed() {
		return CLOSED;
	}

	public static PairingState sender(String code, PairingPhase phase) {
		return new PairingState(PeerRole.SENDER, code, phase);
	}

	public static PairingState receiver(String code, PairingPhase phase) {
		return new PairingState(PeerRole.RECEIVER, code, phase);
	}

	public boolean isBound() {
		return code != null;
	}

	public boolean is(PeerRole expectedRole, PairingPhase expectedPhase) {
		return role == expectedRole && phase == expectedPhase;
	}
}
