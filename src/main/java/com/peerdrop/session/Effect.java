package com.peerdrop.session;

import com.peerdrop.dto.SignalMessage;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Side effect requested by a transition, carried out by the coordinator.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Effect {

	public enum Kind {
		/** Send {@code message} back on the channel that made the transition. */
		REPLY,
		/** Feed {@code peerEvent} to the counterpart channel's state machine. */
		PEER_EVENT,
		/** Remove the channel's room from the registry. */
		CLOSE_ROOM
	}

	Kind kind;
	SignalMessage message;
	PairingEvent peerEvent;

	public static Effect reply(SignalMessage message) {
		return new Effect(Kind.REPLY, message, null);
	}

	public static Effect peerEvent(PairingEvent event) {
		return new Effect(Kind.PEER_EVENT, null, event);
	}

	public static Effect closeRoom() {
		return new Effect(Kind.CLOSE_ROOM, null, null);
	}
}
