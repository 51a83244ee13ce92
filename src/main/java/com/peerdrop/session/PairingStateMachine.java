package com.peerdrop.session;

import com.peerdrop.dto.SignalMessage;
import com.peerdrop.model.PeerRole;

/**
 * Pairing protocol of a single channel as a pure function of (state, event).
 * <p>
 * Sender: CONNECTED -> AWAITING_RECEIVER -> RELAYING -> COMPLETE.<br>
 * Receiver: CONNECTED -> AWAITING_PAYLOAD -> READY_TO_FETCH.<br>
 * Any state -> CLOSED when the channel goes away; a bound channel then tears its room down.
 * <p>
 * An event that does not apply in the current state is ignored: same state, no effects.
 */
public final class PairingStateMachine {

	private PairingStateMachine() {
	}

	public static Transition apply(PairingState state, PairingEvent event) {
		switch (event.getType()) {
			case ROOM_CREATED:
				if (state.getPhase() != PairingPhase.CONNECTED) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.sender(event.getCode(), PairingPhase.AWAITING_RECEIVER),
						Effect.reply(SignalMessage.codeGenerated(event.getCode())));

			case REGISTRATION_REJECTED:
			case JOIN_REJECTED:
				if (state.getPhase() == PairingPhase.CLOSED) {
					return Transition.ignored(state);
				}
				return Transition.to(state, state, Effect.reply(SignalMessage.error(event.getMessage())));

			case JOIN_ACCEPTED:
				if (state.getPhase() != PairingPhase.CONNECTED) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.receiver(event.getCode(), PairingPhase.AWAITING_PAYLOAD),
						Effect.reply(SignalMessage.waitingForFile()),
						Effect.peerEvent(PairingEvent.receiverJoined()));

			case RECEIVER_JOINED:
				if (!state.is(PeerRole.SENDER, PairingPhase.AWAITING_RECEIVER)) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.sender(state.getCode(), PairingPhase.RELAYING),
						Effect.reply(SignalMessage.receiverJoined()));

			case PAYLOAD_READY:
				// a re-upload notifies again
				if (!state.is(PeerRole.RECEIVER, PairingPhase.AWAITING_PAYLOAD)
						&& !state.is(PeerRole.RECEIVER, PairingPhase.READY_TO_FETCH)) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.receiver(state.getCode(), PairingPhase.READY_TO_FETCH),
						Effect.reply(SignalMessage.fileReady(event.getFilename(), event.getFilesize())),
						Effect.peerEvent(PairingEvent.payloadDelivered()));

			case PAYLOAD_DELIVERED:
				if (!state.is(PeerRole.SENDER, PairingPhase.RELAYING)) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.sender(state.getCode(), PairingPhase.COMPLETE));

			case PEER_DISCONNECTED:
				if (!state.isBound() || state.getPhase() == PairingPhase.CLOSED) {
					return Transition.ignored(state);
				}
				return Transition.to(state, PairingState.connected(),
						Effect.reply(SignalMessage.error(event.getPeerRole().getDisplayName() + " disconnected.")));

			case CHANNEL_CLOSED:
				if (state.getPhase() == PairingPhase.CLOSED) {
					return Transition.ignored(state);
				}
				if (!state.isBound()) {
					return Transition.to(state, PairingState.closed());
				}
				return Transition.to(state, PairingState.closed(),
						Effect.peerEvent(PairingEvent.peerDisconnected(state.getRole())),
						Effect.closeRoom());

			default:
				return Transition.ignored(state);
		}
	}
}
