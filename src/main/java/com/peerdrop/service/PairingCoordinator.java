package com.peerdrop.service;

import com.peerdrop.channel.PeerChannel;
import com.peerdrop.dto.SignalMessage;
import com.peerdrop.exception.CodeSpaceExhaustedException;
import com.peerdrop.exception.RoomException;
import com.peerdrop.metrics.RelayMetricsTracker;
import com.peerdrop.model.Payload;
import com.peerdrop.model.PeerRole;
import com.peerdrop.registry.ChannelStateRegistry;
import com.peerdrop.registry.RoomRegistry;
import com.peerdrop.session.Effect;
import com.peerdrop.session.PairingEvent;
import com.peerdrop.session.PairingState;
import com.peerdrop.session.PairingStateMachine;
import com.peerdrop.session.Transition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Drives each channel's {@link PairingStateMachine} and carries out the resulting effects:
 * replies, events for the counterpart channel, and room teardown.
 * Registry calls happen before a transition; channel pushes happen after it, outside any lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PairingCoordinator {

	private final RoomRegistry roomRegistry;
	private final ChannelStateRegistry channelStates;
	private final RelayMetricsTracker metricsTracker;

	public void channelOpened(PeerChannel channel) {
		channelStates.open(channel.getId());
	}

	/**
	 * Dispatch a parsed control message. Unknown types are ignored.
	 */
	public void handleMessage(PeerChannel channel, SignalMessage message) {
		String type = message.getType();
		if (SignalMessage.REGISTER_SENDER.equals(type)) {
			registerSender(channel);
		} else if (SignalMessage.REGISTER_RECEIVER.equals(type)) {
			registerReceiver(channel, message.getCode());
		} else {
			log.debug("Ignoring message of type {} from channel {}", type, channel.getId());
		}
	}

	public void registerSender(PeerChannel channel) {
		Optional<PairingState> state = channelStates.get(channel.getId());
		if (state.isEmpty()) {
			log.warn("register_sender from unknown channel {}", channel.getId());
			return;
		}
		if (state.get().isBound()) {
			log.warn("Channel {} is already paired with room {}", channel.getId(), state.get().getCode());
			apply(channel, PairingEvent.registrationRejected("Already paired with a room."));
			return;
		}

		String code;
		try {
			code = roomRegistry.createRoom(channel);
		} catch (CodeSpaceExhaustedException e) {
			apply(channel, PairingEvent.registrationRejected(e.getMessage()));
			return;
		}

		Optional<Transition> transition = channelStates.transition(channel.getId(),
				current -> PairingStateMachine.apply(current, PairingEvent.roomCreated(code)));
		if (transition.isEmpty() || transition.get().isIgnored()) {
			// channel closed while the room was being allocated
			log.info("Channel {} went away before room {} was handed out", channel.getId(), code);
			roomRegistry.removeRoom(code);
			return;
		}
		metricsTracker.recordRoomCreated();
		execute(channel, transition.get());
	}

	public void registerReceiver(PeerChannel channel, String rawCode) {
		String code = CodeGenerator.canonicalize(rawCode);
		Optional<PairingState> state = channelStates.get(channel.getId());
		if (state.isEmpty()) {
			log.warn("register_receiver from unknown channel {}", channel.getId());
			return;
		}
		if (state.get().isBound()) {
			log.warn("Channel {} is already paired with room {}", channel.getId(), state.get().getCode());
			apply(channel, PairingEvent.joinRejected("Already paired with a room."));
			return;
		}

		try {
			roomRegistry.bindReceiver(code, channel);
		} catch (RoomException e) {
			log.warn("Join rejected for channel {} with code '{}': {}", channel.getId(), code,
					e.getClass().getSimpleName());
			apply(channel, PairingEvent.joinRejected(e.getMessage()));
			return;
		}

		Optional<Transition> transition = channelStates.transition(channel.getId(),
				current -> PairingStateMachine.apply(current, PairingEvent.joinAccepted(code)));
		if (transition.isEmpty() || transition.get().isIgnored()) {
			// receiver closed while binding, tear down as if it had disconnected after joining
			log.info("Channel {} went away while joining room {}", channel.getId(), code);
			roomRegistry.getPeerChannel(code, PeerRole.SENDER)
					.ifPresent(sender -> apply(sender, PairingEvent.peerDisconnected(PeerRole.RECEIVER)));
			closeRoom(code);
			return;
		}
		metricsTracker.recordReceiverJoined();
		execute(channel, transition.get());

		// sender closed while binding; its disconnect event reached this channel before the join
		if (!isSenderPresent(code)) {
			log.info("Sender of room {} went away while channel {} was joining", code, channel.getId());
			apply(channel, PairingEvent.peerDisconnected(PeerRole.SENDER));
			closeRoom(code);
		}
	}

	/**
	 * Tell the room's receiver that the payload can be fetched.
	 *
	 * @return whether a receiver channel was found to notify
	 */
	public boolean payloadUploaded(String code, Payload payload) {
		Optional<PeerChannel> receiver = roomRegistry.getPeerChannel(code, PeerRole.RECEIVER);
		if (receiver.isEmpty()) {
			log.warn("Payload for room {} stored but no receiver is left to notify", code);
			return false;
		}
		apply(receiver.get(), PairingEvent.payloadReady(payload.getFilename(), payload.getSize()));
		return true;
	}

	/**
	 * Teardown for a closed or failed channel. Runs at most once per channel.
	 */
	public void channelClosed(PeerChannel channel) {
		Optional<PairingState> removed = channelStates.remove(channel.getId());
		if (removed.isEmpty()) {
			return;
		}
		PairingState state = removed.get();
		if (state.isBound()) {
			log.info("Cleaning up room {} due to {} disconnect", state.getCode(), state.getRole());
		}
		execute(channel, PairingStateMachine.apply(state, PairingEvent.channelClosed()));
	}

	private boolean isSenderPresent(String code) {
		return roomRegistry.getPeerChannel(code, PeerRole.SENDER)
				.map(sender -> channelStates.get(sender.getId()).isPresent())
				.orElse(false);
	}

	private void apply(PeerChannel channel, PairingEvent event) {
		channelStates.transition(channel.getId(), current -> PairingStateMachine.apply(current, event))
				.ifPresent(transition -> execute(channel, transition));
	}

	private void execute(PeerChannel channel, Transition transition) {
		PairingState bound = transition.getBoundState();
		for (Effect effect : transition.getEffects()) {
			switch (effect.getKind()) {
				case REPLY:
					notifyQuietly(channel, effect.getMessage());
					break;
				case PEER_EVENT:
					if (bound.isBound()) {
						roomRegistry.getPeerChannel(bound.getCode(), bound.getRole().opposite())
								.ifPresent(peer -> apply(peer, effect.getPeerEvent()));
					}
					break;
				case CLOSE_ROOM:
					closeRoom(bound.getCode());
					break;
				default:
					break;
			}
		}
	}

	private void closeRoom(String code) {
		if (roomRegistry.removeRoom(code)) {
			metricsTracker.recordRoomClosed();
		}
	}

	/**
	 * Best-effort push. A peer that is mid-disconnect is expected; the failure is logged and the
	 * caller carries on, so callers ignore the result.
	 */
	private boolean notifyQuietly(PeerChannel channel, SignalMessage message) {
		try {
			channel.send(message);
			return true;
		} catch (IOException e) {
			log.warn("Could not deliver {} to channel {}: {}", message.getType(), channel.getId(), e.getMessage());
			return false;
		} catch (RuntimeException e) {
			// e.g. send time or buffer limit exceeded on a slow peer
			log.warn("Push of {} to channel {} failed", message.getType(), channel.getId(), e);
			return false;
		}
	}
}
