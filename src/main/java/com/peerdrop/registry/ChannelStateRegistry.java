package com.peerdrop.registry;

import com.peerdrop.session.PairingState;
import com.peerdrop.session.Transition;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Pairing state of every open channel, keyed by channel id.
 */
@Component
public class ChannelStateRegistry {

	private final Map<String, PairingState> states = new ConcurrentHashMap<>();

	public void open(String channelId) {
		states.putIfAbsent(channelId, PairingState.connected());
	}

	public Optional<PairingState> get(String channelId) {
		return Optional.ofNullable(states.get(channelId));
	}

	/**
	 * Atomically replace the channel's state with the result of {@code step}.
	 *
	 * @return the transition, or empty if the channel is not (or no longer) registered
	 */
	public Optional<Transition> transition(String channelId, Function<PairingState, Transition> step) {
		Transition[] result = new Transition[1];
		states.computeIfPresent(channelId, (id, current) -> {
			result[0] = step.apply(current);
			return result[0].getNext();
		});
		return Optional.ofNullable(result[0]);
	}

	/**
	 * Drop the channel. Only the first call for a given id sees its state.
	 */
	public Optional<PairingState> remove(String channelId) {
		return Optional.ofNullable(states.remove(channelId));
	}

	public int getOpenChannelCount() {
		return states.size();
	}
}
