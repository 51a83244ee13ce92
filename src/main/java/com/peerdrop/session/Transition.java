package com.peerdrop.session;

import lombok.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

@Value
public class Transition {

	/** State the channel was in before the event. */
	PairingState previous;
	PairingState next;
	List<Effect> effects;

	static Transition to(PairingState previous, PairingState next, Effect... effects) {
		return new Transition(previous, next, Collections.unmodifiableList(Arrays.asList(effects)));
	}

	static Transition ignored(PairingState state) {
		return new Transition(state, state, Collections.emptyList());
	}

	/**
	 * The side of the transition that is bound to a room: the new state if it is bound,
	 * otherwise the state the channel left.
	 */
	public PairingState getBoundState() {
		return next.isBound() ? next : previous;
	}

	public boolean isIgnored() {
		return previous == next && effects.isEmpty();
	}
}
