package com.peerdrop.registry;

import com.peerdrop.session.PairingEvent;
import com.peerdrop.session.PairingPhase;
import com.peerdrop.session.PairingStateMachine;
import com.peerdrop.session.Transition;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChannelStateRegistryTest {

	private final ChannelStateRegistry states = new ChannelStateRegistry();

	@Test
	void transitionStoresNextState() {
		states.open("c1");

		Optional<Transition> transition = states.transition("c1",
				s -> PairingStateMachine.apply(s, PairingEvent.roomCreated("AB12C")));

		assertTrue(transition.isPresent());
		assertEquals(PairingPhase.AWAITING_RECEIVER, states.get("c1").orElseThrow().getPhase());
		assertEquals("AB12C", states.get("c1").orElseThrow().getCode());
	}

	@Test
	void transitionOnUnknownChannelIsEmpty() {
		assertTrue(states.transition("missing",
				s -> PairingStateMachine.apply(s, PairingEvent.roomCreated("AB12C"))).isEmpty());
	}

	@Test
	void removeReturnsStateOnlyOnce() {
		states.open("c1");

		assertTrue(states.remove("c1").isPresent());
		assertTrue(states.remove("c1").isEmpty());
		assertEquals(0, states.getOpenChannelCount());
	}
}
