package com.peerdrop.session;

public enum PairingPhase {

	/** Open, not yet bound to a room. */
	CONNECTED,

	// sender
	AWAITING_RECEIVER,
	RELAYING,
	COMPLETE,

	// receiver
	AWAITING_PAYLOAD,
	READY_TO_FETCH,

	CLOSED
}
