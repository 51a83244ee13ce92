package com.peerdrop.model;

public enum PeerRole {

	SENDER("Sender"),
	RECEIVER("Receiver");

	private final String displayName;

	PeerRole(String displayName) {
		this.displayName = displayName;
	}

	public String getDisplayName() {
		return displayName;
	}

	public PeerRole opposite() {
		return this == SENDER ? RECEIVER : SENDER;
	}
}
