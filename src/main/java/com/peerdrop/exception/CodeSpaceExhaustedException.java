package com.peerdrop.exception;

/**
 * No free room code was found within the configured number of attempts.
 */
public class CodeSpaceExhaustedException extends RoomException {

	public CodeSpaceExhaustedException(int attempts) {
		super(null, "Could not allocate a room code after " + attempts + " attempts. Please try again.");
	}
}
