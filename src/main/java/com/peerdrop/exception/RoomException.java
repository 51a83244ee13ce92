package com.peerdrop.exception;

/**
 * Base type for failures of a peer-facing room operation.
 * The message is human-readable and is shown to the requesting peer as-is.
 */
public abstract class RoomException extends RuntimeException {

	private final String code;

	protected RoomException(String code, String message) {
		super(message);
		this.code = code;
	}

	/**
	 * Room code the failed operation referred to, may be {@code null}.
	 */
	public String getCode() {
		return code;
	}
}
