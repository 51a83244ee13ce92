package com.peerdrop.exception;

public class ReceiverAlreadyBoundException extends RoomException {

	public ReceiverAlreadyBoundException(String code) {
		super(code, "Invalid or expired code.");
	}
}
