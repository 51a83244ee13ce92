package com.peerdrop.exception;

public class NoReceiverException extends RoomException {

	public NoReceiverException(String code) {
		super(code, "Receiver not connected.");
	}
}
