package com.peerdrop.exception;

public class EmptyPayloadException extends RoomException {

	public EmptyPayloadException(String code) {
		super(code, "No selected file");
	}
}
