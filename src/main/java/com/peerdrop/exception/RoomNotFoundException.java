package com.peerdrop.exception;

public class RoomNotFoundException extends RoomException {

	public RoomNotFoundException(String code) {
		super(code, "Invalid or expired code.");
	}
}
