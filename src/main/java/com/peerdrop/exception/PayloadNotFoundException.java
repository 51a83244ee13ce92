package com.peerdrop.exception;

public class PayloadNotFoundException extends RoomException {

	public PayloadNotFoundException(String code) {
		super(code, "File not found or link expired.");
	}
}
