package com.peerdrop.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON frame exchanged over the control channel, in both directions.
 * Only the fields relevant to a given {@code type} are set; the rest are omitted on the wire.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalMessage {

	// client -> server
	public static final String REGISTER_SENDER = "register_sender";
	public static final String REGISTER_RECEIVER = "register_receiver";

	// server -> client
	public static final String CODE_GENERATED = "code_generated";
	public static final String WAITING_FOR_FILE = "waiting_for_file";
	public static final String RECEIVER_JOINED = "receiver_joined";
	public static final String FILE_READY = "file_ready";
	public static final String ERROR = "error";

	private String type;

	private String code;

	private String message;

	private String filename;

	private Long filesize;

	public static SignalMessage codeGenerated(String code) {
		return SignalMessage.builder().type(CODE_GENERATED).code(code).build();
	}

	public static SignalMessage waitingForFile() {
		return SignalMessage.builder().type(WAITING_FOR_FILE).build();
	}

	public static SignalMessage receiverJoined() {
		return SignalMessage.builder().type(RECEIVER_JOINED).build();
	}

	public static SignalMessage fileReady(String filename, long filesize) {
		return SignalMessage.builder().type(FILE_READY).filename(filename).filesize(filesize).build();
	}

	public static SignalMessage error(String message) {
		return SignalMessage.builder().type(ERROR).message(message).build();
	}
}
