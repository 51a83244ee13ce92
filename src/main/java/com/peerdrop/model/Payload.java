package com.peerdrop.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single uploaded file held in memory by its room.
 */
@Value
@Builder
public class Payload {

	public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

	String filename;

	@Builder.Default
	String contentType = DEFAULT_CONTENT_TYPE;

	byte[] content;

	public long getSize() {
		return content.length;
	}

}
