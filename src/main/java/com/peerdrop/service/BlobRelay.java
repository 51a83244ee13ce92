package com.peerdrop.service;

import com.peerdrop.exception.EmptyPayloadException;
import com.peerdrop.exception.NoReceiverException;
import com.peerdrop.exception.PayloadNotFoundException;
import com.peerdrop.exception.RoomNotFoundException;
import com.peerdrop.metrics.RelayMetricsTracker;
import com.peerdrop.model.Payload;
import com.peerdrop.registry.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import lombok.Value;
import org.springframework.util.StringUtils;

/**
 * Holds the one file a room carries. Upload is only accepted once a receiver has joined and is
 * the sole trigger of the receiver's {@code file_ready} push.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlobRelay {

	private final RoomRegistry roomRegistry;
	private final PairingCoordinator pairingCoordinator;
	private final RelayMetricsTracker metricsTracker;

	/**
	 * @return the stored payload and whether the receiver was told it is ready
	 * @throws EmptyPayloadException if no filename or no bytes were submitted
	 * @throws RoomNotFoundException if the code is unknown
	 * @throws NoReceiverException if no receiver has joined the room
	 */
	public UploadResult upload(String rawCode, String filename, String contentType, byte[] content) {
		String code = CodeGenerator.canonicalize(rawCode);
		if (!StringUtils.hasText(filename) || content == null || content.length == 0) {
			throw new EmptyPayloadException(code);
		}

		Payload payload = Payload.builder()
				.filename(filename)
				.contentType(StringUtils.hasText(contentType) ? contentType : Payload.DEFAULT_CONTENT_TYPE)
				.content(content)
				.build();
		roomRegistry.attachPayload(code, payload);
		metricsTracker.recordUpload(payload.getSize());

		boolean notified = pairingCoordinator.payloadUploaded(code, payload);
		if (notified) {
			log.info("Upload of {} to room {} complete, receiver notified", filename, code);
		}
		return new UploadResult(payload, notified);
	}

	/**
	 * Repeatable: the payload stays in the room until the room is torn down.
	 *
	 * @throws RoomNotFoundException if the room is gone
	 * @throws PayloadNotFoundException if nothing was uploaded yet
	 */
	public Payload download(String rawCode) {
		String code = CodeGenerator.canonicalize(rawCode);
		Payload payload = roomRegistry.takePayload(code);
		metricsTracker.recordDownload(payload.getSize());
		log.info("Serving {} ({} bytes) from room {}", payload.getFilename(), payload.getSize(), code);
		return payload;
	}

	@Value
	public static class UploadResult {
		Payload payload;
		boolean receiverNotified;
	}
}
