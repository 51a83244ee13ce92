package com.peerdrop.controller;

import com.peerdrop.dto.UploadForm;
import com.peerdrop.exception.PayloadNotFoundException;
import com.peerdrop.exception.RoomException;
import com.peerdrop.exception.RoomNotFoundException;
import com.peerdrop.model.Payload;
import com.peerdrop.service.BlobRelay;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@RestController
@RequiredArgsConstructor
@Slf4j
public class BlobRelayController {

	static final String UPLOADED_AND_NOTIFIED = "File uploaded and receiver notified.";
	static final String UPLOADED = "File uploaded.";

	private final BlobRelay blobRelay;

	/**
	 * Store the sender's file in its room and notify the receiver.
	 * POST /upload (multipart: code, file)
	 */
	@PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ResponseEntity<String> upload(@Valid @ModelAttribute UploadForm form) throws IOException {
		MultipartFile file = form.getFile();
		log.info("Upload request for room {}: {} ({} bytes)", form.getCode(), file.getOriginalFilename(), file.getSize());
		try {
			BlobRelay.UploadResult result = blobRelay.upload(form.getCode(), file.getOriginalFilename(),
					file.getContentType(), file.getBytes());
			return ResponseEntity.ok(result.isReceiverNotified() ? UPLOADED_AND_NOTIFIED : UPLOADED);
		} catch (RoomException e) {
			log.warn("Upload to room {} rejected: {}", form.getCode(), e.getMessage());
			return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(e.getMessage());
		}
	}

	/**
	 * Serve the stored file as an attachment.
	 * GET /download?code=XXXXX
	 */
	@GetMapping("/download")
	public ResponseEntity<byte[]> download(@RequestParam("code") String code) {
		Payload payload;
		try {
			payload = blobRelay.download(code);
		} catch (RoomNotFoundException | PayloadNotFoundException e) {
			log.warn("Download for room {} failed: {}", code, e.getMessage());
			return ResponseEntity.status(HttpStatus.NOT_FOUND)
					.contentType(MediaType.TEXT_PLAIN)
					.body(e.getMessage().getBytes(StandardCharsets.UTF_8));
		}

		ContentDisposition disposition = ContentDisposition.attachment()
				.filename(payload.getFilename(), StandardCharsets.UTF_8)
				.build();
		return ResponseEntity.ok()
				.header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
				.contentType(mediaTypeOf(payload))
				.contentLength(payload.getSize())
				.body(payload.getContent());
	}

	private MediaType mediaTypeOf(Payload payload) {
		try {
			return MediaType.parseMediaType(payload.getContentType());
		} catch (InvalidMediaTypeException e) {
			log.debug("Stored content type '{}' is not valid, serving as octet-stream", payload.getContentType());
			return MediaType.APPLICATION_OCTET_STREAM;
		}
	}
}
