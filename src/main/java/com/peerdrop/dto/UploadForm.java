package com.peerdrop.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.web.multipart.MultipartFile;

@Data
public class UploadForm {

	@NotBlank(message = "Room code is required")
	private String code;

	@NotNull(message = "File is required")
	private MultipartFile file;

}
