package com.starscape.watermarkbatch.features.createbatch.api.dto;

import jakarta.validation.constraints.*;

public record DocumentUploadRequest(
    @NotBlank(message = "Filename is required")
    @Size(max = 255, message = "Filename too long")
    @Pattern(regexp = "^[^/\\\\<>:\"|?*]+\\.(pdf|docx|doc)$", 
             flags = Pattern.Flag.CASE_INSENSITIVE,
             message = "Invalid filename or extension. Supported extensions: pdf, docx, doc")
    String filename,
    
    @NotBlank(message = "MIME type is required")
    String mimeType,
    
    @Positive(message = "File size must be positive")
    @Max(value = 52428800, message = "File size exceeds maximum (50MB)")
    long bytes
) {}
