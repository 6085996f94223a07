package com.starscape.watermarkbatch.features.createbatch.api.dto;

import jakarta.validation.constraints.*;

/**
 * Watermark parameters. Stored with the batch and passed through to the backend untouched.
 */
public record WatermarkSettingsRequest(
    @NotBlank(message = "Watermark text is required")
    @Size(max = 200, message = "Watermark text too long")
    String text,
    
    @NotNull(message = "Opacity is required")
    @Min(value = 0, message = "Opacity must be between 0 and 100")
    @Max(value = 100, message = "Opacity must be between 0 and 100")
    Integer opacity,
    
    @NotBlank(message = "Font size is required")
    @Pattern(regexp = "^(small|medium|large)$", message = "Font size must be small, medium or large")
    String fontSize,
    
    @NotBlank(message = "Color is required")
    @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "Color must be a hex value like #ff0000")
    String color
) {}
