package com.starscape.watermarkbatch.features.dashboard.api.dto;

public record SystemHealthResponse(
    String status,
    String message
) {
    public static final String HEALTHY = "healthy";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";
}
