package com.starscape.watermarkbatch.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for batch orchestration.
 * Binds to app.batch.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.batch")
public class BatchProcessingProperties {
    
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration tickTimeout = Duration.ofSeconds(5);
    private Duration triggerTimeout = Duration.ofMinutes(30);
    private int degradedThreshold = 3;
    private Duration sessionRetention = Duration.ofMinutes(10);
    private List<String> supportedFormats;
    private long maxFileBytes = 52_428_800L;
    
    public Duration getPollInterval() {
        return pollInterval;
    }
    
    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }
    
    public Duration getTickTimeout() {
        return tickTimeout;
    }
    
    public void setTickTimeout(Duration tickTimeout) {
        this.tickTimeout = tickTimeout;
    }
    
    public Duration getTriggerTimeout() {
        return triggerTimeout;
    }
    
    public void setTriggerTimeout(Duration triggerTimeout) {
        this.triggerTimeout = triggerTimeout;
    }
    
    public int getDegradedThreshold() {
        return degradedThreshold;
    }
    
    public void setDegradedThreshold(int degradedThreshold) {
        this.degradedThreshold = degradedThreshold;
    }
    
    public Duration getSessionRetention() {
        return sessionRetention;
    }
    
    public void setSessionRetention(Duration sessionRetention) {
        this.sessionRetention = sessionRetention;
    }
    
    public List<String> getSupportedFormats() {
        return supportedFormats;
    }
    
    public void setSupportedFormats(List<String> supportedFormats) {
        this.supportedFormats = supportedFormats;
    }
    
    public long getMaxFileBytes() {
        return maxFileBytes;
    }
    
    public void setMaxFileBytes(long maxFileBytes) {
        this.maxFileBytes = maxFileBytes;
    }
    
    /**
     * Check if a MIME type is accepted for watermarking.
     * Performs case-insensitive comparison.
     * @param mimeType The MIME type to check
     * @return true if the MIME type is in the supported formats list
     */
    public boolean isSupportedFormat(String mimeType) {
        if (mimeType == null || supportedFormats == null || supportedFormats.isEmpty()) {
            return false;
        }
        String normalizedMimeType = mimeType.toLowerCase().trim();
        return supportedFormats.stream()
                .map(format -> format.toLowerCase().trim())
                .anyMatch(format -> format.equals(normalizedMimeType));
    }
}
