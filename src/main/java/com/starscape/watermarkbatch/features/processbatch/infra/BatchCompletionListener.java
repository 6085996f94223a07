package com.starscape.watermarkbatch.features.processbatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import com.starscape.watermarkbatch.features.processbatch.infra.messages.BatchCompletedMessage;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Listens for the watermarking backend's batch completion replies.
 * 
 * Only enabled when spring.cloud.aws.sqs.enabled=true. Without it, sessions still end
 * when their monitor observes a terminal batch status.
 */
@Component
@ConditionalOnProperty(name = "spring.cloud.aws.sqs.enabled", havingValue = "true", matchIfMissing = false)
public class BatchCompletionListener {
    
    private static final Logger log = LoggerFactory.getLogger(BatchCompletionListener.class);
    
    private final BatchCompletionTracker completionTracker;
    private final ObjectMapper objectMapper;
    
    public BatchCompletionListener(BatchCompletionTracker completionTracker, ObjectMapper objectMapper) {
        this.completionTracker = completionTracker;
        this.objectMapper = objectMapper;
    }
    
    @SqsListener("${aws.sqs.completion-queue-url}")
    public void handleBatchCompleted(String message) {
        log.info("Received batch completion message: {}", message);
        
        BatchCompletedMessage completed;
        try {
            completed = objectMapper.readValue(message, BatchCompletedMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse batch completion message", e);
            throw new RuntimeException("Invalid message format", e);
        }
        
        if (completed.batchId() == null || completed.batchId().isBlank()) {
            log.warn("Ignoring batch completion message without batchId");
            return;
        }
        
        if (completed.isError()) {
            String reason = completed.errorMessage() != null ? completed.errorMessage() : "unknown error";
            completionTracker.fail(completed.batchId(), new ProcessingException(
                "Backend could not process batch " + completed.batchId() + ": " + reason));
        } else {
            completionTracker.complete(completed.batchId());
        }
    }
}
