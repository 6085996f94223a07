package com.starscape.watermarkbatch.features.processbatch.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingBackend;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import com.starscape.watermarkbatch.features.processbatch.infra.messages.ProcessBatchMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Sends processing commands to the watermarking backend over SQS.
 * The returned future completes when {@link BatchCompletionListener} receives the backend's reply.
 */
@Component
public class SqsProcessingBackend implements ProcessingBackend {
    
    private static final Logger log = LoggerFactory.getLogger(SqsProcessingBackend.class);
    
    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final BatchCompletionTracker completionTracker;
    private final String processingQueueUrl;
    
    public SqsProcessingBackend(
            SqsClient sqsClient,
            ObjectMapper objectMapper,
            BatchCompletionTracker completionTracker,
            @Value("${aws.sqs.processing-queue-url}") String processingQueueUrl) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.completionTracker = completionTracker;
        this.processingQueueUrl = processingQueueUrl;
    }
    
    @Override
    public CompletableFuture<Void> triggerProcessing(String batchId) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new ProcessBatchMessage(batchId, Instant.now()));
        } catch (JsonProcessingException e) {
            throw new ProcessingException("Failed to serialize processing command for batch " + batchId, e);
        }
        
        CompletableFuture<Void> completion = completionTracker.register(batchId);
        try {
            SendMessageResponse response = sqsClient.sendMessage(SendMessageRequest.builder()
                    .queueUrl(processingQueueUrl)
                    .messageBody(body)
                    .build());
            log.info("Sent processing command: batchId={}, messageId={}", batchId, response.messageId());
        } catch (SdkException e) {
            ProcessingException failure = new ProcessingException(
                "Failed to send processing command for batch " + batchId, e);
            completionTracker.fail(batchId, failure);
            throw failure;
        }
        return completion;
    }
}
