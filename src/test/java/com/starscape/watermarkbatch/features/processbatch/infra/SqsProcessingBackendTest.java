package com.starscape.watermarkbatch.features.processbatch.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SqsProcessingBackendTest {
    
    private static final String QUEUE_URL = "http://localhost:4566/000000000000/watermark-processing";
    
    private SqsClient sqsClient;
    private BatchCompletionTracker tracker;
    private ObjectMapper objectMapper;
    private SqsProcessingBackend backend;
    
    @BeforeEach
    void setUp() {
        sqsClient = mock(SqsClient.class);
        tracker = new BatchCompletionTracker();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        backend = new SqsProcessingBackend(sqsClient, objectMapper, tracker, QUEUE_URL);
    }
    
    @Test
    void sendsCommandAndWaitsForReply() throws Exception {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(SendMessageResponse.builder().messageId("msg-1").build());
        
        CompletableFuture<Void> completion = backend.triggerProcessing("bat_1");
        
        ArgumentCaptor<SendMessageRequest> sent = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(sqsClient).sendMessage(sent.capture());
        assertThat(sent.getValue().queueUrl()).isEqualTo(QUEUE_URL);
        JsonNode body = objectMapper.readTree(sent.getValue().messageBody());
        assertThat(body.get("batchId").asText()).isEqualTo("bat_1");
        
        assertThat(completion).isNotDone();
        tracker.complete("bat_1");
        assertThat(completion).isCompleted();
    }
    
    @Test
    void sendFailureIsProcessingException() {
        when(sqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenThrow(SdkClientException.create("unable to reach queue"));
        
        assertThatThrownBy(() -> backend.triggerProcessing("bat_1"))
            .isInstanceOf(ProcessingException.class)
            .hasMessageContaining("bat_1");
        assertThat(tracker.register("bat_1")).isNotDone();
    }
}
