package com.starscape.watermarkbatch.features.processbatch.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchCompletionListenerTest {
    
    private final BatchCompletionTracker tracker = new BatchCompletionTracker();
    private final BatchCompletionListener listener = new BatchCompletionListener(
        tracker, new ObjectMapper().registerModule(new JavaTimeModule()));
    
    @Test
    void successReplyCompletesRequest() {
        CompletableFuture<Void> completion = tracker.register("bat_1");
        
        listener.handleBatchCompleted("""
            {"batchId":"bat_1","outcome":"completed","completedAt":"2024-05-01T10:15:30Z"}
            """);
        
        assertThat(completion).isCompleted();
    }
    
    @Test
    void errorReplyFailsRequest() {
        CompletableFuture<Void> completion = tracker.register("bat_1");
        
        listener.handleBatchCompleted("""
            {"batchId":"bat_1","outcome":"error","errorMessage":"storage unavailable"}
            """);
        
        assertThatThrownBy(completion::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(ProcessingException.class)
            .hasMessageContaining("storage unavailable");
    }
    
    @Test
    void malformedReplyIsRejected() {
        assertThatThrownBy(() -> listener.handleBatchCompleted("not json"))
            .isInstanceOf(RuntimeException.class)
            .hasMessage("Invalid message format");
    }
}
