package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.processbatch.app.SessionOutcome;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.BatchProgressUpdate;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.BatchTerminalUpdate;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.ConnectivityWarning;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ProgressBroadcasterTest {
    
    private SimpMessagingTemplate messagingTemplate;
    private ProgressBroadcaster broadcaster;
    
    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        broadcaster = new ProgressBroadcaster(messagingTemplate);
    }
    
    @Test
    void progressGoesToBatchTopic() {
        broadcaster.onProgress(snapshot(BatchStatus.PROCESSING));
        
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/batch/bat_1"), payload.capture());
        BatchProgressUpdate update = (BatchProgressUpdate) payload.getValue();
        assertThat(update.batchStatus()).isEqualTo("processing");
        assertThat(update.overallProgress()).isEqualTo(50.0);
        assertThat(update.items()).extracting("status").containsExactly("completed", "processing");
    }
    
    @Test
    void degradedPollingSendsWarning() {
        broadcaster.onDegraded("bat_1", 3);
        
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/batch/bat_1"), payload.capture());
        assertThat(payload.getValue()).isInstanceOf(ConnectivityWarning.class);
        assertThat(((ConnectivityWarning) payload.getValue()).consecutiveFailures()).isEqualTo(3);
    }
    
    @Test
    void terminalUpdateCarriesResultAndMode() {
        broadcaster.onTerminal(SessionOutcome.cancelled(snapshot(BatchStatus.FAILED)));
        
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/batch/bat_1"), payload.capture());
        BatchTerminalUpdate update = (BatchTerminalUpdate) payload.getValue();
        assertThat(update.result()).isEqualTo("CANCELLED");
        assertThat(update.mode()).isEqualTo("single");
        assertThat(update.completedCount()).isEqualTo(1);
    }
    
    @Test
    void failureWithoutSnapshotStillBroadcasts() {
        broadcaster.onTerminal(SessionOutcome.failed("bat_1", BatchMode.BATCH, null, "queue unavailable"));
        
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq("/topic/batch/bat_1"), payload.capture());
        BatchTerminalUpdate update = (BatchTerminalUpdate) payload.getValue();
        assertThat(update.totalCount()).isZero();
        assertThat(update.errorMessage()).isEqualTo("queue unavailable");
    }
    
    @Test
    void brokerFailureIsNotPropagated() {
        doThrow(new MessageDeliveryException("broker down"))
            .when(messagingTemplate).convertAndSend(any(String.class), any(Object.class));
        
        assertThatCode(() -> broadcaster.onDegraded("bat_1", 3)).doesNotThrowAnyException();
    }
    
    private static BatchSnapshot snapshot(BatchStatus status) {
        List<ItemProgress> items = List.of(
            new ItemProgress("itm_1", "a.pdf", 10, ItemStatus.COMPLETED, 100, null),
            new ItemProgress("itm_2", "b.pdf", 10, ItemStatus.PROCESSING, 40, null));
        return new BatchSnapshot("bat_1", status, BatchMode.SINGLE, items,
            BatchProgressAggregator.aggregate(items), 1L, Instant.now());
    }
}
