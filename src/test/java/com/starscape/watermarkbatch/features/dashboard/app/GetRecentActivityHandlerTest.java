package com.starscape.watermarkbatch.features.dashboard.app;

import com.starscape.watermarkbatch.features.batches.domain.Batch;
import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.dashboard.api.dto.ActivityItem;
import com.starscape.watermarkbatch.features.dashboard.infra.DashboardQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GetRecentActivityHandlerTest {
    
    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    
    private DashboardQueryRepository repository;
    private GetRecentActivityHandler handler;
    
    @BeforeEach
    void setUp() {
        repository = mock(DashboardQueryRepository.class);
        handler = new GetRecentActivityHandler(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    @Test
    void buildsFeedNewestFirst() {
        Batch completed = batch("bat_done", "Contracts", "completed",
            NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofMinutes(5)), 4, 1);
        Batch processing = batch("bat_run", "Invoices", "processing",
            NOW.minus(Duration.ofHours(1)), null, 0, 0);
        when(repository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of(processing, completed));
        
        List<ActivityItem> feed = handler.handle(10);
        
        assertThat(feed).extracting(ActivityItem::id).containsExactly(
            "bat_done-completed", "bat_run-processing", "bat_run-created");
        ActivityItem done = feed.get(0);
        assertThat(done.action()).isEqualTo("Contracts completed");
        assertThat(done.description()).isEqualTo("4 documents watermarked successfully, 1 failed");
        assertThat(done.status()).isEqualTo("warning");
        assertThat(done.relativeTime()).isEqualTo("5 minutes ago");
    }
    
    @Test
    void failedBatchWithoutCompletionTimeUsesCreation() {
        Batch failed = batch("bat_fail", "Reports", "failed",
            NOW.minus(Duration.ofDays(3)), null, 0, 2);
        when(repository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of(failed));
        
        List<ActivityItem> feed = handler.handle(10);
        
        assertThat(feed).hasSize(1);
        assertThat(feed.get(0).status()).isEqualTo("failed");
        assertThat(feed.get(0).relativeTime()).isEqualTo("3 days ago");
    }
    
    @Test
    void limitIsBounded() {
        when(repository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());
        
        handler.handle(500);
        handler.handle(0);
        
        verify(repository).findAllByOrderByCreatedAtDesc(PageRequest.of(0, GetRecentActivityHandler.MAX_LIMIT));
        verify(repository).findAllByOrderByCreatedAtDesc(PageRequest.of(0, 1));
    }
    
    private static Batch batch(String id, String name, String status, Instant createdAt, Instant completedAt,
                               int processed, int failed) {
        Batch batch = new Batch(id, name, BatchMode.BATCH, "{}");
        ReflectionTestUtils.setField(batch, "status", status);
        ReflectionTestUtils.setField(batch, "createdAt", createdAt);
        ReflectionTestUtils.setField(batch, "completedAt", completedAt);
        ReflectionTestUtils.setField(batch, "processedFiles", processed);
        ReflectionTestUtils.setField(batch, "failedFiles", failed);
        ReflectionTestUtils.setField(batch, "totalFiles", processed + failed);
        return batch;
    }
}
