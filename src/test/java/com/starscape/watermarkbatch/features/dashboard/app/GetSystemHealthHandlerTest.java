package com.starscape.watermarkbatch.features.dashboard.app;

import com.starscape.watermarkbatch.features.dashboard.api.dto.SystemHealthResponse;
import com.starscape.watermarkbatch.features.dashboard.infra.DashboardQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GetSystemHealthHandlerTest {
    
    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    
    private DashboardQueryRepository repository;
    private GetSystemHealthHandler handler;
    
    @BeforeEach
    void setUp() {
        repository = mock(DashboardQueryRepository.class);
        handler = new GetSystemHealthHandler(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }
    
    @Test
    void healthyWhenNothingIsStuckOrFailing() {
        when(repository.countByStatusAndCreatedAtBefore(eq("processing"), any())).thenReturn(0L);
        when(repository.countByStatusAndCreatedAtGreaterThanEqual(eq("failed"), any())).thenReturn(5L);
        
        SystemHealthResponse health = handler.handle();
        
        assertThat(health.status()).isEqualTo(SystemHealthResponse.HEALTHY);
    }
    
    @Test
    void warnsAboutBatchesProcessingForOverTwoHours() {
        when(repository.countByStatusAndCreatedAtBefore("processing", Instant.parse("2024-05-10T10:00:00Z")))
            .thenReturn(2L);
        
        SystemHealthResponse health = handler.handle();
        
        assertThat(health.status()).isEqualTo(SystemHealthResponse.WARNING);
        assertThat(health.message()).contains("2 batch(es)");
        verify(repository, never()).countByStatusAndCreatedAtGreaterThanEqual(any(), any());
    }
    
    @Test
    void warnsAboutFailuresInTheLastDay() {
        when(repository.countByStatusAndCreatedAtBefore(eq("processing"), any())).thenReturn(0L);
        when(repository.countByStatusAndCreatedAtGreaterThanEqual("failed", Instant.parse("2024-05-09T12:00:00Z")))
            .thenReturn(6L);
        
        SystemHealthResponse health = handler.handle();
        
        assertThat(health.status()).isEqualTo(SystemHealthResponse.WARNING);
        assertThat(health.message()).contains("6 failed batches");
    }
    
    @Test
    void reportsErrorWhenStoreIsUnreachable() {
        when(repository.countByStatusAndCreatedAtBefore(any(), any()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));
        
        SystemHealthResponse health = handler.handle();
        
        assertThat(health.status()).isEqualTo(SystemHealthResponse.ERROR);
        assertThat(health.message()).isEqualTo("Unable to check system health");
    }
}
