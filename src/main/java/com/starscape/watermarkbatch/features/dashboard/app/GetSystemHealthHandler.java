package com.starscape.watermarkbatch.features.dashboard.app;

import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.dashboard.api.dto.SystemHealthResponse;
import com.starscape.watermarkbatch.features.dashboard.infra.DashboardQueryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Flags batches stuck in processing for over two hours, and more than five failed batches in a day.
 */
@Service
public class GetSystemHealthHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GetSystemHealthHandler.class);
    
    private static final Duration STUCK_AFTER = Duration.ofHours(2);
    private static final Duration FAILURE_WINDOW = Duration.ofHours(24);
    private static final long FAILURE_LIMIT = 5;
    
    private final DashboardQueryRepository queryRepository;
    private final Clock clock;
    
    @Autowired
    public GetSystemHealthHandler(DashboardQueryRepository queryRepository) {
        this(queryRepository, Clock.systemUTC());
    }
    
    GetSystemHealthHandler(DashboardQueryRepository queryRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.clock = clock;
    }
    
    @Transactional(readOnly = true)
    public SystemHealthResponse handle() {
        Instant now = clock.instant();
        try {
            long stuck = queryRepository.countByStatusAndCreatedAtBefore(
                BatchStatus.PROCESSING.value(), now.minus(STUCK_AFTER));
            if (stuck > 0) {
                return new SystemHealthResponse(SystemHealthResponse.WARNING,
                    stuck + " batch(es) have been processing for over 2 hours");
            }
            
            long recentFailed = queryRepository.countByStatusAndCreatedAtGreaterThanEqual(
                BatchStatus.FAILED.value(), now.minus(FAILURE_WINDOW));
            if (recentFailed > FAILURE_LIMIT) {
                return new SystemHealthResponse(SystemHealthResponse.WARNING,
                    "High failure rate: " + recentFailed + " failed batches in last 24 hours");
            }
            
            return new SystemHealthResponse(SystemHealthResponse.HEALTHY, "All systems running optimally");
        } catch (DataAccessException e) {
            log.warn("System health check could not query batches", e);
            return new SystemHealthResponse(SystemHealthResponse.ERROR, "Unable to check system health");
        }
    }
}
