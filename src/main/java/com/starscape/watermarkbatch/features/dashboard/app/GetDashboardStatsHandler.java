package com.starscape.watermarkbatch.features.dashboard.app;

import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.dashboard.api.dto.DashboardStatsResponse;
import com.starscape.watermarkbatch.features.dashboard.infra.DashboardQueryRepository;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Dashboard totals. Day and month boundaries are taken in UTC.
 */
@Service
public class GetDashboardStatsHandler {
    
    private final DashboardQueryRepository queryRepository;
    private final Clock clock;
    
    @Autowired
    public GetDashboardStatsHandler(DashboardQueryRepository queryRepository) {
        this(queryRepository, Clock.systemUTC());
    }
    
    GetDashboardStatsHandler(DashboardQueryRepository queryRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.clock = clock;
    }
    
    @Transactional(readOnly = true)
    public DashboardStatsResponse handle() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant todayStart = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant monthStart = today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant lastMonthStart = today.withDayOfMonth(1).minusMonths(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        
        long totalBatches = queryRepository.count();
        long monthBatches = queryRepository.countByCreatedAtGreaterThanEqual(monthStart);
        long lastMonthBatches = queryRepository.countCreatedBetween(lastMonthStart, monthStart);
        long activeBatches = queryRepository.countByStatusIn(
            List.of(BatchStatus.PENDING.value(), BatchStatus.PROCESSING.value()));
        long pendingBatches = queryRepository.countByStatus(BatchStatus.PENDING.value());
        
        long totalFiles = queryRepository.countItems();
        long completedFiles = queryRepository.countItemsByStatus(ItemStatus.COMPLETED.value());
        long failedFiles = queryRepository.countItemsByStatus(ItemStatus.FAILED.value());
        long processedToday = queryRepository.countItemsProcessedSince(ItemStatus.COMPLETED.value(), todayStart);
        
        return new DashboardStatsResponse(
            processedToday,
            monthBatches,
            activeBatches,
            totalBatches,
            totalFiles,
            successRate(completedFiles, failedFiles),
            new DashboardStatsResponse.Trends(monthlyChange(monthBatches, lastMonthBatches), pendingBatches)
        );
    }
    
    /**
     * Percentage of finished documents that were watermarked successfully.
     */
    static int successRate(long completed, long failed) {
        long finished = completed + failed;
        return finished > 0 ? (int) Math.round(completed * 100.0 / finished) : 0;
    }
    
    static int monthlyChange(long thisMonth, long lastMonth) {
        if (lastMonth > 0) {
            return (int) Math.round((thisMonth - lastMonth) * 100.0 / lastMonth);
        }
        return thisMonth > 0 ? 100 : 0;
    }
}
