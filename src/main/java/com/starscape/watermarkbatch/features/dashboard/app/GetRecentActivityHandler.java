package com.starscape.watermarkbatch.features.dashboard.app;

import com.starscape.watermarkbatch.features.batches.domain.Batch;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.dashboard.api.dto.ActivityItem;
import com.starscape.watermarkbatch.features.dashboard.infra.DashboardQueryRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns the most recent batches into an activity feed, newest first.
 * A batch can contribute two entries: its creation (if within the last day) and its current state.
 */
@Service
public class GetRecentActivityHandler {
    
    static final int MAX_LIMIT = 50;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    
    private final DashboardQueryRepository queryRepository;
    private final Clock clock;
    
    @Autowired
    public GetRecentActivityHandler(DashboardQueryRepository queryRepository) {
        this(queryRepository, Clock.systemUTC());
    }
    
    GetRecentActivityHandler(DashboardQueryRepository queryRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.clock = clock;
    }
    
    @Transactional(readOnly = true)
    public List<ActivityItem> handle(int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        Instant now = clock.instant();
        
        List<ActivityItem> activities = new ArrayList<>();
        for (Batch batch : queryRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, boundedLimit))) {
            activities.addAll(toActivities(batch, now));
        }
        
        return activities.stream()
            .sorted(Comparator.comparing(ActivityItem::time).reversed())
            .limit(boundedLimit)
            .toList();
    }
    
    private List<ActivityItem> toActivities(Batch batch, Instant now) {
        List<ActivityItem> items = new ArrayList<>(2);
        String name = batch.getBatchName() != null && !batch.getBatchName().isBlank()
            ? batch.getBatchName()
            : "Batch #" + batch.getBatchId().substring(0, Math.min(8, batch.getBatchId().length()));
        Instant created = batch.getCreatedAt();
        Instant completed = batch.getCompletedAt();
        BatchStatus status = BatchStatus.fromValue(batch.getStatus()).orElse(null);
        
        if (status == BatchStatus.COMPLETED && completed != null) {
            String description = batch.getProcessedFiles() + " documents watermarked successfully"
                + (batch.getFailedFiles() > 0 ? ", " + batch.getFailedFiles() + " failed" : "");
            items.add(new ActivityItem(
                batch.getBatchId() + "-completed",
                name + " completed",
                description,
                completed,
                RelativeTimeFormatter.format(completed, now),
                batch.getFailedFiles() > 0 ? "warning" : "completed",
                batch.getBatchId()
            ));
        } else if (status == BatchStatus.PROCESSING) {
            items.add(new ActivityItem(
                batch.getBatchId() + "-processing",
                name + " processing",
                batch.getTotalFiles() + " documents being watermarked",
                created,
                RelativeTimeFormatter.format(created, now),
                "processing",
                batch.getBatchId()
            ));
        } else if (status == BatchStatus.FAILED) {
            Instant at = completed != null ? completed : created;
            items.add(new ActivityItem(
                batch.getBatchId() + "-failed",
                name + " failed",
                "Batch processing encountered errors",
                at,
                RelativeTimeFormatter.format(at, now),
                "failed",
                batch.getBatchId()
            ));
        }
        
        if (created.isAfter(now.minus(RECENT_WINDOW))) {
            items.add(new ActivityItem(
                batch.getBatchId() + "-created",
                "New batch started",
                batch.getTotalFiles() + " documents uploaded for watermarking",
                created,
                RelativeTimeFormatter.format(created, now),
                "info",
                batch.getBatchId()
            ));
        }
        return items;
    }
}
