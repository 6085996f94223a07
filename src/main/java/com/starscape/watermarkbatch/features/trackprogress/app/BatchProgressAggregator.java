package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemStatus;
import com.starscape.watermarkbatch.features.trackprogress.domain.ProgressSummary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Turns a set of item states into overall batch progress.
 * Stateless: the same items always produce the same summary, in any order.
 */
public final class BatchProgressAggregator {
    
    private BatchProgressAggregator() {
    }
    
    public static ProgressSummary aggregate(List<ItemProgress> items) {
        if (items == null || items.isEmpty()) {
            return ProgressSummary.empty();
        }
        
        int total = items.size();
        int completed = 0;
        int failed = 0;
        for (ItemProgress item : items) {
            if (item.status() == ItemStatus.COMPLETED) {
                completed++;
            } else if (item.status() == ItemStatus.FAILED) {
                failed++;
            }
        }
        
        double overallProgress = BigDecimal.valueOf((completed + failed) * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
        
        return new ProgressSummary(overallProgress, completed, failed, total - completed - failed, total);
    }
}
