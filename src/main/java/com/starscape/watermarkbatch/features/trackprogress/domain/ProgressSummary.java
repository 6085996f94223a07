package com.starscape.watermarkbatch.features.trackprogress.domain;

/**
 * Aggregated view of a batch's items.
 * overallProgress is the share of items in a terminal state, in percent with two decimals.
 */
public record ProgressSummary(
    double overallProgress,
    int completed,
    int failed,
    int remaining,
    int total
) {
    
    public static ProgressSummary empty() {
        return new ProgressSummary(0.0, 0, 0, 0, 0);
    }
    
    public int settled() {
        return completed + failed;
    }
}
