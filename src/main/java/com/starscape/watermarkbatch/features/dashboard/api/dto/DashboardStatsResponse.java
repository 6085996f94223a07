package com.starscape.watermarkbatch.features.dashboard.api.dto;

public record DashboardStatsResponse(
    long documentsProcessedToday,
    long totalThisMonth,
    long activeBatches,
    long totalBatches,
    long totalFiles,
    int successRate,
    Trends trends
) {
    /**
     * monthlyChange is the percent change in batches created this month versus last month.
     */
    public record Trends(
        int monthlyChange,
        long pendingCount
    ) {}
}
