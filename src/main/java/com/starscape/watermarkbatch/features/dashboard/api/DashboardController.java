package com.starscape.watermarkbatch.features.dashboard.api;

import com.starscape.watermarkbatch.features.dashboard.api.dto.ActivityItem;
import com.starscape.watermarkbatch.features.dashboard.api.dto.DashboardStatsResponse;
import com.starscape.watermarkbatch.features.dashboard.api.dto.SystemHealthResponse;
import com.starscape.watermarkbatch.features.dashboard.app.GetDashboardStatsHandler;
import com.starscape.watermarkbatch.features.dashboard.app.GetRecentActivityHandler;
import com.starscape.watermarkbatch.features.dashboard.app.GetSystemHealthHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/queries/dashboard")
public class DashboardController {
    
    private final GetDashboardStatsHandler statsHandler;
    private final GetRecentActivityHandler activityHandler;
    private final GetSystemHealthHandler healthHandler;
    
    public DashboardController(
            GetDashboardStatsHandler statsHandler,
            GetRecentActivityHandler activityHandler,
            GetSystemHealthHandler healthHandler) {
        this.statsHandler = statsHandler;
        this.activityHandler = activityHandler;
        this.healthHandler = healthHandler;
    }
    
    @GetMapping
    public ResponseEntity<DashboardStatsResponse> getStats() {
        return ResponseEntity.ok(statsHandler.handle());
    }
    
    @GetMapping("/activity")
    public ResponseEntity<List<ActivityItem>> getRecentActivity(
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(activityHandler.handle(limit));
    }
    
    @GetMapping("/health")
    public ResponseEntity<SystemHealthResponse> getSystemHealth() {
        return ResponseEntity.ok(healthHandler.handle());
    }
}
