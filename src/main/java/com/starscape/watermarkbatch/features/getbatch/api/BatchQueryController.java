package com.starscape.watermarkbatch.features.getbatch.api;

import com.starscape.watermarkbatch.features.getbatch.api.dto.BatchStatusResponse;
import com.starscape.watermarkbatch.features.getbatch.app.GetBatchStatusHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Point-in-time batch status, for clients that poll instead of subscribing.
 */
@RestController
@RequestMapping("/queries")
public class BatchQueryController {
    
    private final GetBatchStatusHandler getBatchStatusHandler;
    
    public BatchQueryController(GetBatchStatusHandler getBatchStatusHandler) {
        this.getBatchStatusHandler = getBatchStatusHandler;
    }
    
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<BatchStatusResponse> getBatchStatus(@PathVariable String batchId) {
        return ResponseEntity.ok(getBatchStatusHandler.handle(batchId));
    }
}
