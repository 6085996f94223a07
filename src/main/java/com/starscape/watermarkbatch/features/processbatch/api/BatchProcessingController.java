package com.starscape.watermarkbatch.features.processbatch.api;

import com.starscape.watermarkbatch.features.processbatch.api.dto.CancelBatchResponse;
import com.starscape.watermarkbatch.features.processbatch.api.dto.PauseBatchResponse;
import com.starscape.watermarkbatch.features.processbatch.api.dto.SessionStatusResponse;
import com.starscape.watermarkbatch.features.processbatch.app.BatchSession;
import com.starscape.watermarkbatch.features.processbatch.app.BatchSessionRegistry;
import com.starscape.watermarkbatch.features.processbatch.app.SessionState;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/commands/batches")
public class BatchProcessingController {
    
    private final BatchSessionRegistry sessionRegistry;
    
    public BatchProcessingController(BatchSessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }
    
    /**
     * Start processing a pending batch, or resume observing one that is already processing.
     * Returns once the backend accepted the request; progress follows over WebSocket.
     */
    @PostMapping("/{batchId}/processing")
    public ResponseEntity<SessionStatusResponse> startProcessing(@PathVariable String batchId) {
        BatchSession session = sessionRegistry.startOrResume(batchId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SessionStatusResponse.from(session));
    }
    
    /**
     * Cancel a running batch. A batch that is not running is left untouched and
     * the response reports cancelled=false.
     */
    @PostMapping("/{batchId}/cancel")
    public ResponseEntity<CancelBatchResponse> cancel(@PathVariable String batchId) {
        boolean cancelled = sessionRegistry.cancel(batchId);
        String state = sessionRegistry.find(batchId)
            .map(session -> session.getState().name())
            .orElse(SessionState.NOT_STARTED.name());
        return ResponseEntity.ok(new CancelBatchResponse(batchId, cancelled, state));
    }
    
    @PostMapping("/{batchId}/pause")
    public ResponseEntity<PauseBatchResponse> pause(@PathVariable String batchId) {
        boolean paused = sessionRegistry.pause(batchId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new PauseBatchResponse(
            batchId,
            paused,
            "Pausing is not supported; processing continues"
        ));
    }
}
