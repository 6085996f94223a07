package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.features.processbatch.app.SessionListener;
import com.starscape.watermarkbatch.features.processbatch.app.SessionOutcome;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.BatchProgressUpdate;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.BatchTerminalUpdate;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.ConnectivityWarning;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Broadcasts batch session updates via WebSocket to subscribers of /topic/batch/{batchId}.
 */
@Service
public class ProgressBroadcaster implements SessionListener {
    
    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);
    
    private final SimpMessagingTemplate messagingTemplate;
    
    public ProgressBroadcaster(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }
    
    public static String destinationFor(String batchId) {
        return "/topic/batch/" + batchId;
    }
    
    @Override
    public void onProgress(BatchSnapshot snapshot) {
        BatchProgressUpdate update = BatchProgressUpdate.from(snapshot);
        send(update.batchId(), update);
        log.debug("Broadcasted progress for batch {}: status={}, progress={}%",
            update.batchId(), update.batchStatus(), update.overallProgress());
    }
    
    @Override
    public void onDegraded(String batchId, int consecutiveFailures) {
        send(batchId, ConnectivityWarning.of(batchId, consecutiveFailures));
        log.debug("Broadcasted connectivity warning for batch {}: failures={}", batchId, consecutiveFailures);
    }
    
    @Override
    public void onTerminal(SessionOutcome outcome) {
        BatchTerminalUpdate update = BatchTerminalUpdate.from(outcome);
        send(outcome.batchId(), update);
        log.info("Broadcasted terminal update for batch {}: result={}, completed={}/{}, failed={}",
            update.batchId(), update.result(), update.completedCount(), update.totalCount(), update.failedCount());
    }
    
    private void send(String batchId, Object payload) {
        // A broken broker must not break the session driving the batch
        try {
            messagingTemplate.convertAndSend(destinationFor(batchId), payload);
        } catch (MessagingException e) {
            log.warn("Failed to broadcast update for batch {}", batchId, e);
        }
    }
}
