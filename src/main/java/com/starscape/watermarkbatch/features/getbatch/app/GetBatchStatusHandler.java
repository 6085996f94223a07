package com.starscape.watermarkbatch.features.getbatch.app;

import com.starscape.watermarkbatch.features.getbatch.api.dto.BatchStatusResponse;
import com.starscape.watermarkbatch.features.processbatch.app.BatchSessionRegistry;
import com.starscape.watermarkbatch.features.trackprogress.api.dto.ItemProgressView;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchSnapshotReader;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import org.springframework.stereotype.Service;

@Service
public class GetBatchStatusHandler {
    
    private final BatchSnapshotReader snapshotReader;
    private final BatchSessionRegistry sessionRegistry;
    
    public GetBatchStatusHandler(BatchSnapshotReader snapshotReader, BatchSessionRegistry sessionRegistry) {
        this.snapshotReader = snapshotReader;
        this.sessionRegistry = sessionRegistry;
    }
    
    public BatchStatusResponse handle(String batchId) {
        BatchSnapshot snapshot = snapshotReader.read(batchId, 0L);
        String sessionState = sessionRegistry.find(batchId)
            .map(session -> session.getState().name())
            .orElse(null);
        
        return new BatchStatusResponse(
            snapshot.batchId(),
            snapshot.batchStatus().value(),
            snapshot.mode().value(),
            sessionState,
            snapshot.summary().overallProgress(),
            snapshot.summary().total(),
            snapshot.summary().completed(),
            snapshot.summary().failed(),
            snapshot.summary().remaining(),
            snapshot.items().stream().map(ItemProgressView::from).toList(),
            snapshot.observedAt()
        );
    }
}
