package com.starscape.watermarkbatch.features.processbatch.api.dto;

import com.starscape.watermarkbatch.features.processbatch.app.BatchSession;

/**
 * State of the session driving a batch. Progress itself is delivered on /topic/batch/{batchId}.
 */
public record SessionStatusResponse(
    String batchId,
    String state,
    String mode,
    String batchStatus,
    Double overallProgress
) {
    public static SessionStatusResponse from(BatchSession session) {
        return new SessionStatusResponse(
            session.getBatchId(),
            session.getState().name(),
            session.getMode().value(),
            session.getLatestSnapshot().map(s -> s.batchStatus().value()).orElse(null),
            session.getLatestSnapshot().map(s -> s.summary().overallProgress()).orElse(null)
        );
    }
}
