package com.starscape.watermarkbatch.features.trackprogress.api.dto;

import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;

/**
 * One document's progress as sent to clients.
 */
public record ItemProgressView(
    String itemId,
    String name,
    long size,
    String status,
    int progress,
    String error
) {
    public static ItemProgressView from(ItemProgress item) {
        return new ItemProgressView(
            item.id(),
            item.name(),
            item.size(),
            item.status().value(),
            item.progress(),
            item.error()
        );
    }
}
