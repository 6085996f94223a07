package com.starscape.watermarkbatch.features.processbatch.app;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which batches this process has had accepted by the processing backend.
 * Entries live for the lifetime of the process.
 */
@Component
public class TriggerLedger {
    
    private final Set<String> triggered = ConcurrentHashMap.newKeySet();
    
    /**
     * @return true if this is the first trigger for the batch
     */
    public boolean markTriggered(String batchId) {
        return triggered.add(batchId);
    }
    
    /**
     * Forget a trigger the backend did not accept, so a later session can retry it.
     */
    public void release(String batchId) {
        triggered.remove(batchId);
    }
}
