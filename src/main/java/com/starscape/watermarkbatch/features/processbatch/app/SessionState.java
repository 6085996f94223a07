package com.starscape.watermarkbatch.features.processbatch.app;

public enum SessionState {
    NOT_STARTED,
    STARTING,
    RUNNING,
    CANCELLING,
    COMPLETED,
    FAILED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
