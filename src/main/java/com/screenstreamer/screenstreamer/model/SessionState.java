package com.screenstreamer.screenstreamer.model;

public enum SessionState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED,
    // producer closed its output on its own
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == RUNNING;
    }
}
