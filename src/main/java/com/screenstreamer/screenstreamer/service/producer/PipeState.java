package com.screenstreamer.screenstreamer.service.producer;

/**
 * Shutdown state machine of a producer pipe:
 * RUNNING -> STOP_REQUESTED -> (EXITED | FORCE_KILLED).
 * A producer that ends on its own goes straight from RUNNING to EXITED.
 */
public enum PipeState {
    RUNNING,
    STOP_REQUESTED,
    EXITED,
    FORCE_KILLED;

    public boolean isTerminal() {
        return this == EXITED || this == FORCE_KILLED;
    }
}
