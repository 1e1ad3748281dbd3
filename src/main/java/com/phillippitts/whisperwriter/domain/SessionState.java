package com.phillippitts.whisperwriter.domain;

/**
 * Lifecycle of a single recording session. Transitions only move forward:
 * {@code IDLE -> RECORDING -> TRANSCRIBING -> STOPPED}, or {@code RECORDING -> STOPPED} on cancel.
 */
public enum SessionState {
    IDLE,
    RECORDING,
    TRANSCRIBING,
    STOPPED;

    /** True while the session holds the microphone or the backend. */
    public boolean isActive() {
        return this == RECORDING || this == TRANSCRIBING;
    }
}
