package com.phillippitts.whisperwriter.domain;

/**
 * How the activation key drives recording sessions. Fixed for the lifetime of the process.
 *
 * <p>Bound from {@code recording-options.recording-mode}; Spring's relaxed binding accepts
 * {@code press_to_toggle}, {@code press-to-toggle} and {@code PRESS_TO_TOGGLE} alike.
 */
public enum RecordingMode {
    /** First press starts recording, second press stops and transcribes. */
    PRESS_TO_TOGGLE,
    /** Recording runs while the key is held; release stops and transcribes. */
    HOLD_TO_RECORD,
    /** Sessions restart automatically after each transcription until stopped externally. */
    CONTINUOUS
}
