package com.phillippitts.whisperwriter.service.feedback;

/**
 * Audible cue played after dictated text has been typed.
 */
@FunctionalInterface
public interface CompletionChime {

    CompletionChime SILENT = () -> { };

    /** Starts playback without blocking the caller. Never throws. */
    void play();
}
