package com.phillippitts.whisperwriter.domain;

import java.util.Objects;

/**
 * Single message a recording session emits when it reaches {@link SessionState#STOPPED}.
 *
 * @param sessionId short identifier used in logs
 * @param text final post-processed text; empty when cancelled, failed or silent
 * @param outcome how the session ended
 * @param commandExecuted whether a voice command fired during this session
 */
public record SessionResult(String sessionId, String text, Outcome outcome, boolean commandExecuted) {

    /**
     * COMPLETED: the pipeline ran (the text may still be empty). CANCELLED: aborted while recording.
     * FAILED: transcription or a pipeline stage threw. CAPTURE_FAILED: no audio could be recorded
     * because the microphone or the worker pool was unavailable.
     */
    public enum Outcome { COMPLETED, CANCELLED, FAILED, CAPTURE_FAILED }

    public SessionResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static SessionResult cancelled(String sessionId) {
        return new SessionResult(sessionId, "", Outcome.CANCELLED, false);
    }

    public static SessionResult failed(String sessionId) {
        return new SessionResult(sessionId, "", Outcome.FAILED, false);
    }

    public static SessionResult captureFailed(String sessionId) {
        return new SessionResult(sessionId, "", Outcome.CAPTURE_FAILED, false);
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }
}
