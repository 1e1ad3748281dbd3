package com.phillippitts.whisperwriter.service.feedback;

import com.phillippitts.whisperwriter.domain.SessionState;

/**
 * Receives session state changes for user-visible status. Called from session worker threads,
 * so implementations must be thread-safe.
 */
public interface StatusDisplay {

    /** Used when {@code misc.hide-status-window=true}: every call is a no-op. */
    StatusDisplay NONE = (sessionId, state) -> { };

    void show(String sessionId, SessionState state);
}
