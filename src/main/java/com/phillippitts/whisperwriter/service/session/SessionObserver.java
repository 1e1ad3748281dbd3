package com.phillippitts.whisperwriter.service.session;

import com.phillippitts.whisperwriter.domain.SessionState;

/**
 * Receives every state a session enters after {@code IDLE}. Invoked on whichever thread caused
 * the transition, often the session worker.
 */
@FunctionalInterface
public interface SessionObserver {

    SessionObserver NONE = (sessionId, state) -> { };

    void onStateChanged(String sessionId, SessionState state);
}
