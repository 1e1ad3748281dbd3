package com.phillippitts.whisperwriter.service.activation;

import com.phillippitts.whisperwriter.domain.SessionResult;

import java.time.Instant;

/**
 * Published once per session after its text was handed to the typing service. Carries only the
 * character count, never the text.
 */
public record SessionCompletedEvent(String sessionId, SessionResult.Outcome outcome, int chars,
                                    boolean commandExecuted, Instant at) {

    static SessionCompletedEvent of(SessionResult result) {
        return new SessionCompletedEvent(result.sessionId(), result.outcome(), result.text().length(),
                result.commandExecuted(), Instant.now());
    }
}
