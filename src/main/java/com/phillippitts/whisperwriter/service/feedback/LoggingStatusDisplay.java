package com.phillippitts.whisperwriter.service.feedback;

import com.phillippitts.whisperwriter.domain.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Status display for a headless agent: one INFO line per state change.
 */
public class LoggingStatusDisplay implements StatusDisplay {

    private static final Logger LOG = LogManager.getLogger("whisperwriter.status");

    @Override
    public void show(String sessionId, SessionState state) {
        switch (state) {
            case RECORDING -> LOG.info("[{}] Recording...", sessionId);
            case TRANSCRIBING -> LOG.info("[{}] Transcribing...", sessionId);
            case STOPPED -> LOG.info("[{}] Done", sessionId);
            case IDLE -> LOG.debug("[{}] Idle", sessionId);
        }
    }
}
