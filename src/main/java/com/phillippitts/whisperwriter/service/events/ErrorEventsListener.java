package com.phillippitts.whisperwriter.service.events;

import com.phillippitts.whisperwriter.domain.SessionResult;
import com.phillippitts.whisperwriter.service.activation.SessionCompletedEvent;
import com.phillippitts.whisperwriter.service.audio.capture.CaptureErrorEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.whisperwriter.service.typing.event.AllTypingFallbacksFailedEvent;
import com.phillippitts.whisperwriter.service.typing.event.TypingFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns user-facing error events into actionable log lines. Never logs transcript text, and
 * repeats of the same problem are throttled to one line per minute.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onHotkeyPermissionDenied(HotkeyPermissionDeniedEvent e) {
        if (shouldLog("hotkey-permission")) {
            LOG.warn("Global hotkey unavailable. On macOS grant Accessibility "
                    + "(System Settings > Privacy & Security > Accessibility) and restart; "
                    + "on Linux make sure an X11 session is running.");
        }
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        if (shouldLog("capture-" + e.reason())) {
            LOG.warn("Microphone error: reason={}. Check recording-options.sound-device and OS permissions.",
                    e.reason());
        }
    }

    @EventListener
    void onTypingFallback(TypingFallbackEvent e) {
        if (shouldLog("typing-fallback-" + e.adapter())) {
            LOG.info("Typing adapter {} fell through ({}); trying the next one", e.adapter(), e.reason());
        }
    }

    @EventListener
    void onAllTypingFailed(AllTypingFallbacksFailedEvent e) {
        if (shouldLog("typing-failed")) {
            LOG.warn("Dictated text could not be typed or copied (chars={}). "
                    + "Check Accessibility permission and that a display is available.", e.chars());
        }
    }

    @EventListener
    void onSessionCompleted(SessionCompletedEvent e) {
        if (e.outcome() == SessionResult.Outcome.FAILED && shouldLog("session-failed")) {
            LOG.warn("Transcription failed for session {}; nothing was typed. "
                    + "Check the model-options.* settings and the log above for the cause.", e.sessionId());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
