package com.phillippitts.whisperwriter.service.activation;

import com.phillippitts.whisperwriter.domain.RecordingMode;
import com.phillippitts.whisperwriter.domain.SessionResult;
import com.phillippitts.whisperwriter.domain.SessionState;
import com.phillippitts.whisperwriter.service.feedback.CompletionChime;
import com.phillippitts.whisperwriter.service.feedback.StatusDisplay;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyCancelEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyPressedEvent;
import com.phillippitts.whisperwriter.service.hotkey.event.HotkeyReleasedEvent;
import com.phillippitts.whisperwriter.service.session.RecordingSession;
import com.phillippitts.whisperwriter.service.session.RecordingSessionFactory;
import com.phillippitts.whisperwriter.service.typing.TypingService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps activation key presses and releases onto recording sessions according to the
 * {@link RecordingMode}.
 *
 * <pre>
 * mode             activate (idle)        activate (active)            deactivate
 * PRESS_TO_TOGGLE  start                  stop and transcribe          no-op
 * CONTINUOUS       start, loop on         stop and transcribe, loop on no-op
 * HOLD_TO_RECORD   start                  no-op                        stop and transcribe
 * </pre>
 *
 * <p>At most one session exists at a time: the check for an existing session and the creation of
 * a new one happen under one lock. When a session stops the controller clears it, types the text
 * (unless cancelled), optionally plays the chime, and in continuous mode immediately starts the
 * next session until the cancel key ({@link #cancelActiveSession()}) or application shutdown ends
 * the loop.
 * Each finished session is announced as a {@link SessionCompletedEvent}.
 */
public class ActivationController implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ActivationController.class);

    private final RecordingMode mode;
    private final RecordingSessionFactory sessionFactory;
    private final TypingService typingService;
    private final StatusDisplay statusDisplay;
    private final CompletionChime chime;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    private RecordingSession current;
    private volatile boolean continuousLoop;
    private volatile boolean running;
    private volatile boolean shutDown;

    public ActivationController(RecordingSessionFactory sessionFactory, TypingService typingService,
                                StatusDisplay statusDisplay, CompletionChime chime,
                                ApplicationEventPublisher publisher) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
        this.mode = sessionFactory.mode();
        this.typingService = Objects.requireNonNull(typingService, "typingService must not be null");
        this.statusDisplay = statusDisplay == null ? StatusDisplay.NONE : statusDisplay;
        this.chime = chime == null ? CompletionChime.SILENT : chime;
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @EventListener
    public void onHotkeyPressed(HotkeyPressedEvent event) {
        onActivate();
    }

    @EventListener
    public void onHotkeyReleased(HotkeyReleasedEvent event) {
        onDeactivate();
    }

    @EventListener
    public void onHotkeyCancel(HotkeyCancelEvent event) {
        LOG.info("Cancel key pressed");
        cancelActiveSession();
    }

    /**
     * Activation key went down.
     */
    public void onActivate() {
        lock.lock();
        try {
            if (shutDown) {
                return;
            }
            RecordingSession session = current;
            if (session == null) {
                if (mode == RecordingMode.CONTINUOUS) {
                    continuousLoop = true;
                }
                startSession();
                return;
            }
            switch (mode) {
                case PRESS_TO_TOGGLE, CONTINUOUS -> {
                    if (!session.stopRecording()) {
                        LOG.debug("Session {} is {}; activation ignored", session.id(), session.state());
                    }
                }
                case HOLD_TO_RECORD -> LOG.debug("Session {} already recording; activation ignored", session.id());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activation key was released. Only meaningful in hold-to-record mode.
     */
    public void onDeactivate() {
        if (mode != RecordingMode.HOLD_TO_RECORD) {
            return;
        }
        lock.lock();
        try {
            RecordingSession session = current;
            if (session == null) {
                return;
            }
            session.stopRecording();
        } finally {
            lock.unlock();
        }
    }

    /**
     * External stop: ends the continuous loop and aborts a session that is still recording. A
     * session already transcribing finishes and its text is still typed.
     */
    public void cancelActiveSession() {
        lock.lock();
        try {
            continuousLoop = false;
            RecordingSession session = current;
            if (session != null && !session.cancel()) {
                LOG.debug("Session {} is {}; letting it finish", session.id(), session.state());
            }
        } finally {
            lock.unlock();
        }
    }

    /** State of the current session, or {@code IDLE} when there is none. */
    public SessionState currentState() {
        lock.lock();
        try {
            return current == null ? SessionState.IDLE : current.state();
        } finally {
            lock.unlock();
        }
    }

    public Optional<RecordingSession> currentSession() {
        lock.lock();
        try {
            return Optional.ofNullable(current);
        } finally {
            lock.unlock();
        }
    }

    public boolean isContinuousLoopRunning() {
        return continuousLoop;
    }

    public RecordingMode mode() {
        return mode;
    }

    // lock must be held
    private void startSession() {
        RecordingSession session = sessionFactory.create(statusDisplay::show);
        current = session;
        session.completion().whenComplete((result, error) -> {
            // the dependent future is never observed
            try {
                if (error != null) {
                    LOG.error("Session {} completed exceptionally", session.id(), error);
                    onSessionStopped(session, SessionResult.failed(session.id()));
                } else {
                    onSessionStopped(session, result);
                }
            } catch (RuntimeException e) {
                LOG.error("Handling the end of session {} failed", session.id(), e);
            }
        });
        LOG.debug("Starting session {} ({})", session.id(), mode);
        session.start();
    }

    private void onSessionStopped(RecordingSession session, SessionResult result) {
        boolean restart;
        lock.lock();
        try {
            if (current == session) {
                current = null;
            }
            if (result.outcome() == SessionResult.Outcome.CAPTURE_FAILED && continuousLoop) {
                LOG.warn("Recording unavailable; continuous dictation stopped");
                continuousLoop = false;
            }
            restart = mode == RecordingMode.CONTINUOUS && continuousLoop && !shutDown;
        } finally {
            lock.unlock();
        }

        deliver(result);
        try {
            publisher.publishEvent(SessionCompletedEvent.of(result));
        } catch (RuntimeException e) {
            LOG.error("Publishing completion of session {} failed", result.sessionId(), e);
        }

        if (restart) {
            lock.lock();
            try {
                if (current == null && continuousLoop && !shutDown) {
                    startSession();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    private void deliver(SessionResult result) {
        if (result.isCancelled()) {
            return;
        }
        try {
            typingService.paste(result.text());
        } catch (RuntimeException e) {
            LOG.warn("Typing failed for session {}: {}", result.sessionId(), e.toString());
        }
        if (!result.text().isEmpty()) {
            chime.play();
        }
    }

    @Override
    public void start() {
        running = true;
        LOG.info("Activation controller ready: mode={}", mode);
    }

    @Override
    public void stop() {
        shutDown = true;
        cancelActiveSession();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
