package com.phillippitts.whisperwriter.service.session;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.domain.RecordingMode;
import com.phillippitts.whisperwriter.domain.SessionResult;
import com.phillippitts.whisperwriter.domain.SessionState;
import com.phillippitts.whisperwriter.exception.AudioCaptureException;
import com.phillippitts.whisperwriter.service.audio.capture.AudioSource;
import com.phillippitts.whisperwriter.service.audio.capture.AudioSourceFactory;
import com.phillippitts.whisperwriter.service.audio.capture.SilenceTracker;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import com.phillippitts.whisperwriter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One record-then-transcribe cycle, driven by a worker on the session executor.
 *
 * <p>State machine: {@code IDLE -> RECORDING -> TRANSCRIBING -> STOPPED}, or
 * {@code RECORDING -> STOPPED} when cancelled. A session is single-use.
 *
 * <p>The worker owns the {@link AudioSource} and the sample accumulator; nothing else reads the
 * samples until they are frozen into an {@link AudioBuffer}. Cancellation is cooperative: the
 * flag is checked after the source is closed and again right before the backend call, never in
 * the middle of inference.
 *
 * <p>{@link #completion()} is completed exactly once, after the state became {@code STOPPED}.
 * It never completes exceptionally: every failure becomes an empty result.
 */
public class RecordingSession {

    private static final Logger LOG = LogManager.getLogger(RecordingSession.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final String id;
    private final RecordingMode mode;
    private final AudioSourceFactory sourceFactory;
    private final DictationPipeline pipeline;
    private final Executor executor;
    private final RecordingSettings settings;
    private final DictationMetrics metrics;
    private final SessionObserver observer;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final CompletableFuture<SessionResult> completion = new CompletableFuture<>();
    private final Object transitionLock = new Object();

    RecordingSession(String id, RecordingMode mode, AudioSourceFactory sourceFactory, DictationPipeline pipeline,
                     Executor executor, RecordingSettings settings, DictationMetrics metrics,
                     SessionObserver observer) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.observer = observer == null ? SessionObserver.NONE : observer;
    }

    public String id() {
        return id;
    }

    public SessionState state() {
        return state.get();
    }

    /** True while the session holds the microphone or the backend. */
    public boolean isActive() {
        return state.get().isActive();
    }

    public CompletableFuture<SessionResult> completion() {
        return completion;
    }

    /**
     * Moves {@code IDLE -> RECORDING} and hands the capture loop to the executor.
     *
     * @return false if the session was already started
     */
    public boolean start() {
        if (!state.compareAndSet(SessionState.IDLE, SessionState.RECORDING)) {
            return false;
        }
        observer.onStateChanged(id, SessionState.RECORDING);
        try {
            executor.execute(this::runWorker);
        } catch (RejectedExecutionException e) {
            LOG.warn("Session {} rejected by executor: {}", id, e.getMessage());
            finish(SessionResult.captureFailed(id));
        }
        return true;
    }

    /**
     * Ends capture and lets the worker transcribe. Only valid while recording and not cancelled.
     *
     * @return true if this call moved the session to {@code TRANSCRIBING}
     */
    public boolean stopRecording() {
        synchronized (transitionLock) {
            if (cancelRequested.get()) {
                return false;
            }
            if (!state.compareAndSet(SessionState.RECORDING, SessionState.TRANSCRIBING)) {
                return false;
            }
        }
        observer.onStateChanged(id, SessionState.TRANSCRIBING);
        return true;
    }

    /**
     * Aborts a session that is still recording. The captured audio is discarded and the backend is
     * never invoked. Has no effect once transcription started.
     *
     * @return true if the cancellation was registered
     */
    public boolean cancel() {
        synchronized (transitionLock) {
            if (state.get() != SessionState.RECORDING) {
                return false;
            }
            cancelRequested.set(true);
        }
        LOG.info("Session {} cancel requested", id);
        return true;
    }

    private void runWorker() {
        ThreadContext.put(MDC_SESSION_ID, id);
        try {
            AudioBuffer buffer;
            try {
                buffer = capture();
            } catch (AudioCaptureException e) {
                LOG.warn("Session {} could not record: {}", id, e.getMessage());
                finish(SessionResult.captureFailed(id));
                return;
            }
            if (cancelRequested.get()) {
                finish(SessionResult.cancelled(id));
                return;
            }
            if (state.get() == SessionState.RECORDING) {
                // capture ended on its own (duration cap or trailing silence)
                stopRecording();
            }
            finish(transcribe(buffer));
        } catch (RuntimeException e) {
            LOG.error("Session {} failed unexpectedly", id, e);
            finish(SessionResult.failed(id));
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private AudioBuffer capture() {
        long start = System.nanoTime();
        SampleAccumulator samples = new SampleAccumulator();
        SilenceTracker silence = null;
        try (AudioSource source = sourceFactory.create()) {
            source.open();
            int sampleRate = source.sampleRate();
            if (mode == RecordingMode.CONTINUOUS) {
                silence = new SilenceTracker(sampleRate, settings.silenceDurationMs(), settings.silenceThreshold());
            }
            long maxSamples = (long) sampleRate * settings.maxDurationMs() / 1000;
            while (state.get() == SessionState.RECORDING && !cancelRequested.get()) {
                short[] chunk = source.readAvailableSamples();
                if (chunk.length == 0) {
                    if (!TimeUtils.sleepQuietly(settings.pollMillis())) {
                        LOG.debug("Session {} worker interrupted while recording", id);
                        break;
                    }
                    continue;
                }
                samples.append(chunk);
                if (samples.size() >= maxSamples) {
                    LOG.info("Session {} reached max duration ({} ms)", id, settings.maxDurationMs());
                    break;
                }
                if (silence != null && silence.accept(chunk)) {
                    LOG.debug("Session {} utterance ended after {} ms of silence", id, settings.silenceDurationMs());
                    break;
                }
            }
            if (!cancelRequested.get()) {
                // pick up what arrived between the stop request and the close
                samples.append(source.readAvailableSamples());
            }
            AudioBuffer buffer = new AudioBuffer(samples.toArray(), sampleRate);
            LOG.info("Session {} captured {} ms of audio in {} ms", id, buffer.durationMillis(),
                    TimeUtils.elapsedMillis(start));
            if (buffer.durationMillis() < settings.minDurationMs()) {
                LOG.debug("Session {} recording shorter than {} ms; treating as silence", id, settings.minDurationMs());
                return AudioBuffer.empty(sampleRate);
            }
            if (silence != null && !silence.isSpeechHeard()) {
                LOG.debug("Session {} heard no speech; treating as silence", id);
                return AudioBuffer.empty(sampleRate);
            }
            return buffer;
        }
    }

    private SessionResult transcribe(AudioBuffer buffer) {
        if (cancelRequested.get()) {
            return SessionResult.cancelled(id);
        }
        try {
            DictationPipeline.Output out = pipeline.run(buffer);
            return new SessionResult(id, out.text(), SessionResult.Outcome.COMPLETED, out.commandExecuted());
        } catch (RuntimeException e) {
            LOG.warn("Session {} transcription failed: {}", id, e.getMessage(), e);
            return SessionResult.failed(id);
        }
    }

    private void finish(SessionResult result) {
        state.set(SessionState.STOPPED);
        metrics.incrementSession(result.outcome());
        try {
            observer.onStateChanged(id, SessionState.STOPPED);
        } catch (RuntimeException e) {
            LOG.warn("Status observer failed for session {}: {}", id, e.toString());
        }
        LOG.info("Session {} stopped: outcome={}, chars={}", id, result.outcome(), result.text().length());
        completion.complete(result);
    }

    /** Growable short array; avoids boxing every sample. */
    private static final class SampleAccumulator {
        private short[] data = new short[16_000];
        private int size;

        void append(short[] chunk) {
            if (chunk.length == 0) {
                return;
            }
            if (size + chunk.length > data.length) {
                data = Arrays.copyOf(data, Math.max(data.length * 2, size + chunk.length));
            }
            System.arraycopy(chunk, 0, data, size, chunk.length);
            size += chunk.length;
        }

        int size() {
            return size;
        }

        short[] toArray() {
            return Arrays.copyOf(data, size);
        }
    }
}
