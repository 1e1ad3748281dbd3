package com.phillippitts.whisperwriter.service.session;

import com.phillippitts.whisperwriter.domain.RecordingMode;
import com.phillippitts.whisperwriter.service.audio.capture.AudioSourceFactory;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates fresh, unstarted {@link RecordingSession}s sharing one pipeline and executor.
 * Session ids are sequential ({@code s1}, {@code s2}, ...) for readable logs.
 */
public class RecordingSessionFactory {

    private final RecordingMode mode;
    private final AudioSourceFactory sourceFactory;
    private final DictationPipeline pipeline;
    private final Executor executor;
    private final RecordingSettings settings;
    private final DictationMetrics metrics;
    private final AtomicLong sequence = new AtomicLong();

    public RecordingSessionFactory(RecordingMode mode, AudioSourceFactory sourceFactory, DictationPipeline pipeline,
                                   Executor executor, RecordingSettings settings, DictationMetrics metrics) {
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RecordingSession create(SessionObserver observer) {
        return new RecordingSession("s" + sequence.incrementAndGet(), mode, sourceFactory, pipeline,
                executor, settings, metrics, observer);
    }

    public RecordingMode mode() {
        return mode;
    }
}
