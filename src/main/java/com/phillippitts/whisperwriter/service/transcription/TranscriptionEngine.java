package com.phillippitts.whisperwriter.service.transcription;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import com.phillippitts.whisperwriter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Dispatches finished recordings to the single backend chosen at startup.
 *
 * <p>An empty buffer returns {@code ""} without touching the backend. Backend exceptions
 * propagate unchanged; the recording session decides how to recover.
 */
public class TranscriptionEngine {

    private static final Logger LOG = LogManager.getLogger(TranscriptionEngine.class);

    private final TranscriptionBackend backend;
    private final DecodingOptions options;
    private final DictationMetrics metrics;

    public TranscriptionEngine(TranscriptionBackend backend, DecodingOptions options, DictationMetrics metrics) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public String transcribe(AudioBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer must not be null");
        if (buffer.isEmpty()) {
            LOG.debug("Empty buffer; skipping backend '{}'", backend.name());
            return "";
        }
        long start = System.nanoTime();
        try {
            String text = backend.transcribe(buffer, options);
            metrics.recordLatency(backend.name(), System.nanoTime() - start);
            String result = text == null ? "" : text;
            LOG.info("Backend '{}' transcribed {} ms of audio in {} ms ({} chars)",
                    backend.name(), buffer.durationMillis(), TimeUtils.elapsedMillis(start), result.length());
            return result;
        } catch (RuntimeException e) {
            metrics.incrementFailure(backend.name());
            throw e;
        }
    }

    public String backendName() {
        return backend.name();
    }
}
