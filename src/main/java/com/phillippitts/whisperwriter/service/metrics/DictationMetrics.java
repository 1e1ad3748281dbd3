package com.phillippitts.whisperwriter.service.metrics;

import com.phillippitts.whisperwriter.domain.SessionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the dictation pipeline.
 *
 * <ul>
 *   <li>{@code whisperwriter.transcription.latency} timer, tagged by backend</li>
 *   <li>{@code whisperwriter.transcription.failure} counter, tagged by backend</li>
 *   <li>{@code whisperwriter.session} counter, tagged by outcome</li>
 *   <li>{@code whisperwriter.command.executed} counter, tagged by phrase</li>
 * </ul>
 */
@Component
public class DictationMetrics {

    private static final String METRIC_PREFIX = "whisperwriter";

    private final MeterRegistry registry;

    public DictationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLatency(String backendName, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken by a backend to transcribe one recording")
                .tag("backend", backendName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFailure(String backendName) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of failed transcriptions")
                .tag("backend", backendName)
                .register(registry)
                .increment();
    }

    public void incrementSession(SessionResult.Outcome outcome) {
        Counter.builder(METRIC_PREFIX + ".session")
                .description("Recording sessions by outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementCommand(String phrase) {
        Counter.builder(METRIC_PREFIX + ".command.executed")
                .description("Voice commands executed")
                .tag("phrase", phrase)
                .register(registry)
                .increment();
    }
}
