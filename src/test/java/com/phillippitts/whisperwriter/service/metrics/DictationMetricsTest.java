package com.phillippitts.whisperwriter.service.metrics;

import com.phillippitts.whisperwriter.domain.SessionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DictationMetricsTest {

    private SimpleMeterRegistry registry;
    private DictationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DictationMetrics(registry);
    }

    @Test
    void recordsLatencyPerBackend() {
        metrics.recordLatency("local", TimeUnit.MILLISECONDS.toNanos(120));
        metrics.recordLatency("local", TimeUnit.MILLISECONDS.toNanos(80));

        Timer timer = registry.find("whisperwriter.transcription.latency").tag("backend", "local").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    void countsFailuresPerBackend() {
        metrics.incrementFailure("api");

        Counter counter = registry.find("whisperwriter.transcription.failure").tag("backend", "api").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void countsSessionsByLowercaseOutcome() {
        metrics.incrementSession(SessionResult.Outcome.COMPLETED);
        metrics.incrementSession(SessionResult.Outcome.COMPLETED);
        metrics.incrementSession(SessionResult.Outcome.CANCELLED);

        assertThat(registry.find("whisperwriter.session").tag("outcome", "completed").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("whisperwriter.session").tag("outcome", "cancelled").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void countsCommandsByPhrase() {
        metrics.incrementCommand("wiz open edge");

        assertThat(registry.find("whisperwriter.command.executed").tag("phrase", "wiz open edge").counter().count())
                .isEqualTo(1.0);
    }
}
