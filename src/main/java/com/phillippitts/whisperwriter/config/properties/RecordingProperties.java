package com.phillippitts.whisperwriter.config.properties;

import com.phillippitts.whisperwriter.domain.RecordingMode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture and the recording mode.
 *
 * <pre>
 * recording-options.recording-mode=press_to_toggle
 * recording-options.sample-rate=16000
 * recording-options.silence-duration-ms=900
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "recording-options")
public class RecordingProperties {

    @NotNull
    private final RecordingMode recordingMode;

    @Min(8000)
    @Max(48000)
    private final int sampleRate;

    /** Mixer name; null selects the system default input. */
    private final String soundDevice;

    @Min(10)
    @Max(500)
    private final int chunkMillis;

    /** Hard cap on a single recording. */
    @Min(1000)
    private final int maxDurationMs;

    /** Recordings shorter than this are discarded as accidental taps. */
    @Min(0)
    private final int minDurationMs;

    /** Trailing silence that ends an utterance in continuous mode. */
    @Min(100)
    @Max(10000)
    private final int silenceDurationMs;

    /** RMS amplitude (0-32767) below which a 20 ms window counts as silence. */
    @Min(0)
    @Max(32767)
    private final int silenceThreshold;

    @ConstructorBinding
    public RecordingProperties(RecordingMode recordingMode,
                               Integer sampleRate,
                               String soundDevice,
                               Integer chunkMillis,
                               Integer maxDurationMs,
                               Integer minDurationMs,
                               Integer silenceDurationMs,
                               Integer silenceThreshold) {
        this.recordingMode = recordingMode == null ? RecordingMode.PRESS_TO_TOGGLE : recordingMode;
        this.sampleRate = sampleRate == null ? 16000 : sampleRate;
        this.soundDevice = (soundDevice == null || soundDevice.isBlank()) ? null : soundDevice;
        this.chunkMillis = chunkMillis == null ? 40 : chunkMillis;
        this.maxDurationMs = maxDurationMs == null ? 600_000 : maxDurationMs;
        this.minDurationMs = minDurationMs == null ? 100 : minDurationMs;
        this.silenceDurationMs = silenceDurationMs == null ? 900 : silenceDurationMs;
        this.silenceThreshold = silenceThreshold == null ? 800 : silenceThreshold;
    }

    public RecordingMode getRecordingMode() {
        return recordingMode;
    }

    public int getSampleRate() {
        return sampleRate;
    }

    public String getSoundDevice() {
        return soundDevice;
    }

    public int getChunkMillis() {
        return chunkMillis;
    }

    public int getMaxDurationMs() {
        return maxDurationMs;
    }

    public int getMinDurationMs() {
        return minDurationMs;
    }

    public int getSilenceDurationMs() {
        return silenceDurationMs;
    }

    public int getSilenceThreshold() {
        return silenceThreshold;
    }
}
