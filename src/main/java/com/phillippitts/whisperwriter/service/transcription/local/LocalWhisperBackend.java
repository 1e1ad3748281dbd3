package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionBackend;

import java.util.Objects;

/**
 * Runs recordings through the cached local model. Samples are rescaled to floats
 * ({@code s / 32768.0}) before inference.
 */
public class LocalWhisperBackend implements TranscriptionBackend {

    public static final String NAME = "local";

    private final LocalModelProvider provider;
    private final LocalDecodeSettings settings;

    public LocalWhisperBackend(LocalModelProvider provider, LocalDecodeSettings settings) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String transcribe(AudioBuffer buffer, DecodingOptions options) {
        LocalWhisperModel model = provider.get();
        return model.transcribe(buffer.toFloatSamples(), buffer.sampleRate(), options, settings);
    }
}
