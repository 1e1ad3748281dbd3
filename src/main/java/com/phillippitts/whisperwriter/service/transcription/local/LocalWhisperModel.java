package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;

/**
 * A loaded local speech model.
 */
public interface LocalWhisperModel {

    /**
     * Transcribes normalized mono samples.
     *
     * @param samples samples in [-1.0, 1.0]
     * @param sampleRate sample rate in Hz
     * @return joined segment text
     */
    String transcribe(float[] samples, int sampleRate, DecodingOptions options, LocalDecodeSettings settings);

    /** Device the model was loaded on. */
    String device();
}
