package com.phillippitts.whisperwriter.service.transcription.local;

/**
 * Loads a {@link LocalWhisperModel} for a spec.
 */
@FunctionalInterface
public interface LocalModelLoader {

    /**
     * @throws com.phillippitts.whisperwriter.exception.BackendInitException when the weights,
     *         the runtime or the requested device are unavailable
     */
    LocalWhisperModel load(LocalModelSpec spec);
}
