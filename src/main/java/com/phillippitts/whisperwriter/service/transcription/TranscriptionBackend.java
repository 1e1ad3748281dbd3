package com.phillippitts.whisperwriter.service.transcription;

import com.phillippitts.whisperwriter.domain.AudioBuffer;

/**
 * A speech recognizer capable of turning one finished recording into text.
 *
 * <p>Implementations are not preemptible: once called, transcription runs to completion.
 * Failures surface as {@link com.phillippitts.whisperwriter.exception.BackendInitException} or
 * {@link com.phillippitts.whisperwriter.exception.BackendInvocationException}.
 */
public interface TranscriptionBackend {

    /** Short identifier used in logs and metric tags, e.g. "local" or "api". */
    String name();

    /**
     * Transcribes a non-empty buffer.
     *
     * @return recognized text, possibly empty
     */
    String transcribe(AudioBuffer buffer, DecodingOptions options);
}
