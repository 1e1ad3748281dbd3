package com.phillippitts.whisperwriter.service.audio.capture;

/**
 * A microphone stream owned by exactly one recording session.
 *
 * <p>Lifecycle: {@link #open()} once, poll {@link #readAvailableSamples()} until done, then
 * {@link #close()}. Implementations need not be thread-safe; only the session worker touches them.
 */
public interface AudioSource extends AutoCloseable {

    /**
     * Acquires the device and starts capturing.
     *
     * @throws com.phillippitts.whisperwriter.exception.AudioCaptureException if the device is unavailable
     */
    void open();

    /**
     * Returns whatever signed 16-bit mono samples are ready without waiting for more.
     * May return an empty array.
     */
    short[] readAvailableSamples();

    /** Sample rate of the returned samples, in Hz. */
    int sampleRate();

    /** Releases the device. Idempotent; never throws. */
    @Override
    void close();
}
