package com.phillippitts.whisperwriter.exception;

/**
 * Thrown when the microphone cannot be opened or read.
 * The recording session ends with an empty transcript; the next activation tries again.
 */
public class AudioCaptureException extends WhisperWriterException {

    private final String reason;

    public AudioCaptureException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Machine-readable reason: MIC_UNAVAILABLE, MIC_PERMISSION_DENIED or CAPTURE_ERROR. */
    public String getReason() {
        return reason;
    }
}
