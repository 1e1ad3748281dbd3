package com.phillippitts.whisperwriter.exception;

/**
 * Base exception for all whisperwriter application-specific errors.
 * Every domain exception extends this class so callers can recover at a single boundary.
 */
public class WhisperWriterException extends RuntimeException {

    public WhisperWriterException(String message) {
        super(message);
    }

    public WhisperWriterException(String message, Throwable cause) {
        super(message, cause);
    }

    public WhisperWriterException(Throwable cause) {
        super(cause);
    }
}
