package com.phillippitts.whisperwriter.exception;

/**
 * Thrown when a transcription backend fails while processing a buffer: the recognizer process
 * crashed, the remote API returned an error, or the output could not be parsed.
 *
 * <p>Recovered at the recording-session boundary; the session reaches its stopped state with an
 * empty transcript.
 */
public class BackendInvocationException extends WhisperWriterException {

    private final String backendName;

    public BackendInvocationException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public BackendInvocationException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public BackendInvocationException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
