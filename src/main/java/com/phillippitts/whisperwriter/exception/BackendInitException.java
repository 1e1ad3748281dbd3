package com.phillippitts.whisperwriter.exception;

/**
 * Thrown when a transcription backend cannot be prepared: the model is missing, the device is
 * unsupported, or the native binary cannot be found.
 *
 * <p>The local model provider recovers from this once by retrying on the CPU. A second failure
 * reaches the recording session, which reports an empty transcript.
 */
public class BackendInitException extends WhisperWriterException {

    private final String modelId;
    private final String device;

    public BackendInitException(String message, String modelId, String device) {
        super(message + " (model=" + modelId + ", device=" + device + ")");
        this.modelId = modelId;
        this.device = device;
    }

    public BackendInitException(String message, String modelId, String device, Throwable cause) {
        super(message + " (model=" + modelId + ", device=" + device + ")", cause);
        this.modelId = modelId;
        this.device = device;
    }

    public String getModelId() {
        return modelId;
    }

    public String getDevice() {
        return device;
    }
}
