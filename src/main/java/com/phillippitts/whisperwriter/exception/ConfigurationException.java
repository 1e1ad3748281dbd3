package com.phillippitts.whisperwriter.exception;

/**
 * Thrown at startup when the configuration cannot produce a working dictation pipeline.
 * This is fatal: the application context refuses to start.
 */
public class ConfigurationException extends WhisperWriterException {

    private final String property;

    public ConfigurationException(String property, String message) {
        super("Invalid configuration '" + property + "': " + message);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
