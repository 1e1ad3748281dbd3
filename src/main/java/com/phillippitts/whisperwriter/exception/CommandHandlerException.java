package com.phillippitts.whisperwriter.exception;

/**
 * Thrown by a voice command handler whose side effect failed.
 * The command processor absorbs it and leaves the transcript unchanged.
 */
public class CommandHandlerException extends WhisperWriterException {

    private final String phrase;

    public CommandHandlerException(String phrase, String message, Throwable cause) {
        super("Command '" + phrase + "' failed: " + message, cause);
        this.phrase = phrase;
    }

    public String getPhrase() {
        return phrase;
    }
}
