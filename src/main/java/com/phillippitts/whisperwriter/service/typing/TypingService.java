package com.phillippitts.whisperwriter.service.typing;

/**
 * Delivers final text into the application that currently has keyboard focus.
 */
public interface TypingService {
    /**
     * Pastes text using the best available strategy. Logs never contain the full text at INFO.
     *
     * @param text text to deliver; empty text is a successful no-op
     * @return true if any strategy succeeded
     */
    boolean paste(String text);
}
