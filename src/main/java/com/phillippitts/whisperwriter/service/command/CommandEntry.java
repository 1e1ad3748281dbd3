package com.phillippitts.whisperwriter.service.command;

import java.util.Objects;

/**
 * A registered voice command.
 *
 * @param phrase sanitized lowercase phrase matched as a substring of the sanitized transcript
 * @param handler side effect to run on match
 */
public record CommandEntry(String phrase, CommandHandler handler) {

    public CommandEntry {
        Objects.requireNonNull(phrase, "phrase must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (phrase.isBlank()) {
            throw new IllegalArgumentException("phrase must not be blank");
        }
    }
}
