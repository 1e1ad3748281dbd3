package com.phillippitts.whisperwriter.domain;

import java.util.Objects;

/**
 * Result of running a transcript through the voice command processor.
 *
 * @param executed true if a command's side effect ran successfully
 * @param text transcript to continue with; the matched phrase is removed when executed
 */
public record CommandOutcome(boolean executed, String text) {

    public CommandOutcome {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static CommandOutcome unchanged(String text) {
        return new CommandOutcome(false, text);
    }
}
