package com.phillippitts.whisperwriter.service.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, immutable list of voice commands. Registration order is the tie-break when more
 * than one phrase occurs in a transcript: the earliest registered entry wins.
 *
 * <p>Build with {@link #builder()}; phrases are sanitized on registration so
 * {@code "Wiz, open Edge"} and {@code "wiz open edge"} are the same command.
 */
public final class CommandRegistry {

    private final List<CommandEntry> entries;

    private CommandRegistry(List<CommandEntry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CommandRegistry empty() {
        return new CommandRegistry(List.of());
    }

    public List<CommandEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {
        private final List<CommandEntry> entries = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends a command.
         *
         * @throws IllegalArgumentException if the phrase sanitizes to blank or is already registered
         */
        public Builder register(String phrase, CommandHandler handler) {
            String normalized = TextSanitizer.sanitize(phrase);
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("Command phrase has no words: '" + phrase + "'");
            }
            for (CommandEntry e : entries) {
                if (e.phrase().equals(normalized)) {
                    throw new IllegalArgumentException("Duplicate command phrase: '" + normalized + "'");
                }
            }
            entries.add(new CommandEntry(normalized, handler));
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(entries);
        }
    }
}
