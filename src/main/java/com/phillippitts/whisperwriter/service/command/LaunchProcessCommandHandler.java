package com.phillippitts.whisperwriter.service.command;

import com.phillippitts.whisperwriter.domain.CommandOutcome;
import com.phillippitts.whisperwriter.exception.CommandHandlerException;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Voice command that launches an external program, for example
 * {@code cmd /c start microsoft-edge:} for "wiz open edge".
 *
 * <p>The process is started and left running; the handler does not wait for it. The phrase is
 * removed from the transcript so only the surrounding dictation gets typed.
 */
public class LaunchProcessCommandHandler implements CommandHandler {

    private static final Logger LOG = LogManager.getLogger(LaunchProcessCommandHandler.class);

    private final String phrase;
    private final List<String> command;
    private final ProcessFactory processFactory;
    private final PhraseRemover remover;

    public LaunchProcessCommandHandler(String phrase, List<String> command, ProcessFactory processFactory) {
        Objects.requireNonNull(phrase, "phrase must not be null");
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        this.phrase = TextSanitizer.sanitize(phrase);
        this.command = List.copyOf(command);
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.remover = new PhraseRemover(this.phrase);
    }

    @Override
    public CommandOutcome handle(String originalText) {
        try {
            Process process = processFactory.start(command, null);
            // The child never writes anything we need; close our ends so it cannot block on a full pipe.
            process.getOutputStream().close();
            process.getInputStream().close();
            process.getErrorStream().close();
            LOG.info("Launched '{}' for command '{}'", command.get(0), phrase);
        } catch (IOException e) {
            throw new CommandHandlerException(phrase, "could not start " + command.get(0), e);
        }
        return new CommandOutcome(true, remover.removeFrom(originalText));
    }

    public List<String> command() {
        return command;
    }
}
