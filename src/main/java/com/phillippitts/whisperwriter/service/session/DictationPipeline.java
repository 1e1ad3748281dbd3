package com.phillippitts.whisperwriter.service.session;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.domain.CommandOutcome;
import com.phillippitts.whisperwriter.domain.PostProcessingOptions;
import com.phillippitts.whisperwriter.service.command.CommandProcessor;
import com.phillippitts.whisperwriter.service.text.TextPostProcessor;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionEngine;
import com.phillippitts.whisperwriter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Transcribe, detect commands, format. Only an empty transcript short-circuits to {@code ""};
 * whatever a command leaves behind, even nothing, still goes through formatting.
 */
public class DictationPipeline {

    private static final Logger LOG = LogManager.getLogger(DictationPipeline.class);

    /**
     * @param text final text to type
     * @param commandExecuted whether a voice command fired
     */
    public record Output(String text, boolean commandExecuted) {
        static final Output EMPTY = new Output("", false);
    }

    private final TranscriptionEngine engine;
    private final CommandProcessor commandProcessor;
    private final TextPostProcessor postProcessor;
    private final PostProcessingOptions options;

    public DictationPipeline(TranscriptionEngine engine, CommandProcessor commandProcessor,
                             TextPostProcessor postProcessor, PostProcessingOptions options) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.commandProcessor = Objects.requireNonNull(commandProcessor, "commandProcessor must not be null");
        this.postProcessor = Objects.requireNonNull(postProcessor, "postProcessor must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Runs the buffer through every stage. Backend exceptions propagate to the caller.
     */
    public Output run(AudioBuffer buffer) {
        String raw = engine.transcribe(buffer).strip();
        if (raw.isEmpty()) {
            return Output.EMPTY;
        }
        LOG.debug("Raw transcript preview='{}'", LogSanitizer.truncate(raw, 40));
        CommandOutcome outcome = commandProcessor.execute(raw);
        return new Output(postProcessor.apply(outcome.text(), options), outcome.executed());
    }
}
