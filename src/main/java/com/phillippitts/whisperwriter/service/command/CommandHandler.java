package com.phillippitts.whisperwriter.service.command;

import com.phillippitts.whisperwriter.domain.CommandOutcome;

/**
 * Side effect bound to a spoken phrase.
 *
 * <p>Handlers receive the original, unsanitized transcript and return the text that should
 * continue down the pipeline, normally with the phrase removed. A failing handler throws
 * {@link com.phillippitts.whisperwriter.exception.CommandHandlerException}.
 */
@FunctionalInterface
public interface CommandHandler {

    CommandOutcome handle(String originalText);
}
