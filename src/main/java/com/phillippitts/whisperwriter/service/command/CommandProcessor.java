package com.phillippitts.whisperwriter.service.command;

import com.phillippitts.whisperwriter.domain.CommandOutcome;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Detects a voice command in a transcript and runs its handler.
 *
 * <p>The transcript is sanitized and each registered phrase is tested, in registration order,
 * as a plain substring. The first hit wins and its handler receives the original text. Because
 * matching is substring-based, ordinary dictation that happens to contain a phrase triggers it.
 *
 * <p>Never throws for handler failures: a failing handler yields {@code (false, originalText)}.
 */
public class CommandProcessor {

    private static final Logger LOG = LogManager.getLogger(CommandProcessor.class);

    private final CommandRegistry registry;
    private final DictationMetrics metrics;

    public CommandProcessor(CommandRegistry registry, DictationMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public CommandOutcome execute(String rawText) {
        if (rawText == null || rawText.isEmpty()) {
            return CommandOutcome.unchanged("");
        }
        String sanitized = TextSanitizer.sanitize(rawText);
        for (CommandEntry entry : registry.entries()) {
            if (!sanitized.contains(entry.phrase())) {
                continue;
            }
            LOG.info("Voice command matched: '{}'", entry.phrase());
            try {
                CommandOutcome outcome = entry.handler().handle(rawText);
                if (outcome == null) {
                    LOG.warn("Command '{}' returned no outcome; keeping original text", entry.phrase());
                    return CommandOutcome.unchanged(rawText);
                }
                if (outcome.executed()) {
                    metrics.incrementCommand(entry.phrase());
                }
                return outcome;
            } catch (RuntimeException e) {
                LOG.warn("Command '{}' failed: {}", entry.phrase(), e.getMessage(), e);
                return CommandOutcome.unchanged(rawText);
            }
        }
        return CommandOutcome.unchanged(rawText);
    }
}
