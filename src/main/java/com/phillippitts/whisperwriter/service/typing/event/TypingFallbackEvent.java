package com.phillippitts.whisperwriter.service.typing.event;

import java.time.Instant;

/**
 * A typing strategy failed and the next one will be tried. Never carries the text.
 */
public record TypingFallbackEvent(String adapter, String reason, Instant at) { }
