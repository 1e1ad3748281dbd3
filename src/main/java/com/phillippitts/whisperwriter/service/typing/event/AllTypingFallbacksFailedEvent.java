package com.phillippitts.whisperwriter.service.typing.event;

import java.time.Instant;

/**
 * Every typing strategy failed; the transcript was not delivered.
 */
public record AllTypingFallbacksFailedEvent(int chars, Instant at) { }
