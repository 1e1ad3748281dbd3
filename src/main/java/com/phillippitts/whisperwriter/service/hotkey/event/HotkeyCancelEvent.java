package com.phillippitts.whisperwriter.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the cancel key goes down: abort recording and leave continuous dictation.
 */
public record HotkeyCancelEvent(Instant at) { }
