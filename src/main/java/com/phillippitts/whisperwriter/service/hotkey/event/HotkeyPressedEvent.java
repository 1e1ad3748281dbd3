package com.phillippitts.whisperwriter.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the activation key goes down.
 */
public record HotkeyPressedEvent(Instant at) { }
