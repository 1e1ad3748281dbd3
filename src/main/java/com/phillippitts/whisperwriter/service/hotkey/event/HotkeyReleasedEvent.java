package com.phillippitts.whisperwriter.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the activation key combination is released.
 */
public record HotkeyReleasedEvent(Instant at) { }
