package com.phillippitts.whisperwriter.service.hotkey.event;

import java.time.Instant;

/**
 * Published when the OS refuses the global key hook (e.g. macOS Accessibility permission missing).
 */
public record HotkeyPermissionDeniedEvent(Instant at) { }
