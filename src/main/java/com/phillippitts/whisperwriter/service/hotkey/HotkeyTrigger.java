package com.phillippitts.whisperwriter.service.hotkey;

/**
 * Matches the configured activation key against a stream of key events.
 * Implementations hold only the press/release state they need.
 */
public interface HotkeyTrigger {

    String name();

    /** @return true if this event activates the hotkey */
    boolean onKeyPressed(NormalizedKeyEvent e);

    /** @return true if this event ends a previously activated press */
    boolean onKeyReleased(NormalizedKeyEvent e);
}
