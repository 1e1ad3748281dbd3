package com.phillippitts.whisperwriter.service.hotkey;

import java.util.Objects;

/**
 * Fires once when the primary key goes down with every required modifier held, and once when the
 * combination breaks: the primary key or any required modifier is released. Auto-repeat presses
 * while held are ignored.
 */
public final class ActivationKeyTrigger implements HotkeyTrigger {

    private final ActivationKey activationKey;
    private boolean held;

    public ActivationKeyTrigger(ActivationKey activationKey) {
        this.activationKey = Objects.requireNonNull(activationKey, "activationKey must not be null");
    }

    @Override
    public String name() {
        return "key:" + activationKey;
    }

    @Override
    public synchronized boolean onKeyPressed(NormalizedKeyEvent e) {
        if (held || !e.key().equals(activationKey.key())) {
            return false;
        }
        if (!e.modifiers().containsAll(activationKey.modifiers())) {
            return false;
        }
        held = true;
        return true;
    }

    @Override
    public synchronized boolean onKeyReleased(NormalizedKeyEvent e) {
        if (!held) {
            return false;
        }
        if (e.key().equals(activationKey.key()) || activationKey.modifiers().contains(e.key())) {
            held = false;
            return true;
        }
        return false;
    }
}
