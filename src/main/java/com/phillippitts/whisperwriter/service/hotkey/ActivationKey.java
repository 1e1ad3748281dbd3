package com.phillippitts.whisperwriter.service.hotkey;

import java.util.Set;

/**
 * Parsed activation key: one primary key plus zero or more required modifiers.
 */
public record ActivationKey(String key, Set<String> modifiers) {

    public ActivationKey {
        modifiers = Set.copyOf(modifiers);
    }

    @Override
    public String toString() {
        if (modifiers.isEmpty()) {
            return key;
        }
        return String.join("+", modifiers.stream().sorted().toList()) + "+" + key;
    }
}
