package com.phillippitts.whisperwriter.service.hotkey;

import java.util.Locale;
import java.util.Set;

/**
 * Keyboard event decoupled from the native hook library, so triggers and tests never touch
 * JNativeHook types.
 *
 * @param type press or release
 * @param key canonical key name (see {@link KeyNameMapper})
 * @param modifiers canonical modifiers held when the event fired
 * @param whenMillis wall-clock timestamp
 */
public record NormalizedKeyEvent(Type type, String key, Set<String> modifiers, long whenMillis) {

    public enum Type { PRESSED, RELEASED }

    public NormalizedKeyEvent {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        key = key.toUpperCase(Locale.ROOT);
        modifiers = modifiers == null ? Set.of()
                : Set.copyOf(modifiers.stream().map(m -> m.toUpperCase(Locale.ROOT)).toList());
    }
}
