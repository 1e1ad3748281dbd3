package com.phillippitts.whisperwriter.service.hotkey;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Canonical key and modifier names, shared by configuration parsing and the native hook adapter.
 */
public final class KeyNameMapper {

    private static final Set<String> MODIFIERS = Set.of("META", "SHIFT", "CONTROL", "ALT");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("CTRL", "CONTROL"),
            Map.entry("CMD", "META"),
            Map.entry("COMMAND", "META"),
            Map.entry("WIN", "META"),
            Map.entry("WINDOWS", "META"),
            Map.entry("SUPER", "META"),
            Map.entry("OPTION", "ALT"),
            Map.entry("ESC", "ESCAPE"),
            Map.entry("RETURN", "ENTER"),
            Map.entry("BACK_SPACE", "BACKSPACE"));

    private static final Set<String> KEYS;

    static {
        Set<String> keys = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.add(String.valueOf(c));
        }
        for (char c = '0'; c <= '9'; c++) {
            keys.add(String.valueOf(c));
        }
        IntStream.rangeClosed(1, 24).forEach(i -> keys.add("F" + i));
        keys.addAll(List.of("ESCAPE", "ENTER", "TAB", "SPACE", "BACKSPACE", "INSERT", "DELETE",
                "HOME", "END", "PAGE_UP", "PAGE_DOWN", "PAUSE", "SCROLL_LOCK", "CAPS_LOCK"));
        keys.addAll(MODIFIERS);
        KEYS = Set.copyOf(keys);
    }

    private KeyNameMapper() {}

    /** Canonicalize a key name: upper case, spaces to underscores, aliases resolved. */
    public static String normalizeKey(String keyText) {
        if (keyText == null || keyText.isBlank()) {
            return "UNKNOWN";
        }
        String k = keyText.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
        return ALIASES.getOrDefault(k, k);
    }

    public static boolean isModifier(String name) {
        return MODIFIERS.contains(normalizeKey(name));
    }

    public static boolean isValidKey(String name) {
        return KEYS.contains(normalizeKey(name));
    }

    /**
     * Parses {@code "ctrl+shift+space"} style text. The last non-modifier token is the primary key;
     * a combination of modifiers only (e.g. {@code "ctrl+alt"}) uses its last modifier as the key.
     *
     * @throws IllegalArgumentException if the text is blank, names an unknown key, or has more than
     *         one non-modifier key
     */
    public static ActivationKey parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Activation key must not be blank");
        }
        Set<String> modifiers = new HashSet<>();
        String primary = null;
        String lastModifier = null;
        for (String part : text.split("\\+")) {
            if (part.isBlank()) {
                throw new IllegalArgumentException("Empty key in '" + text + "'");
            }
            String name = normalizeKey(part);
            if (!KEYS.contains(name)) {
                throw new IllegalArgumentException("Unknown key '" + part.trim() + "' in '" + text + "'");
            }
            if (MODIFIERS.contains(name)) {
                modifiers.add(name);
                lastModifier = name;
            } else if (primary != null) {
                throw new IllegalArgumentException("More than one non-modifier key in '" + text + "'");
            } else {
                primary = name;
            }
        }
        if (primary == null) {
            modifiers.remove(lastModifier);
            primary = lastModifier;
        }
        return new ActivationKey(primary, modifiers);
    }
}
