package com.phillippitts.whisperwriter.service.command;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text for phrase matching: lowercase, every character that is neither a word
 * character nor whitespace becomes a space, runs of whitespace collapse to one space.
 * Word characters are Unicode-aware, so accented letters survive.
 */
public final class TextSanitizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        String spaced = NON_WORD.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").strip();
    }
}
