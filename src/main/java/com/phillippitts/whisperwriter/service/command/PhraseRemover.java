package com.phillippitts.whisperwriter.service.command;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Removes every occurrence of a sanitized phrase from raw text, case-insensitively. Words of the
 * phrase may be separated by any run of non-word characters in the raw text, so
 * {@code "Wiz, open Edge."} still loses its command words.
 */
final class PhraseRemover {

    private final Pattern pattern;

    PhraseRemover(String sanitizedPhrase) {
        String regex = Arrays.stream(sanitizedPhrase.split(" "))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\W+"));
        this.pattern = Pattern.compile(regex,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
    }

    String removeFrom(String text) {
        return pattern.matcher(text).replaceAll("").strip();
    }
}
