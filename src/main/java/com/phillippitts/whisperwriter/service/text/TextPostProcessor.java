package com.phillippitts.whisperwriter.service.text;

import com.phillippitts.whisperwriter.domain.PostProcessingOptions;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;

/**
 * Final formatting applied to a transcript before it is typed.
 *
 * <p>Steps run in a fixed order: trim, drop one trailing period, append one space, lowercase.
 * With every flag enabled {@code "Hello."} becomes {@code "hello "}.
 */
@Component
public class TextPostProcessor {

    public String apply(String text, PostProcessingOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (text == null) {
            return "";
        }
        String result = text.strip();
        if (options.removeTrailingPeriod() && result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        if (options.addTrailingSpace()) {
            result = result + " ";
        }
        if (options.removeCapitalization()) {
            result = result.toLowerCase(Locale.ROOT);
        }
        return result;
    }
}
