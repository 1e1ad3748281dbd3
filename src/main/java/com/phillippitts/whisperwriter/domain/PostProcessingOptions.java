package com.phillippitts.whisperwriter.domain;

/**
 * Flags controlling {@code TextPostProcessor}. Steps always run in the order the fields are
 * declared: trailing period, trailing space, capitalization.
 *
 * @param removeTrailingPeriod drop one trailing "." after trimming
 * @param addTrailingSpace append a single space
 * @param removeCapitalization lowercase the whole text
 */
public record PostProcessingOptions(boolean removeTrailingPeriod,
                                    boolean addTrailingSpace,
                                    boolean removeCapitalization) {

    public static PostProcessingOptions none() {
        return new PostProcessingOptions(false, false, false);
    }
}
