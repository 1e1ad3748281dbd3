package com.phillippitts.whisperwriter.service.text;

import com.phillippitts.whisperwriter.domain.PostProcessingOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextPostProcessorTest {

    private final TextPostProcessor processor = new TextPostProcessor();

    @Test
    void allFlagsTurnSentenceIntoLowercaseWithTrailingSpace() {
        PostProcessingOptions all = new PostProcessingOptions(true, true, true);
        assertThat(processor.apply("Hello.", all)).isEqualTo("hello ");
    }

    @Test
    void noFlagsOnlyTrims() {
        assertThat(processor.apply("  Hello there.  ", PostProcessingOptions.none())).isEqualTo("Hello there.");
    }

    @Test
    void removesOnlyOneTrailingPeriod() {
        PostProcessingOptions opts = new PostProcessingOptions(true, false, false);
        assertThat(processor.apply("Wait...", opts)).isEqualTo("Wait..");
        assertThat(processor.apply("No period", opts)).isEqualTo("No period");
    }

    @Test
    void periodBeforeTrailingWhitespaceIsStillRemoved() {
        PostProcessingOptions opts = new PostProcessingOptions(true, false, false);
        assertThat(processor.apply("Done. \n", opts)).isEqualTo("Done");
    }

    @Test
    void trailingSpaceIsAddedAfterPeriodRemoval() {
        PostProcessingOptions opts = new PostProcessingOptions(true, true, false);
        assertThat(processor.apply("Ship it.", opts)).isEqualTo("Ship it ");
    }

    @Test
    void lowercasingIsLocaleIndependent() {
        PostProcessingOptions opts = new PostProcessingOptions(false, false, true);
        assertThat(processor.apply("TITLE Case", opts)).isEqualTo("title case");
    }

    @Test
    void nullTextBecomesEmpty() {
        assertThat(processor.apply(null, new PostProcessingOptions(true, true, true))).isEmpty();
    }
}
