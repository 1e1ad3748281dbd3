package com.phillippitts.whisperwriter.service.transcription;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecodingOptionsTest {

    @Test
    void blankLanguageMeansAutoDetect() {
        DecodingOptions options = new DecodingOptions("  ", "", 0.0);
        assertThat(options.autoDetectLanguage()).isTrue();
        assertThat(options.initialPrompt()).isNull();
    }

    @Test
    void rejectsTemperatureOutsideUnitInterval() {
        assertThatThrownBy(() -> new DecodingOptions(null, null, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecodingOptions(null, null, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaultsAreGreedyAutoDetect() {
        assertThat(DecodingOptions.defaults()).isEqualTo(new DecodingOptions(null, null, 0.0));
    }
}
