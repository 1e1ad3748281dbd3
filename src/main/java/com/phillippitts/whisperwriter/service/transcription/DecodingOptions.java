package com.phillippitts.whisperwriter.service.transcription;

/**
 * Decoding parameters shared by every backend.
 *
 * @param language ISO language code, or null for automatic detection
 * @param initialPrompt text that biases the decoder's vocabulary and style, or null
 * @param temperature sampling temperature; 0.0 is greedy decoding
 */
public record DecodingOptions(String language, String initialPrompt, double temperature) {

    public DecodingOptions {
        if (language != null && language.isBlank()) {
            language = null;
        }
        if (initialPrompt != null && initialPrompt.isBlank()) {
            initialPrompt = null;
        }
        if (temperature < 0.0 || temperature > 1.0) {
            throw new IllegalArgumentException("temperature must be within [0.0, 1.0]: " + temperature);
        }
    }

    public static DecodingOptions defaults() {
        return new DecodingOptions(null, null, 0.0);
    }

    public boolean autoDetectLanguage() {
        return language == null;
    }
}
