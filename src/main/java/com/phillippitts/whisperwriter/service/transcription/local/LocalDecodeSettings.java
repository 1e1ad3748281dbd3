package com.phillippitts.whisperwriter.service.transcription.local;

/**
 * Decoding switches that only the local model understands.
 *
 * @param conditionOnPreviousText feed each decoded window's text as context for the next one
 * @param vadFilter drop non-speech regions before decoding
 */
public record LocalDecodeSettings(boolean conditionOnPreviousText, boolean vadFilter) {
}
