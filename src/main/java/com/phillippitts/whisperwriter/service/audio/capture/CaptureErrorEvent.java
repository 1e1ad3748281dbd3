package com.phillippitts.whisperwriter.service.audio.capture;

import java.time.Instant;

/**
 * Published when microphone capture fails.
 *
 * @param reason MIC_UNAVAILABLE, MIC_PERMISSION_DENIED or CAPTURE_ERROR
 * @param at when the failure happened
 */
public record CaptureErrorEvent(String reason, Instant at) {
}
