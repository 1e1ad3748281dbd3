package com.phillippitts.whisperwriter.service.session;

import com.phillippitts.whisperwriter.config.properties.RecordingProperties;

/**
 * Capture limits a session enforces while recording.
 *
 * @param maxDurationMs recording stops on its own after this long
 * @param minDurationMs shorter recordings are transcribed as silence
 * @param silenceDurationMs trailing quiet that ends a continuous-mode utterance
 * @param silenceThreshold RMS level separating silence from speech
 * @param pollMillis sleep between reads when the source has nothing ready
 */
public record RecordingSettings(int maxDurationMs, int minDurationMs, int silenceDurationMs,
                                int silenceThreshold, int pollMillis) {

    public static RecordingSettings from(RecordingProperties props) {
        return new RecordingSettings(props.getMaxDurationMs(), props.getMinDurationMs(),
                props.getSilenceDurationMs(), props.getSilenceThreshold(),
                Math.max(5, props.getChunkMillis() / 2));
    }
}
