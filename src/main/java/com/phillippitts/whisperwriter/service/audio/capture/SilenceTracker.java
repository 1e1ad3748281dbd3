package com.phillippitts.whisperwriter.service.audio.capture;

/**
 * Streaming end-of-utterance detector for continuous dictation.
 *
 * <p>Samples are grouped into 20 ms windows and each window's RMS amplitude is compared with a
 * threshold. Once at least one loud window has been seen, {@link #accept(short[])} reports
 * {@code true} as soon as the trailing quiet run reaches the configured silence duration.
 * Leading silence never ends an utterance.
 */
public final class SilenceTracker {

    static final int WINDOW_MS = 20;

    private final int windowSamples;
    private final long silenceSamplesNeeded;
    private final double threshold;

    private long sumSquares;
    private int windowFill;
    private boolean speechHeard;
    private long trailingSilence;

    /**
     * @param sampleRate sample rate in Hz
     * @param silenceDurationMs trailing quiet needed to end an utterance
     * @param threshold RMS amplitude below which a window counts as silence (0-32767)
     */
    public SilenceTracker(int sampleRate, int silenceDurationMs, int threshold) {
        if (sampleRate <= 0 || silenceDurationMs <= 0) {
            throw new IllegalArgumentException("sampleRate and silenceDurationMs must be positive");
        }
        this.windowSamples = Math.max(1, sampleRate * WINDOW_MS / 1000);
        this.silenceSamplesNeeded = (long) sampleRate * silenceDurationMs / 1000;
        this.threshold = threshold;
    }

    /**
     * Feeds the next chunk.
     *
     * @return true once speech was heard and has been followed by enough silence
     */
    public boolean accept(short[] chunk) {
        for (short s : chunk) {
            sumSquares += (long) s * s;
            windowFill++;
            if (windowFill == windowSamples) {
                closeWindow();
            }
        }
        return isUtteranceComplete();
    }

    public boolean isUtteranceComplete() {
        return speechHeard && trailingSilence >= silenceSamplesNeeded;
    }

    public boolean isSpeechHeard() {
        return speechHeard;
    }

    private void closeWindow() {
        double rms = Math.sqrt((double) sumSquares / windowFill);
        if (rms < threshold) {
            trailingSilence += windowFill;
        } else {
            speechHeard = true;
            trailingSilence = 0;
        }
        sumSquares = 0;
        windowFill = 0;
    }
}
