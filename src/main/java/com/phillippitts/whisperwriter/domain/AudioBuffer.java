package com.phillippitts.whisperwriter.domain;

import java.util.Arrays;

/**
 * Immutable mono buffer of signed 16-bit samples captured during one recording session.
 *
 * <p>The samples are copied on construction and on every array accessor, so once a session hands
 * a buffer to the transcription engine neither side can observe the other's writes.
 */
public final class AudioBuffer {

    /** Divisor mapping a signed 16-bit sample onto [-1.0, 1.0). */
    public static final float PCM16_SCALE = 32768.0f;

    private final short[] samples;
    private final int sampleRate;

    public AudioBuffer(short[] samples, int sampleRate) {
        if (samples == null) {
            throw new IllegalArgumentException("samples must not be null");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        this.samples = samples.clone();
        this.sampleRate = sampleRate;
    }

    public static AudioBuffer empty(int sampleRate) {
        return new AudioBuffer(new short[0], sampleRate);
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int sampleCount() {
        return samples.length;
    }

    public boolean isEmpty() {
        return samples.length == 0;
    }

    public long durationMillis() {
        return samples.length * 1000L / sampleRate;
    }

    public short[] samples() {
        return samples.clone();
    }

    /**
     * Rescales every sample to a float by dividing by 32768, so 32767 maps just below 1.0 and
     * -32768 maps to exactly -1.0.
     */
    public float[] toFloatSamples() {
        float[] out = new float[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = samples[i] / PCM16_SCALE;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioBuffer)) {
            return false;
        }
        AudioBuffer other = (AudioBuffer) o;
        return sampleRate == other.sampleRate && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(samples) + sampleRate;
    }

    @Override
    public String toString() {
        return "AudioBuffer[samples=" + samples.length + ", sampleRate=" + sampleRate + "]";
    }
}
