package com.phillippitts.whisperwriter.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes mono WAV containers in the two encodings the backends consume: signed 16-bit PCM for
 * the remote API and 32-bit IEEE float for the local whisper.cpp model.
 */
public final class WavWriter {

    private static final int FORMAT_PCM = 1;
    private static final int FORMAT_IEEE_FLOAT = 3;
    private static final int HEADER_BYTES = 44;

    private WavWriter() {}

    /** Encodes PCM16 mono samples into an in-memory WAV file. */
    public static byte[] pcm16ToBytes(short[] samples, int sampleRate) {
        Objects.requireNonNull(samples, "samples must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_BYTES + samples.length * 2);
        try {
            writeHeader(out, FORMAT_PCM, 16, sampleRate, samples.length * 2);
            for (short s : samples) {
                writeLEShort(out, s);
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Writes float samples in [-1.0, 1.0] as a 32-bit float mono WAV file.
     *
     * @param samples normalized samples
     * @param sampleRate sample rate in Hz
     * @param wavPath output file (created or overwritten)
     */
    public static void writeFloat32(float[] samples, int sampleRate, Path wavPath) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            writeHeader(os, FORMAT_IEEE_FLOAT, 32, sampleRate, samples.length * 4);
            byte[] chunk = new byte[4096];
            int pos = 0;
            for (float f : samples) {
                int bits = Float.floatToIntBits(f);
                chunk[pos++] = (byte) (bits & 0xFF);
                chunk[pos++] = (byte) ((bits >>> 8) & 0xFF);
                chunk[pos++] = (byte) ((bits >>> 16) & 0xFF);
                chunk[pos++] = (byte) ((bits >>> 24) & 0xFF);
                if (pos == chunk.length) {
                    os.write(chunk, 0, pos);
                    pos = 0;
                }
            }
            os.write(chunk, 0, pos);
            os.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file to " + wavPath, e);
        }
    }

    private static void writeHeader(OutputStream os, int formatTag, int bitsPerSample,
                                    int sampleRate, int dataSize) throws IOException {
        int blockAlign = bitsPerSample / 8;
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, (short) formatTag);
        writeLEShort(os, (short) 1);
        writeLEInt(os, sampleRate);
        writeLEInt(os, sampleRate * blockAlign);
        writeLEShort(os, (short) blockAlign);
        writeLEShort(os, (short) bitsPerSample);
        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
