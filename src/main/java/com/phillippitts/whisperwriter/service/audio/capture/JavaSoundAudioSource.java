package com.phillippitts.whisperwriter.service.audio.capture;

import com.phillippitts.whisperwriter.exception.AudioCaptureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link AudioSource} over a Java Sound {@link TargetDataLine} producing 16-bit signed
 * little-endian mono PCM.
 */
public class JavaSoundAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSource.class);
    private static final short[] NO_SAMPLES = new short[0];

    /** Opens a line for a format, optionally on a named mixer. */
    @FunctionalInterface
    public interface DataLineProvider {
        TargetDataLine open(AudioFormat format, Optional<String> deviceName) throws LineUnavailableException;
    }

    private final DataLineProvider provider;
    private final int sampleRate;
    private final Optional<String> deviceName;
    private final byte[] readBuffer;
    private final ApplicationEventPublisher publisher;

    private TargetDataLine line;
    private long totalSamples;

    JavaSoundAudioSource(DataLineProvider provider, int sampleRate, Optional<String> deviceName,
                         int chunkMillis, ApplicationEventPublisher publisher) {
        this.provider = provider;
        this.sampleRate = sampleRate;
        this.deviceName = deviceName;
        int chunkBytes = Math.max(2, (sampleRate * chunkMillis / 1000) * 2);
        this.readBuffer = new byte[chunkBytes];
        this.publisher = publisher;
    }

    @Override
    public void open() {
        AudioFormat format = new AudioFormat(sampleRate, 16, 1, true, false);
        try {
            line = provider.open(format, deviceName);
            line.start();
            LOG.debug("Microphone opened: device='{}', rate={}Hz", deviceName.orElse("default"), sampleRate);
        } catch (LineUnavailableException e) {
            throw fail("MIC_UNAVAILABLE", "Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw fail("MIC_PERMISSION_DENIED", "Microphone access denied: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw fail("CAPTURE_ERROR", "Could not open microphone: " + e, e);
        }
    }

    @Override
    public short[] readAvailableSamples() {
        if (line == null) {
            return NO_SAMPLES;
        }
        int available = line.available();
        int toRead = Math.min(available, readBuffer.length) & ~1;
        if (toRead <= 0) {
            return NO_SAMPLES;
        }
        int n = line.read(readBuffer, 0, toRead);
        if (n <= 0) {
            return NO_SAMPLES;
        }
        short[] samples = new short[n / 2];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (short) ((readBuffer[2 * i] & 0xFF) | (readBuffer[2 * i + 1] << 8));
        }
        totalSamples += samples.length;
        return samples;
    }

    @Override
    public int sampleRate() {
        return sampleRate;
    }

    @Override
    public void close() {
        TargetDataLine l = line;
        line = null;
        if (l == null) {
            return;
        }
        try {
            l.stop();
            l.close();
        } catch (RuntimeException e) {
            LOG.debug("Error closing microphone line: {}", e.toString());
        }
        LOG.debug("Microphone closed after {} samples", totalSamples);
    }

    private AudioCaptureException fail(String reason, String message, Throwable cause) {
        LOG.warn(message);
        publisher.publishEvent(new CaptureErrorEvent(reason, Instant.now()));
        return new AudioCaptureException(reason, message, cause);
    }
}
