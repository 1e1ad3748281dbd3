package com.phillippitts.whisperwriter.service.feedback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;

/**
 * Plays a short synthesized two-note beep through the default output device on a daemon thread.
 */
public class ToneCompletionChime implements CompletionChime {

    private static final Logger LOG = LogManager.getLogger(ToneCompletionChime.class);

    private static final int SAMPLE_RATE = 22050;
    private static final int NOTE_MS = 70;
    private static final double[] NOTES_HZ = {880.0, 1320.0};
    private static final double VOLUME = 0.25;

    private final byte[] pcm = synthesize();

    @Override
    public void play() {
        Thread t = new Thread(this::playBlocking, "completion-chime");
        t.setDaemon(true);
        t.start();
    }

    private void playBlocking() {
        AudioFormat format = new AudioFormat(SAMPLE_RATE, 16, 1, true, false);
        try (SourceDataLine line = AudioSystem.getSourceDataLine(format)) {
            line.open(format);
            line.start();
            line.write(pcm, 0, pcm.length);
            line.drain();
        } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
            LOG.debug("Completion chime unavailable: {}", e.toString());
        }
    }

    static byte[] synthesize() {
        int perNote = SAMPLE_RATE * NOTE_MS / 1000;
        byte[] out = new byte[perNote * NOTES_HZ.length * 2];
        int pos = 0;
        for (double hz : NOTES_HZ) {
            for (int i = 0; i < perNote; i++) {
                // linear fade-out avoids a click at the note boundary
                double envelope = 1.0 - (double) i / perNote;
                double v = Math.sin(2 * Math.PI * hz * i / SAMPLE_RATE) * envelope * VOLUME;
                short s = (short) Math.round(v * Short.MAX_VALUE);
                out[pos++] = (byte) (s & 0xFF);
                out[pos++] = (byte) ((s >>> 8) & 0xFF);
            }
        }
        return out;
    }
}
