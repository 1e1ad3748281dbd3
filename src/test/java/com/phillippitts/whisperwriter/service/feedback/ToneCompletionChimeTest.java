package com.phillippitts.whisperwriter.service.feedback;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToneCompletionChimeTest {

    @Test
    void synthesizesTwoShortNotesOfPcm16() {
        byte[] pcm = ToneCompletionChime.synthesize();

        // 2 notes x 70 ms x 22050 Hz x 2 bytes
        assertThat(pcm).hasSize(2 * 1543 * 2);
        int peak = 0;
        for (int i = 0; i < pcm.length; i += 2) {
            short sample = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
            peak = Math.max(peak, Math.abs(sample));
        }
        assertThat(peak).isBetween(4000, Short.MAX_VALUE / 4 + 1);
    }
}
