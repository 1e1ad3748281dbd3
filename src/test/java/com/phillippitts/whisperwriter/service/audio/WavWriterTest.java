package com.phillippitts.whisperwriter.service.audio;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    @TempDir
    Path dir;

    @Test
    void pcm16HeaderDescribesMono16BitPcm() {
        byte[] wav = WavWriter.pcm16ToBytes(new short[]{1, -1, 300}, 16000);
        ByteBuffer bb = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);

        assertThat(wav).hasSize(44 + 6);
        assertThat(new String(wav, 0, 4, StandardCharsets.US_ASCII)).isEqualTo("RIFF");
        assertThat(bb.getInt(4)).isEqualTo(36 + 6);
        assertThat(new String(wav, 8, 4, StandardCharsets.US_ASCII)).isEqualTo("WAVE");
        assertThat(bb.getShort(20)).isEqualTo((short) 1);
        assertThat(bb.getShort(22)).isEqualTo((short) 1);
        assertThat(bb.getInt(24)).isEqualTo(16000);
        assertThat(bb.getInt(28)).isEqualTo(32000);
        assertThat(bb.getShort(34)).isEqualTo((short) 16);
        assertThat(bb.getInt(40)).isEqualTo(6);
        assertThat(bb.getShort(44)).isEqualTo((short) 1);
        assertThat(bb.getShort(46)).isEqualTo((short) -1);
        assertThat(bb.getShort(48)).isEqualTo((short) 300);
    }

    @Test
    void float32FileUsesIeeeFloatFormat() throws IOException {
        Path out = dir.resolve("f.wav");
        WavWriter.writeFloat32(new float[]{-1.0f, 0.5f}, 16000, out);

        byte[] wav = Files.readAllBytes(out);
        ByteBuffer bb = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(wav).hasSize(44 + 8);
        assertThat(bb.getShort(20)).isEqualTo((short) 3);
        assertThat(bb.getInt(28)).isEqualTo(64000);
        assertThat(bb.getShort(32)).isEqualTo((short) 4);
        assertThat(bb.getShort(34)).isEqualTo((short) 32);
        assertThat(bb.getFloat(44)).isEqualTo(-1.0f);
        assertThat(bb.getFloat(48)).isEqualTo(0.5f);
    }

    @Test
    void float32HandlesMoreSamplesThanOneChunk() throws IOException {
        Path out = dir.resolve("long.wav");
        float[] samples = new float[5000];
        samples[4999] = 0.25f;
        WavWriter.writeFloat32(samples, 16000, out);

        ByteBuffer bb = ByteBuffer.wrap(Files.readAllBytes(out)).order(ByteOrder.LITTLE_ENDIAN);
        assertThat(bb.getInt(40)).isEqualTo(20000);
        assertThat(bb.getFloat(44 + 4 * 4999)).isEqualTo(0.25f);
    }
}
