package com.phillippitts.whisperwriter.testutil;

import com.phillippitts.whisperwriter.domain.AudioBuffer;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionBackend;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable backend that counts invocations. Returns {@link #response} or throws
 * {@link #failure} when set.
 */
public class FakeBackend implements TranscriptionBackend {

    public final AtomicInteger calls = new AtomicInteger();
    public volatile String response = "hello world";
    public volatile RuntimeException failure;
    public volatile AudioBuffer lastBuffer;
    public volatile DecodingOptions lastOptions;

    public FakeBackend() {
    }

    public FakeBackend(String response) {
        this.response = response;
    }

    @Override
    public String name() {
        return "fake";
    }

    @Override
    public String transcribe(AudioBuffer buffer, DecodingOptions options) {
        calls.incrementAndGet();
        lastBuffer = buffer;
        lastOptions = options;
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
        return response;
    }
}
