package com.phillippitts.whisperwriter.service.transcription.local;

import com.phillippitts.whisperwriter.exception.BackendInitException;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalModelProviderTest {

    /** Records every spec it is asked to load; fails for devices listed in {@code failOn}. */
    static final class ScriptedLoader implements LocalModelLoader {
        final List<LocalModelSpec> attempts = new ArrayList<>();
        final List<String> failOn;

        ScriptedLoader(String... failOn) {
            this.failOn = List.of(failOn);
        }

        @Override
        public LocalWhisperModel load(LocalModelSpec spec) {
            attempts.add(spec);
            if (failOn.contains(spec.device())) {
                throw new BackendInitException("load failed", spec.modelId(), spec.device());
            }
            return new StubModel(spec.device());
        }
    }

    record StubModel(String device) implements LocalWhisperModel {
        @Override
        public String transcribe(float[] samples, int sampleRate, DecodingOptions options,
                                 LocalDecodeSettings settings) {
            return "stub";
        }
    }

    @Test
    void loadsOnceAndCaches() {
        ScriptedLoader loader = new ScriptedLoader();
        LocalModelProvider provider = new LocalModelProvider(loader, new LocalModelSpec("base", false, "cuda", "float16"));

        LocalWhisperModel first = provider.get();
        LocalWhisperModel second = provider.get();

        assertThat(first).isSameAs(second);
        assertThat(loader.attempts).hasSize(1);
        assertThat(first.device()).isEqualTo("cuda");
        assertThat(provider.isLoaded()).isTrue();
    }

    @Test
    void fallsBackToCpuWithSameModelWhenDeviceFails() {
        ScriptedLoader loader = new ScriptedLoader("cuda");
        LocalModelProvider provider = new LocalModelProvider(loader, new LocalModelSpec("small", false, "cuda", "float16"));

        LocalWhisperModel model = provider.get();

        assertThat(model.device()).isEqualTo("cpu");
        assertThat(loader.attempts).extracting(LocalModelSpec::device).containsExactly("cuda", "cpu");
        assertThat(loader.attempts).extracting(LocalModelSpec::modelId).containsOnly("small");
    }

    @Test
    void int8ForcesCpuWithoutTryingConfiguredDevice() {
        ScriptedLoader loader = new ScriptedLoader();
        LocalModelProvider provider = new LocalModelProvider(loader, new LocalModelSpec("base", false, "cuda", "INT8"));

        provider.get();

        assertThat(loader.attempts).extracting(LocalModelSpec::device).containsExactly("cpu");
    }

    @Test
    void cpuFailureIsNotRetriedAndNothingIsCached() {
        ScriptedLoader loader = new ScriptedLoader("cpu");
        LocalModelProvider provider = new LocalModelProvider(loader, new LocalModelSpec("base", false, "cpu", "default"));

        assertThatThrownBy(provider::get).isInstanceOf(BackendInitException.class);
        assertThat(loader.attempts).hasSize(1);
        assertThat(provider.isLoaded()).isFalse();
    }

    @Test
    void failedFallbackPropagatesAndNextCallRetries() {
        ScriptedLoader loader = new ScriptedLoader("auto", "cpu");
        LocalModelProvider provider = new LocalModelProvider(loader, new LocalModelSpec("base", false, "auto", "default"));

        assertThatThrownBy(provider::get).isInstanceOf(BackendInitException.class);
        assertThatThrownBy(provider::get).isInstanceOf(BackendInitException.class);
        assertThat(loader.attempts).extracting(LocalModelSpec::device).containsExactly("auto", "cpu", "auto", "cpu");
    }

    @Test
    void specNormalizesDeviceAndComputeType() {
        LocalModelSpec spec = new LocalModelSpec("base", false, " ", null);
        assertThat(spec.device()).isEqualTo("auto");
        assertThat(spec.computeType()).isEqualTo("default");
        assertThat(new LocalModelSpec("base", false, "CUDA", "Int8").effective().isCpu()).isTrue();
    }
}
