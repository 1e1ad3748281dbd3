package com.phillippitts.whisperwriter.config.transcription;

import com.phillippitts.whisperwriter.config.properties.ModelProperties;
import com.phillippitts.whisperwriter.exception.BackendInitException;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import com.phillippitts.whisperwriter.service.transcription.DecodingOptions;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionBackend;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionEngine;
import com.phillippitts.whisperwriter.service.transcription.api.ApiWhisperBackend;
import com.phillippitts.whisperwriter.service.transcription.local.LocalDecodeSettings;
import com.phillippitts.whisperwriter.service.transcription.local.LocalModelProvider;
import com.phillippitts.whisperwriter.service.transcription.local.LocalModelSpec;
import com.phillippitts.whisperwriter.service.transcription.local.LocalWhisperBackend;
import com.phillippitts.whisperwriter.service.transcription.local.WhisperCppModelLoader;
import com.phillippitts.whisperwriter.util.DefaultProcessFactory;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;

/**
 * Selects the transcription backend once from {@code model-options.use-api} and wires the
 * {@link TranscriptionEngine} around it.
 */
@Configuration
public class TranscriptionConfig {

    private static final Logger LOG = LogManager.getLogger(TranscriptionConfig.class);

    private final ModelProperties modelProperties;

    public TranscriptionConfig(ModelProperties modelProperties) {
        this.modelProperties = modelProperties;
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public DecodingOptions decodingOptions() {
        ModelProperties.Common common = modelProperties.getCommon();
        return new DecodingOptions(common.language(), common.initialPrompt(), common.temperature());
    }

    /**
     * Lazily loading, caching model holder. The weights are loaded on the first transcription or
     * by {@link #preloadLocalModel} once the application is ready.
     */
    @Bean
    @ConditionalOnProperty(prefix = "model-options", name = "use-api", havingValue = "false", matchIfMissing = true)
    public LocalModelProvider localModelProvider(ProcessFactory processFactory) {
        ModelProperties.Local local = modelProperties.getLocal();
        boolean fromPath = local.modelPath() != null;
        LocalModelSpec spec = new LocalModelSpec(fromPath ? local.modelPath() : local.model(), fromPath,
                local.device(), local.computeType());
        WhisperCppModelLoader loader = new WhisperCppModelLoader(
                Path.of(local.binaryPath()),
                Path.of(local.modelsDir()),
                local.threads(),
                local.vadModelPath() == null ? null : Path.of(local.vadModelPath()),
                processFactory);
        return new LocalModelProvider(loader, spec);
    }

    @Bean
    @ConditionalOnProperty(prefix = "model-options", name = "use-api", havingValue = "false", matchIfMissing = true)
    public TranscriptionBackend localWhisperBackend(LocalModelProvider provider) {
        ModelProperties.Local local = modelProperties.getLocal();
        return new LocalWhisperBackend(provider,
                new LocalDecodeSettings(local.conditionOnPreviousText(), local.vadFilter()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "model-options", name = "use-api", havingValue = "true")
    public TranscriptionBackend apiWhisperBackend() {
        ModelProperties.Api api = modelProperties.getApi();
        return ApiWhisperBackend.create(RestClient.builder(), api.baseUrl(), api.apiKey(), api.model());
    }

    @Bean
    public TranscriptionEngine transcriptionEngine(TranscriptionBackend backend, DecodingOptions decodingOptions,
                                                   DictationMetrics metrics) {
        LOG.info("Transcription backend: {}", backend.name());
        return new TranscriptionEngine(backend, decodingOptions, metrics);
    }

    /**
     * Loads the local model at startup so the first dictation does not pay for it. A failure here
     * is not fatal: the next session retries the load and reports an empty transcript if it fails
     * again.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void preloadLocalModel(ApplicationReadyEvent event) {
        LocalModelProvider provider = event.getApplicationContext()
                .getBeanProvider(LocalModelProvider.class).getIfAvailable();
        preload(provider);
    }

    static void preload(LocalModelProvider provider) {
        if (provider == null || provider.isLoaded()) {
            return;
        }
        try {
            provider.get();
        } catch (BackendInitException e) {
            LOG.error("Local model could not be loaded at startup: {}", e.getMessage());
        }
    }
}
