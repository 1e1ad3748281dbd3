package com.phillippitts.whisperwriter.config.orchestration;

import com.phillippitts.whisperwriter.config.properties.MiscProperties;
import com.phillippitts.whisperwriter.config.properties.PostProcessingProperties;
import com.phillippitts.whisperwriter.config.properties.RecordingProperties;
import com.phillippitts.whisperwriter.service.activation.ActivationController;
import com.phillippitts.whisperwriter.service.audio.capture.AudioSourceFactory;
import com.phillippitts.whisperwriter.service.command.CommandProcessor;
import com.phillippitts.whisperwriter.service.feedback.CompletionChime;
import com.phillippitts.whisperwriter.service.feedback.LoggingStatusDisplay;
import com.phillippitts.whisperwriter.service.feedback.StatusDisplay;
import com.phillippitts.whisperwriter.service.feedback.ToneCompletionChime;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import com.phillippitts.whisperwriter.service.session.DictationPipeline;
import com.phillippitts.whisperwriter.service.session.RecordingSessionFactory;
import com.phillippitts.whisperwriter.service.session.RecordingSettings;
import com.phillippitts.whisperwriter.service.text.TextPostProcessor;
import com.phillippitts.whisperwriter.service.transcription.TranscriptionEngine;
import com.phillippitts.whisperwriter.service.typing.TypingService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the dictation pipeline, the session factory and the activation controller.
 */
@Configuration
public class OrchestrationConfig {

    private final RecordingProperties recordingProperties;
    private final MiscProperties miscProperties;

    public OrchestrationConfig(RecordingProperties recordingProperties, MiscProperties miscProperties) {
        this.recordingProperties = recordingProperties;
        this.miscProperties = miscProperties;
    }

    @Bean
    public DictationPipeline dictationPipeline(TranscriptionEngine engine, CommandProcessor commandProcessor,
                                               TextPostProcessor postProcessor,
                                               PostProcessingProperties postProcessingProperties) {
        return new DictationPipeline(engine, commandProcessor, postProcessor, postProcessingProperties.toOptions());
    }

    @Bean
    public RecordingSessionFactory recordingSessionFactory(AudioSourceFactory sourceFactory,
                                                           DictationPipeline pipeline,
                                                           @Qualifier("sessionExecutor") Executor sessionExecutor,
                                                           DictationMetrics metrics) {
        return new RecordingSessionFactory(recordingProperties.getRecordingMode(), sourceFactory, pipeline,
                sessionExecutor, RecordingSettings.from(recordingProperties), metrics);
    }

    /** Log-backed status; {@code misc.hide-status-window=true} silences it. */
    @Bean
    public StatusDisplay statusDisplay() {
        return miscProperties.isHideStatusWindow() ? StatusDisplay.NONE : new LoggingStatusDisplay();
    }

    @Bean
    public CompletionChime completionChime() {
        return miscProperties.isNoiseOnCompletion() ? new ToneCompletionChime() : CompletionChime.SILENT;
    }

    @Bean
    public ActivationController activationController(RecordingSessionFactory sessionFactory,
                                                     TypingService typingService,
                                                     StatusDisplay statusDisplay,
                                                     CompletionChime completionChime,
                                                     ApplicationEventPublisher publisher) {
        return new ActivationController(sessionFactory, typingService, statusDisplay, completionChime, publisher);
    }
}
