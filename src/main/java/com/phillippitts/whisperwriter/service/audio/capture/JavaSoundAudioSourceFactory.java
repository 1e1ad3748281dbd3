package com.phillippitts.whisperwriter.service.audio.capture;

import com.phillippitts.whisperwriter.config.properties.RecordingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces {@link JavaSoundAudioSource}s configured from {@code recording-options.*}.
 * Test configurations replace this bean with a fake factory.
 */
@Component
public class JavaSoundAudioSourceFactory implements AudioSourceFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioSourceFactory.class);

    private final RecordingProperties props;
    private final ApplicationEventPublisher publisher;
    private final JavaSoundAudioSource.DataLineProvider provider;

    @Autowired
    public JavaSoundAudioSourceFactory(RecordingProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, JavaSoundAudioSourceFactory::openLine);
    }

    JavaSoundAudioSourceFactory(RecordingProperties props, ApplicationEventPublisher publisher,
                                JavaSoundAudioSource.DataLineProvider provider) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    @PostConstruct
    void logSystemInfo() {
        LOG.info("Audio capture: device='{}', rate={}Hz, chunk={}ms, available-mixers={}",
                props.getSoundDevice() == null ? "default" : props.getSoundDevice(),
                props.getSampleRate(), props.getChunkMillis(), AudioSystem.getMixerInfo().length);
    }

    @Override
    public AudioSource create() {
        return new JavaSoundAudioSource(provider, props.getSampleRate(),
                Optional.ofNullable(props.getSoundDevice()), props.getChunkMillis(), publisher);
    }

    private static TargetDataLine openLine(javax.sound.sampled.AudioFormat format, Optional<String> device)
            throws javax.sound.sampled.LineUnavailableException {
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
        TargetDataLine line = null;
        if (device.isPresent()) {
            for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
                if (mixerInfo.getName().equalsIgnoreCase(device.get())) {
                    line = (TargetDataLine) AudioSystem.getMixer(mixerInfo).getLine(info);
                    break;
                }
            }
            if (line == null) {
                LOG.warn("Sound device '{}' not found; using system default", device.get());
            }
        }
        if (line == null) {
            line = (TargetDataLine) AudioSystem.getLine(info);
        }
        line.open(format);
        return line;
    }
}
