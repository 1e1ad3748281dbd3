package com.phillippitts.whisperwriter;

import com.phillippitts.whisperwriter.config.properties.CommandProperties;
import com.phillippitts.whisperwriter.config.properties.HotkeyProperties;
import com.phillippitts.whisperwriter.config.properties.MiscProperties;
import com.phillippitts.whisperwriter.config.properties.ModelProperties;
import com.phillippitts.whisperwriter.config.properties.PostProcessingProperties;
import com.phillippitts.whisperwriter.config.properties.RecordingProperties;
import com.phillippitts.whisperwriter.config.properties.TypingProperties;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RecordingProperties.class,
        ModelProperties.class,
        PostProcessingProperties.class,
        MiscProperties.class,
        HotkeyProperties.class,
        CommandProperties.class,
        TypingProperties.class
})
public class WhisperWriterApplication {

    public static void main(String[] args) {
        // Robot and the clipboard need a display
        new SpringApplicationBuilder(WhisperWriterApplication.class)
                .headless(false)
                .run(args);
    }
}
