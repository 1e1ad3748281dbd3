package com.phillippitts.whisperwriter.config.command;

import com.phillippitts.whisperwriter.config.properties.CommandProperties;
import com.phillippitts.whisperwriter.service.command.CommandProcessor;
import com.phillippitts.whisperwriter.service.command.CommandRegistry;
import com.phillippitts.whisperwriter.service.command.LaunchProcessCommandHandler;
import com.phillippitts.whisperwriter.service.metrics.DictationMetrics;
import com.phillippitts.whisperwriter.util.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

/**
 * Builds the ordered voice-command registry from {@code commands.launch[*]}. Registration order
 * is match priority.
 */
@Configuration
public class VoiceCommandConfig {

    private static final Logger LOG = LogManager.getLogger(VoiceCommandConfig.class);

    @Bean
    @DependsOn("dictationConfigurationValidator")
    public CommandRegistry commandRegistry(CommandProperties props, ProcessFactory processFactory) {
        return buildRegistry(props, processFactory);
    }

    @Bean
    public CommandProcessor commandProcessor(CommandRegistry registry, DictationMetrics metrics) {
        return new CommandProcessor(registry, metrics);
    }

    static CommandRegistry buildRegistry(CommandProperties props, ProcessFactory processFactory) {
        if (!props.isEnabled()) {
            LOG.info("Voice commands disabled");
            return CommandRegistry.empty();
        }
        CommandRegistry.Builder builder = CommandRegistry.builder();
        for (CommandProperties.LaunchCommand c : props.getLaunch()) {
            builder.register(c.phrase(), new LaunchProcessCommandHandler(c.phrase(), c.command(), processFactory));
        }
        CommandRegistry registry = builder.build();
        LOG.info("Registered {} voice command(s)", registry.size());
        return registry;
    }
}
