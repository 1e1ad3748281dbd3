package com.phillippitts.whisperwriter.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;

/**
 * Voice commands that launch programs, in match-priority order.
 *
 * <pre>
 * commands.launch[0].phrase=wiz open edge
 * commands.launch[0].command=cmd,/c,start,microsoft-edge:
 * </pre>
 *
 * <p>When nothing is configured the single default command opens Microsoft Edge.
 */
@ConfigurationProperties(prefix = "commands")
public class CommandProperties {

    /**
     * @param phrase spoken phrase, matched after sanitizing
     * @param command program and arguments
     */
    public record LaunchCommand(String phrase, List<String> command) {
        public LaunchCommand {
            command = command == null ? List.of() : List.copyOf(command);
        }
    }

    static final LaunchCommand DEFAULT_COMMAND =
            new LaunchCommand("wiz open edge", List.of("cmd", "/c", "start", "microsoft-edge:"));

    private final boolean enabled;
    private final List<LaunchCommand> launch;

    @ConstructorBinding
    public CommandProperties(Boolean enabled, List<LaunchCommand> launch) {
        this.enabled = enabled == null || enabled;
        this.launch = (launch == null || launch.isEmpty()) ? List.of(DEFAULT_COMMAND) : List.copyOf(launch);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<LaunchCommand> getLaunch() {
        return launch;
    }
}
