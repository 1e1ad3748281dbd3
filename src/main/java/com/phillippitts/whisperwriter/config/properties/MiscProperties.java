package com.phillippitts.whisperwriter.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Miscellaneous user-facing switches ({@code misc.*}).
 */
@ConfigurationProperties(prefix = "misc")
public class MiscProperties {

    /** Suppress status reporting entirely. */
    private final boolean hideStatusWindow;

    /** Play a short chime after text is typed. */
    private final boolean noiseOnCompletion;

    @ConstructorBinding
    public MiscProperties(Boolean hideStatusWindow, Boolean noiseOnCompletion) {
        this.hideStatusWindow = hideStatusWindow != null && hideStatusWindow;
        this.noiseOnCompletion = noiseOnCompletion != null && noiseOnCompletion;
    }

    public boolean isHideStatusWindow() {
        return hideStatusWindow;
    }

    public boolean isNoiseOnCompletion() {
        return noiseOnCompletion;
    }
}
