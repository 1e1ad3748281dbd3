package com.phillippitts.whisperwriter.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties controlling how text reaches the focused window.
 *
 * <p>Privacy default: the previous clipboard contents are restored after pasting.
 */
@Validated
@ConfigurationProperties(prefix = "typing")
public class TypingProperties {

    /** Enable the Robot paste tier. When false only the clipboard tier runs. */
    private final boolean enableRobot;

    @Min(0)
    @Max(1000)
    private final int focusDelayMs;

    /** Wait before restoring the clipboard so the target app can read it. */
    @Min(0)
    @Max(2000)
    private final int restoreDelayMs;

    private final boolean restoreClipboard;

    /** os-default | META+V | CONTROL+V. */
    private final String pasteShortcut;

    @ConstructorBinding
    public TypingProperties(Boolean enableRobot,
                            Integer focusDelayMs,
                            Integer restoreDelayMs,
                            Boolean restoreClipboard,
                            String pasteShortcut) {
        this.enableRobot = enableRobot == null || enableRobot;
        this.focusDelayMs = focusDelayMs == null ? 50 : focusDelayMs;
        this.restoreDelayMs = restoreDelayMs == null ? 150 : restoreDelayMs;
        this.restoreClipboard = restoreClipboard == null || restoreClipboard;
        this.pasteShortcut = (pasteShortcut == null || pasteShortcut.isBlank()) ? "os-default" : pasteShortcut;
    }

    public boolean isEnableRobot() {
        return enableRobot;
    }

    public int getFocusDelayMs() {
        return focusDelayMs;
    }

    public int getRestoreDelayMs() {
        return restoreDelayMs;
    }

    public boolean isRestoreClipboard() {
        return restoreClipboard;
    }

    public String getPasteShortcut() {
        return pasteShortcut;
    }
}
