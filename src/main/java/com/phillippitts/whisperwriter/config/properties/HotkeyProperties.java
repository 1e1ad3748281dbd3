package com.phillippitts.whisperwriter.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Global activation and cancel keys.
 *
 * <p>Both are written as modifiers and one primary key joined by {@code +}, case-insensitive, with common
 * aliases accepted: {@code ctrl+shift+space}, {@code META+ALT+D}, {@code F13}. The cancel key
 * aborts a recording and ends continuous dictation.
 */
@Validated
@ConfigurationProperties(prefix = "hotkey")
public class HotkeyProperties {

    @NotBlank
    private final String activationKey;

    @NotBlank
    private final String cancelKey;

    @ConstructorBinding
    public HotkeyProperties(String activationKey, String cancelKey) {
        this.activationKey = (activationKey == null || activationKey.isBlank())
                ? "CONTROL+SHIFT+SPACE"
                : activationKey;
        this.cancelKey = (cancelKey == null || cancelKey.isBlank())
                ? "CONTROL+SHIFT+BACKSPACE"
                : cancelKey;
    }

    public String getActivationKey() {
        return activationKey;
    }

    public String getCancelKey() {
        return cancelKey;
    }
}
