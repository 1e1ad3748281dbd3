package com.phillippitts.whisperwriter.config;

import com.phillippitts.whisperwriter.config.properties.CommandProperties;
import com.phillippitts.whisperwriter.config.properties.HotkeyProperties;
import com.phillippitts.whisperwriter.config.properties.ModelProperties;
import com.phillippitts.whisperwriter.exception.ConfigurationException;
import com.phillippitts.whisperwriter.service.hotkey.ActivationKey;
import com.phillippitts.whisperwriter.service.command.TextSanitizer;
import com.phillippitts.whisperwriter.service.hotkey.KeyNameMapper;
import com.phillippitts.whisperwriter.service.transcription.local.WhisperCppModelLoader;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Cross-field checks that Bean Validation cannot express. Runs before the hotkey hook is
 * installed so a bad configuration stops the application before any session can start.
 */
@Component
class DictationConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(DictationConfigurationValidator.class);

    private final HotkeyProperties hotkeyProperties;
    private final ModelProperties modelProperties;
    private final CommandProperties commandProperties;

    DictationConfigurationValidator(HotkeyProperties hotkeyProperties, ModelProperties modelProperties,
                                    CommandProperties commandProperties) {
        this.hotkeyProperties = hotkeyProperties;
        this.modelProperties = modelProperties;
        this.commandProperties = commandProperties;
    }

    @PostConstruct
    void validate() {
        validateKeys();
        if (modelProperties.isUseApi()) {
            validateApi();
        } else {
            validateLocal();
        }
        validateCommands();
    }

    private void validateKeys() {
        ActivationKey activation = parseKey("hotkey.activation-key", hotkeyProperties.getActivationKey());
        ActivationKey cancel = parseKey("hotkey.cancel-key", hotkeyProperties.getCancelKey());
        if (activation.equals(cancel)) {
            throw new ConfigurationException("hotkey.cancel-key",
                    "'" + cancel + "' is already the activation key");
        }
    }

    private static ActivationKey parseKey(String property, String value) {
        try {
            return KeyNameMapper.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(property, e.getMessage()
                    + ". Use modifiers (CONTROL, SHIFT, ALT, META) plus one of A-Z, 0-9, F1..F24 or a named key, "
                    + "e.g. CONTROL+SHIFT+SPACE");
        }
    }

    private void validateLocal() {
        String device = modelProperties.getLocal().device().toLowerCase(Locale.ROOT);
        if (!WhisperCppModelLoader.SUPPORTED_DEVICES.contains(device)) {
            throw new ConfigurationException("model-options.local.device",
                    "'" + device + "' is not one of " + WhisperCppModelLoader.SUPPORTED_DEVICES);
        }
    }

    private void validateApi() {
        String baseUrl = modelProperties.getApi().baseUrl();
        try {
            URI uri = new URI(baseUrl);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigurationException("model-options.api.base-url",
                        "'" + baseUrl + "' must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new ConfigurationException("model-options.api.base-url", "'" + baseUrl + "' is not a valid URL");
        }
        if (modelProperties.getApi().apiKey() == null) {
            LOG.warn("model-options.use-api=true but no API key is set (OPENAI_API_KEY); "
                    + "requests will be sent without authorization");
        }
    }

    private void validateCommands() {
        if (!commandProperties.isEnabled()) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < commandProperties.getLaunch().size(); i++) {
            CommandProperties.LaunchCommand c = commandProperties.getLaunch().get(i);
            String property = "commands.launch[" + i + "]";
            String phrase = TextSanitizer.sanitize(c.phrase());
            if (phrase.isEmpty()) {
                throw new ConfigurationException(property + ".phrase", "must contain at least one word");
            }
            if (!seen.add(phrase)) {
                throw new ConfigurationException(property + ".phrase", "duplicate phrase '" + phrase + "'");
            }
            if (c.command().isEmpty() || c.command().get(0).isBlank()) {
                throw new ConfigurationException(property + ".command", "must name a program to run");
            }
        }
    }
}
