package com.phillippitts.whisperwriter.config.hotkey;

import com.phillippitts.whisperwriter.config.properties.HotkeyProperties;
import com.phillippitts.whisperwriter.service.hotkey.ActivationKeyTrigger;
import com.phillippitts.whisperwriter.service.hotkey.GlobalKeyHook;
import com.phillippitts.whisperwriter.service.hotkey.HotkeyManager;
import com.phillippitts.whisperwriter.service.hotkey.HotkeyTrigger;
import com.phillippitts.whisperwriter.service.hotkey.KeyNameMapper;
import com.phillippitts.whisperwriter.service.hotkey.impl.JNativeHookGlobalKeyHook;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

/**
 * Global key hook plus the triggers parsed from {@code hotkey.activation-key} and
 * {@code hotkey.cancel-key}.
 */
@Configuration
public class HotkeyConfig {

    @Bean
    public GlobalKeyHook globalKeyHook() {
        return new JNativeHookGlobalKeyHook();
    }

    @Bean
    @DependsOn("dictationConfigurationValidator")
    public HotkeyTrigger hotkeyTrigger(HotkeyProperties props) {
        return new ActivationKeyTrigger(KeyNameMapper.parse(props.getActivationKey()));
    }

    @Bean
    @DependsOn("dictationConfigurationValidator")
    public HotkeyTrigger cancelTrigger(HotkeyProperties props) {
        return new ActivationKeyTrigger(KeyNameMapper.parse(props.getCancelKey()));
    }

    @Bean
    public HotkeyManager hotkeyManager(GlobalKeyHook hook,
                                       @Qualifier("hotkeyTrigger") HotkeyTrigger hotkeyTrigger,
                                       @Qualifier("cancelTrigger") HotkeyTrigger cancelTrigger,
                                       ApplicationEventPublisher publisher) {
        return new HotkeyManager(hook, hotkeyTrigger, cancelTrigger, publisher);
    }
}
