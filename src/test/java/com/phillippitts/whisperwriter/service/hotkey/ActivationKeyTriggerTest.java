package com.phillippitts.whisperwriter.service.hotkey;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ActivationKeyTriggerTest {

    private static NormalizedKeyEvent press(String key, String... mods) {
        return new NormalizedKeyEvent(NormalizedKeyEvent.Type.PRESSED, key, Set.of(mods), System.currentTimeMillis());
    }

    private static NormalizedKeyEvent release(String key, String... mods) {
        return new NormalizedKeyEvent(NormalizedKeyEvent.Type.RELEASED, key, Set.of(mods), System.currentTimeMillis());
    }

    @Test
    void singleKeyIgnoresRepeatsAndMatchesRelease() {
        HotkeyTrigger t = new ActivationKeyTrigger(KeyNameMapper.parse("f9"));
        assertThat(t.onKeyPressed(press("F9"))).isTrue();
        assertThat(t.onKeyPressed(press("F9"))).isFalse();
        assertThat(t.onKeyReleased(release("F9"))).isTrue();
        assertThat(t.onKeyReleased(release("F9"))).isFalse();
        assertThat(t.name()).isEqualTo("key:F9");
    }

    @Test
    void combinationRequiresAllModifiers() {
        HotkeyTrigger t = new ActivationKeyTrigger(KeyNameMapper.parse("ctrl+shift+space"));
        assertThat(t.onKeyPressed(press("SPACE", "CONTROL"))).isFalse();
        assertThat(t.onKeyPressed(press("SPACE", "CONTROL", "SHIFT", "ALT"))).isTrue();
    }

    @Test
    void releasingAModifierEndsTheCombination() {
        HotkeyTrigger t = new ActivationKeyTrigger(KeyNameMapper.parse("ctrl+shift+space"));
        t.onKeyPressed(press("SPACE", "CONTROL", "SHIFT"));
        assertThat(t.onKeyReleased(release("A", "CONTROL", "SHIFT"))).isFalse();
        assertThat(t.onKeyReleased(release("SHIFT", "CONTROL"))).isTrue();
        assertThat(t.onKeyReleased(release("SPACE", "CONTROL"))).isFalse();
    }

    @Test
    void releaseWithoutPressIsIgnored() {
        HotkeyTrigger t = new ActivationKeyTrigger(KeyNameMapper.parse("F9"));
        assertThat(t.onKeyReleased(release("F9"))).isFalse();
    }
}
