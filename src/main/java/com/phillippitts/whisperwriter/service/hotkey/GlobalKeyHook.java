package com.phillippitts.whisperwriter.service.hotkey;

import java.util.function.Consumer;

/**
 * System-wide keyboard hook. Test seam: unit tests inject a fake and emit
 * {@link NormalizedKeyEvent}s directly.
 */
public interface GlobalKeyHook {

    /**
     * Installs the hook. Idempotent.
     *
     * @throws SecurityException when the OS refuses (e.g. missing accessibility permission)
     */
    void register();

    /** Removes the hook. Idempotent. */
    void unregister();

    void addListener(Consumer<NormalizedKeyEvent> listener);
}
