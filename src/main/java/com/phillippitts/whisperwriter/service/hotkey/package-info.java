/**
 * Global activation key capture. {@link com.phillippitts.whisperwriter.service.hotkey.HotkeyManager}
 * turns raw key events into Spring application events consumed by the activation controller.
 */
package com.phillippitts.whisperwriter.service.hotkey;
